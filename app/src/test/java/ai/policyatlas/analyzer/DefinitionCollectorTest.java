package ai.policyatlas.analyzer;

import static ai.policyatlas.testutil.TemplateFixtures.admx;
import static ai.policyatlas.testutil.TemplateFixtures.using;
import static ai.policyatlas.testutil.TemplateFixtures.write;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.policyatlas.diagnostics.DiagnosticKind;
import ai.policyatlas.diagnostics.DiagnosticLog;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class DefinitionCollectorTest {
    @TempDir
    Path root;

    private DiagnosticLog diagnostics;

    @BeforeEach
    public void setUp() {
        diagnostics = new DiagnosticLog();
    }

    private CollectedDefinitions collect() {
        var tree = new SourceTree(root, "admx", "adml");
        return new DefinitionCollector(diagnostics).collect(tree.definitionFiles());
    }

    @Test
    public void sameNameInTwoNamespacesStaysDistinct() throws IOException {
        write(root, "a.admx", admx("a", "nsA", "", "<categories><category name=\"System\"/></categories>"));
        write(root, "b.admx", admx("b", "nsB", "", "<categories><category name=\"System\"/></categories>"));

        var collected = collect();

        assertEquals(Set.of("nsA::System", "nsB::System"), collected.categories().keySet());
        assertTrue(diagnostics.ofKind(DiagnosticKind.DUPLICATE_IDENTIFIER).isEmpty());
    }

    @Test
    public void laterFileWinsForCategoriesAndPolicies() throws IOException {
        write(
                root,
                "a.admx",
                admx(
                        "a",
                        "ns",
                        "",
                        """
                        <categories><category name="Cat" displayName="$(string.First)"/></categories>
                        <policies><policy name="P" class="User" key="K"/></policies>
                        """));
        write(
                root,
                "b.admx",
                admx(
                        "b",
                        "ns",
                        "",
                        """
                        <categories><category name="Cat" displayName="$(string.Second)"/></categories>
                        <policies><policy name="P" class="Machine" key="K"/></policies>
                        """));

        var collected = collect();

        assertEquals("$(string.Second)", collected.categories().get("ns::Cat").displayNameToken());
        assertEquals(PolicyClass.MACHINE, collected.policies().get("ns::P").policyClass());
        assertEquals("b.admx", collected.policies().get("ns::P").source().displayPath());
        assertEquals(2, diagnostics.ofKind(DiagnosticKind.DUPLICATE_IDENTIFIER).size());
    }

    @Test
    public void firstSupportedOnDefinitionWins() throws IOException {
        var first = "<supportedOn><definitions><definition name=\"SUPPORTED_X\" displayName=\"$(string.X1)\"/>"
                + "</definitions></supportedOn>";
        var second = "<supportedOn><definitions><definition name=\"SUPPORTED_X\" displayName=\"$(string.X2)\"/>"
                + "</definitions></supportedOn>";
        write(root, "a.admx", admx("a", "nsA", "", first));
        write(root, "b.admx", admx("b", "nsB", "", second));

        var collected = collect();

        assertEquals("$(string.X1)", collected.supportedOn().get("SUPPORTED_X").displayNameToken());
        assertEquals(1, diagnostics.ofKind(DiagnosticKind.DUPLICATE_IDENTIFIER).size());
    }

    @Test
    public void brokenFilesAreSkippedAndReported() throws IOException {
        write(root, "good.admx", admx("g", "nsG", "", "<categories><category name=\"Ok\"/></categories>"));
        write(root, "broken.admx", "<policyDefinitions><unclosed></policyDefinitions>");
        write(
                root,
                "notarget.admx",
                "<policyDefinitions><policyNamespaces/><categories><category name=\"Lost\"/></categories>"
                        + "</policyDefinitions>");

        var collected = collect();

        assertEquals(Set.of("nsG::Ok"), collected.categories().keySet());
        assertEquals(2, diagnostics.ofKind(DiagnosticKind.SOURCE_FILE_ERROR).size());
        assertEquals(1, collected.sourceFiles().size());
    }

    @Test
    public void recordsPolicyDetails() throws IOException {
        write(
                root,
                "vendor/Inet.admx",
                admx(
                        "inet",
                        "Vendor.Inet",
                        using("windows", "Microsoft.Policies.Windows"),
                        """
                        <categories>
                          <category name="Browser" displayName="$(string.Browser)">
                            <parentCategory ref="windows:WindowsComponents"/>
                          </category>
                        </categories>
                        <policies>
                          <policy name="Home" class="bogus" displayName="$(string.Home)" key="K"
                                  presentation="$(presentation.Home)">
                            <parentCategory ref="Browser"/>
                            <supportedOn ref="windows:SUPPORTED_Win7"/>
                          </policy>
                          <policy class="User" key="K"/>
                        </policies>
                        """));

        var collected = collect();

        var category = collected.categories().get("Vendor.Inet::Browser");
        assertEquals("windows:WindowsComponents", category.parentRefRaw());
        assertEquals("Microsoft.Policies.Windows::WindowsComponents", category.parentRefUniqueId());

        var policy = collected.policies().get("Vendor.Inet::Home");
        assertEquals(PolicyClass.BOTH, policy.policyClass(), "invalid class falls back to Both");
        assertEquals("Vendor.Inet::Home", policy.presentationKey());
        assertEquals("windows:SUPPORTED_Win7", policy.supportedOnRef());
        assertEquals("Browser", policy.parentCategoryRefRaw());
        assertEquals("vendor/Inet.admx", policy.source().displayPath());

        assertEquals(1, collected.policies().size(), "nameless policy skipped");
        assertEquals(1, diagnostics.ofKind(DiagnosticKind.MISSING_IDENTIFIER).size());
        assertEquals(1, diagnostics.ofKind(DiagnosticKind.STRUCTURAL_AMBIGUITY).size());
        assertEquals("Vendor.Inet", collected.namespaceByBaseName().get("inet"));
    }
}

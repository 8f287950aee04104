package ai.policyatlas;

import static ai.policyatlas.testutil.TemplateFixtures.adml;
import static ai.policyatlas.testutil.TemplateFixtures.admx;
import static ai.policyatlas.testutil.TemplateFixtures.string;
import static ai.policyatlas.testutil.TemplateFixtures.switchPolicy;
import static ai.policyatlas.testutil.TemplateFixtures.write;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.policyatlas.diagnostics.DiagnosticKind;
import ai.policyatlas.exception.NoSourceFilesException;
import ai.policyatlas.util.Json;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class PolicyAtlasTest {
    @TempDir
    Path source;

    @TempDir
    Path out;

    private void writeTemplates() throws IOException {
        write(
                source,
                "sample.admx",
                admx(
                        "sample",
                        "Sample.Policies",
                        "",
                        """
                        <categories><category name="Main" displayName="$(string.Main)"/></categories>
                        <policies>
                        %s
                        </policies>
                        """
                                .formatted(switchPolicy("Foo", "Main", "Foo", 1, 0))));
        write(source, "en-US/sample.adml", adml(string("Main", "Main settings") + string("Foo", "Foo"), ""));
        write(source, "de-DE/sample.adml", adml(string("Main", "Haupteinstellungen"), ""));
    }

    private static AtlasSettings settings(String... languages) {
        return AtlasSettings.defaults().withLanguages(List.of(languages));
    }

    @Test
    public void writesOneFilePerLanguage() throws IOException {
        writeTemplates();

        var report = new PolicyAtlas(settings("en-US", "de-DE")).run(source, out);

        assertTrue(report.allLanguagesWritten(), () -> report.toString());
        assertEquals(out.resolve("data_en_US.json"), report.written().get("en-US"));
        var german = Json.readTree(Files.readString(out.resolve("data_de_DE.json")));
        assertEquals("de-DE", german.get("language").asText());
        assertEquals("Haupteinstellungen", german.get("allCategories").get(1).get("displayName").asText());
        assertEquals(1, report.metrics().policies());
    }

    @Test
    public void languageWithoutResourcesIsSkippedAndOthersComplete() throws IOException {
        writeTemplates();

        var atlas = new PolicyAtlas(settings("en-US", "fr-FR"));
        var report = atlas.run(source, out);

        assertEquals(List.of("fr-FR"), report.skipped());
        assertTrue(Files.exists(out.resolve("data_en_US.json")));
        assertFalse(Files.exists(out.resolve("data_fr_FR.json")));
        assertEquals(1, atlas.diagnostics().ofKind(DiagnosticKind.MISSING_LANGUAGE_RESOURCES).size());
    }

    @Test
    public void languageDirectoryMatchIgnoresCase() throws IOException {
        writeTemplates();
        write(source, "fr-fr/sample.adml", adml(string("Main", "Principal"), ""));

        var report = new PolicyAtlas(settings("fr-FR")).run(source, out);

        assertTrue(report.written().containsKey("fr-FR"));
    }

    @Test
    public void emptySourceRootIsFatal() {
        var atlas = new PolicyAtlas(settings("en-US"));
        assertThrows(NoSourceFilesException.class, () -> atlas.run(source, out));
    }

    @Test
    public void tooDeepOutputFailsOnlyThatLanguage() throws IOException {
        writeTemplates();

        var report = new PolicyAtlas(settings("en-US").withMaxDepth(2)).run(source, out);

        assertTrue(report.failed().containsKey("en-US"));
        assertTrue(report.written().isEmpty());
    }
}

package ai.policyatlas.projection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.policyatlas.analyzer.PolicyClass;
import ai.policyatlas.analyzer.RegistryInfo;
import ai.policyatlas.analyzer.RegistryOption;
import ai.policyatlas.analyzer.RegistryValueType;
import ai.policyatlas.util.Json;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class RecordSetWriterTest {
    @TempDir
    Path out;

    private static LanguageRecordSet sample(String language) {
        var registry = new RegistryInfo(
                "Software\\Test",
                "Foo",
                RegistryValueType.REG_DWORD,
                1L,
                0L,
                List.of(new RegistryOption(1L, "Enabled"), new RegistryOption(0L, "Disabled")),
                List.of());
        var orphan = new PolicyRecord(
                "ns::Orphan",
                "Orphan",
                PolicyClass.USER,
                "Orphan",
                "no description",
                "not specified",
                null,
                registry,
                null,
                "test.admx");
        return new LanguageRecordSet(
                language, List.of(CategoryRecord.root(List.of())), List.of(orphan));
    }

    @Test
    public void fileNameReplacesDashesInTheLanguage() {
        var writer = new RecordSetWriter(out, "data_", 64);
        assertEquals(out.resolve("data_en_US.json"), writer.fileFor("en-US"));
        assertEquals(out.resolve("data_de.json"), writer.fileFor("de"));
    }

    @Test
    public void writesTheConsumerShape() throws IOException {
        var file = new RecordSetWriter(out.resolve("nested"), "data_", 64).write(sample("en-US"));

        var json = Json.readTree(Files.readString(file));
        assertEquals("en-US", json.get("language").asText());

        var root = json.get("allCategories").get(0);
        assertEquals("ROOT", root.get("id").asText());
        assertTrue(root.has("parent") && root.get("parent").isNull(), "parent is written as null");

        var policy = json.get("allPolicies").get(0);
        assertEquals("User", policy.get("class").asText());
        assertTrue(policy.has("categoryId") && policy.get("categoryId").isNull(), "categoryId is written as null");
        assertFalse(policy.has("presentation"), "absent presentation is omitted");
        assertFalse(policy.has("policyClass"));
        assertEquals("REG_DWORD", policy.get("registry").get("type").asText());
        assertEquals(1, policy.get("registry").get("options").get(0).get("value").asInt());
        assertFalse(policy.get("registry").get("options").get(0).has("fallback"));
        assertFalse(policy.get("registry").has("elements"), "empty element list is omitted");
        assertEquals("test.admx", policy.get("admxFile").asText());
    }

    @Test
    public void tooDeepRecordSetIsNotWritten() {
        var writer = new RecordSetWriter(out, "data_", 3);
        assertThrows(IOException.class, () -> writer.write(sample("en-US")));
        assertFalse(Files.exists(writer.fileFor("en-US")));
    }
}

package ai.policyatlas;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class AtlasSettingsTest {
    @TempDir
    Path dir;

    @Test
    public void bundledDefaults() {
        var settings = AtlasSettings.defaults();
        assertEquals(List.of("en-US"), settings.languages());
        assertEquals("data_", settings.filePrefix());
        assertEquals(64, settings.maxDepth());
        assertEquals("admx", settings.definitionExtension());
        assertEquals("adml", settings.resourceExtension());
    }

    @Test
    public void configFileOverridesOnlyWhatItNames() throws IOException {
        var config = dir.resolve("atlas.properties");
        Files.writeString(config, "languages = en-US, de-DE ,,ja-JP\noutput.filePrefix=policies_\n");

        var settings = AtlasSettings.load(config);

        assertEquals(List.of("en-US", "de-DE", "ja-JP"), settings.languages());
        assertEquals("policies_", settings.filePrefix());
        assertEquals(64, settings.maxDepth());
    }

    @Test
    public void invalidMaxDepthIsRejected() throws IOException {
        var config = dir.resolve("bad.properties");
        Files.writeString(config, "serialization.maxDepth=deep\n");
        var settings = AtlasSettings.load(config);
        assertThrows(IllegalArgumentException.class, settings::maxDepth);
        assertThrows(IllegalArgumentException.class, () -> AtlasSettings.defaults().withMaxDepth(0).maxDepth());
    }

    @Test
    public void missingConfigFileFails() {
        assertThrows(IOException.class, () -> AtlasSettings.load(dir.resolve("absent.properties")));
    }
}

package ai.policyatlas;

import ai.policyatlas.util.Json;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Run settings. Defaults come from the bundled {@code policy-atlas.properties}; a user properties file may override any
 * of them, and command-line options override both.
 */
public final class AtlasSettings {
    private static final Logger logger = LogManager.getLogger(AtlasSettings.class);

    static final String DEFAULTS_RESOURCE = "/policy-atlas.properties";

    static final String KEY_LANGUAGES = "languages";
    static final String KEY_FILE_PREFIX = "output.filePrefix";
    static final String KEY_MAX_DEPTH = "serialization.maxDepth";
    static final String KEY_DEFINITION_EXTENSION = "source.definitionExtension";
    static final String KEY_RESOURCE_EXTENSION = "source.resourceExtension";

    private final Properties props;

    private AtlasSettings(Properties props) {
        this.props = props;
    }

    /** The bundled defaults only. */
    public static AtlasSettings defaults() {
        var props = new Properties();
        try (var in = AtlasSettings.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled resource " + DEFAULTS_RESOURCE);
            }
            props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
        return new AtlasSettings(props);
    }

    /** The bundled defaults overlaid with {@code configFile}, if given. */
    public static AtlasSettings load(@Nullable Path configFile) throws IOException {
        var settings = defaults();
        if (configFile == null) {
            return settings;
        }
        var overlay = new Properties();
        try (var reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            overlay.load(reader);
        }
        overlay.stringPropertyNames().forEach(key -> settings.props.setProperty(key, overlay.getProperty(key)));
        logger.debug("Loaded {} settings from {}", overlay.size(), configFile);
        return settings;
    }

    public List<String> languages() {
        return Splitter.on(',').trimResults().omitEmptyStrings().splitToList(props.getProperty(KEY_LANGUAGES, ""));
    }

    public AtlasSettings withLanguages(List<String> languages) {
        props.setProperty(KEY_LANGUAGES, String.join(",", languages));
        return this;
    }

    public String filePrefix() {
        return props.getProperty(KEY_FILE_PREFIX, "data_");
    }

    public int maxDepth() {
        var raw = props.getProperty(KEY_MAX_DEPTH);
        if (raw == null || raw.isBlank()) {
            return Json.DEFAULT_MAX_DEPTH;
        }
        try {
            int depth = Integer.parseInt(raw.trim());
            if (depth < 1) {
                throw new IllegalArgumentException(KEY_MAX_DEPTH + " must be positive, got " + raw);
            }
            return depth;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(KEY_MAX_DEPTH + " is not a number: " + raw, e);
        }
    }

    public AtlasSettings withMaxDepth(int maxDepth) {
        props.setProperty(KEY_MAX_DEPTH, Integer.toString(maxDepth));
        return this;
    }

    public String definitionExtension() {
        return props.getProperty(KEY_DEFINITION_EXTENSION, "admx");
    }

    public String resourceExtension() {
        return props.getProperty(KEY_RESOURCE_EXTENSION, "adml");
    }
}

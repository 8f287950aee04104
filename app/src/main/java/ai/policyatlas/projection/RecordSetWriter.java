package ai.policyatlas.projection;

import ai.policyatlas.util.AtomicWrites;
import ai.policyatlas.util.Json;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Writes one {@link LanguageRecordSet} per file, named {@code <prefix><language>.json} with '-' replaced by '_'. */
public final class RecordSetWriter {
    private static final Logger logger = LogManager.getLogger(RecordSetWriter.class);

    private final Path outputDir;
    private final String filePrefix;
    private final ObjectMapper mapper;

    public RecordSetWriter(Path outputDir, String filePrefix, int maxDepth) {
        this.outputDir = outputDir;
        this.filePrefix = filePrefix;
        this.mapper = Json.createMapper(maxDepth);
    }

    public Path fileFor(String language) {
        return outputDir.resolve(filePrefix + language.replace('-', '_') + ".json");
    }

    /**
     * Serializes the record set and replaces the language's file. Nothing is written if serialization fails, including
     * when the records nest deeper than the configured limit.
     */
    public Path write(LanguageRecordSet records) throws IOException {
        var json = mapper.writeValueAsString(records);
        var target = fileFor(records.language());
        AtomicWrites.atomicOverwrite(target, json);
        logger.info("Wrote {} ({} characters)", target, json.length());
        return target;
    }
}

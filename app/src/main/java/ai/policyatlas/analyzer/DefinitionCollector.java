package ai.policyatlas.analyzer;

import ai.policyatlas.diagnostics.DiagnosticKind;
import ai.policyatlas.diagnostics.DiagnosticLog;
import ai.policyatlas.exception.SourceFileException;
import java.util.ArrayList;
import java.util.Collection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads every definition file once and merges what they declare. A file that fails to parse is reported and skipped;
 * the others are still collected.
 */
public final class DefinitionCollector {
    private static final Logger logger = LogManager.getLogger(DefinitionCollector.class);

    private final DiagnosticLog diagnostics;
    private final AdmxFileParser parser;

    public DefinitionCollector(DiagnosticLog diagnostics) {
        this.diagnostics = diagnostics;
        this.parser = new AdmxFileParser(diagnostics);
    }

    public CollectedDefinitions collect(Collection<SourceFile> files) {
        var perFile = new ArrayList<FileDefinitions>();
        for (var file : files) {
            try {
                perFile.add(parser.parse(file));
            } catch (SourceFileException e) {
                logger.debug("Skipping {}", file, e);
                diagnostics.report(DiagnosticKind.SOURCE_FILE_ERROR, file.displayPath(), e.getMessage());
            }
        }

        var collected = DefinitionMerger.merge(perFile, diagnostics);
        logger.info(
                "Collected {} categories, {} policies, {} supportedOn definitions from {} of {} files",
                collected.categories().size(),
                collected.policies().size(),
                collected.supportedOn().size(),
                perFile.size(),
                files.size());
        return collected;
    }
}

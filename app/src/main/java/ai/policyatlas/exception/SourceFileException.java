package ai.policyatlas.exception;

import ai.policyatlas.analyzer.SourceFile;

/** A template file could not be read or parsed, or lacks the sections needed to place its definitions. */
public class SourceFileException extends RuntimeException {
    public SourceFileException(SourceFile source, String message) {
        super(source + ": " + message);
    }

    public SourceFileException(SourceFile source, String message, Throwable cause) {
        super(source + ": " + message, cause);
    }
}

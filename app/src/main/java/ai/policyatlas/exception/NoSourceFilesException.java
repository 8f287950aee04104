package ai.policyatlas.exception;

import java.nio.file.Path;

public final class NoSourceFilesException extends RuntimeException {
    public NoSourceFilesException(Path sourceRoot, String extension) {
        super("No ." + extension + " files found under " + sourceRoot);
    }
}

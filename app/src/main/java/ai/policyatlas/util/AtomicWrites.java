package ai.policyatlas.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public class AtomicWrites {
    private AtomicWrites() {}

    /**
     * Overwrites the content of a file with the provided text, creating missing parent directories.
     *
     * <p>The text goes to a temporary file in the target's directory first, which is then moved over the target, so a
     * reader never sees a half-written file. Falls back to a plain move where the filesystem has no atomic move.
     *
     * @throws IOException if an I/O error occurs during writing or moving the file.
     */
    public static void atomicOverwrite(Path targetPath, String content) throws IOException {
        var parent = targetPath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tempFile = Files.createTempFile(parent, "temp-", ".tmp");

        try {
            Files.write(tempFile, content.getBytes(StandardCharsets.UTF_8));

            try {
                Files.move(
                        tempFile, targetPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
    }
}

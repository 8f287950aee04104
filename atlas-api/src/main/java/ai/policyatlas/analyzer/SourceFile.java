package ai.policyatlas.analyzer;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Abstraction for a template filename relative to the source root. This exists so that definitions from different
 * files can be compared and reported consistently, unlike bare Paths which may or may not be absolute.
 */
public class SourceFile implements AtlasFile {
    private final Path root;
    private final Path relPath;

    /** root must be pre-normalized; we will normalize relPath if it is not already */
    public SourceFile(Path root, Path relPath) {
        if (!root.isAbsolute()) {
            throw new IllegalArgumentException("Root must be absolute, got " + root);
        }
        if (!root.equals(root.normalize())) {
            throw new IllegalArgumentException("Root must be normalized, got " + root);
        }
        if (relPath.isAbsolute()) {
            throw new IllegalArgumentException("RelPath must be relative, got " + relPath);
        }

        this.root = root;
        this.relPath = relPath.normalize();
    }

    public SourceFile(Path root, String relName) {
        this(root, Path.of(relName));
    }

    /** Builds a SourceFile for an absolute path that lives beneath {@code root}. */
    public static SourceFile under(Path root, Path absPath) {
        var normalizedRoot = root.toAbsolutePath().normalize();
        return new SourceFile(normalizedRoot, normalizedRoot.relativize(absPath.toAbsolutePath().normalize()));
    }

    public Path getRelPath() {
        return relPath;
    }

    @Override
    public Path absPath() {
        return root.resolve(relPath);
    }

    /** Also relative (but unlike raw Path.getParent, ours returns empty path instead of null) */
    public Path getParent() {
        var p = relPath.getParent();
        return p == null ? Path.of("") : p;
    }

    /** The relative path with forward slashes, as shown to consumers of the generated data. */
    public String displayPath() {
        return relPath.toString().replace('\\', '/');
    }

    @Override
    public String toString() {
        return relPath.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceFile sourceFile)) return false;
        return Objects.equals(root, sourceFile.root) && Objects.equals(relPath, sourceFile.relPath);
    }

    @Override
    public int hashCode() {
        return relPath.hashCode();
    }
}

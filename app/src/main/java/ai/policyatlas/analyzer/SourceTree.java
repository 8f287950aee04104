package ai.policyatlas.analyzer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A vendor template tree: definition files anywhere below the root, and one directory per language (e.g.
 * {@code en-US/}) holding that language's resource files.
 */
public final class SourceTree {
    private static final Logger logger = LogManager.getLogger(SourceTree.class);

    private final Path root;
    private final String definitionExtension;
    private final String resourceExtension;

    public SourceTree(Path root, String definitionExtension, String resourceExtension) {
        this.root = root.toAbsolutePath().normalize();
        this.definitionExtension = definitionExtension.toLowerCase(Locale.ROOT);
        this.resourceExtension = resourceExtension.toLowerCase(Locale.ROOT);
    }

    public Path getRoot() {
        return root;
    }

    public String definitionExtension() {
        return definitionExtension;
    }

    /** All definition files below the root, sorted by relative path. */
    public List<SourceFile> definitionFiles() {
        if (!Files.isDirectory(root)) {
            logger.warn("Source root {} is not a directory", root);
            return List.of();
        }
        return listFiles(root, Integer.MAX_VALUE, definitionExtension);
    }

    /**
     * The directory holding resources for {@code language}. Vendors ship both {@code en-US} and {@code en-us}, so the
     * match ignores case.
     */
    public Optional<Path> languageDirectory(String language) {
        if (!Files.isDirectory(root)) {
            return Optional.empty();
        }
        try (Stream<Path> entries = Files.list(root)) {
            return entries.filter(Files::isDirectory)
                    .filter(p -> p.getFileName().toString().equalsIgnoreCase(language))
                    .sorted()
                    .findFirst();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Resource files directly inside the language's directory, sorted by name; empty if there are none. */
    public List<SourceFile> resourceFiles(String language) {
        return languageDirectory(language)
                .map(dir -> listFiles(dir, 1, resourceExtension))
                .orElse(List.of());
    }

    private List<SourceFile> listFiles(Path dir, int depth, String extension) {
        try (Stream<Path> walk = Files.walk(dir, depth)) {
            return walk.filter(Files::isRegularFile)
                    .map(p -> SourceFile.under(root, p))
                    .filter(sf -> sf.extension().equals(extension))
                    .sorted(Comparator.comparing(SourceFile::displayPath))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

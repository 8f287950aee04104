package ai.policyatlas.analyzer;

import java.nio.file.Path;
import java.util.Locale;

public interface AtlasFile {
    Path absPath();

    /** Just the filename, no path at all */
    default String getFileName() {
        return absPath().getFileName().toString();
    }

    /**
     * The filename without its extension, lowercased. ADMX and ADML files that belong together share a base name, but
     * vendors are not consistent about its case.
     */
    default String baseName() {
        var filename = getFileName();
        int lastDot = filename.lastIndexOf('.');
        var stem = lastDot > 0 ? filename.substring(0, lastDot) : filename;
        return stem.toLowerCase(Locale.ROOT);
    }

    @Override
    String toString();

    /** return the (lowercased) extension [not including the dot] */
    default String extension() {
        var filename = getFileName();
        int lastDot = filename.lastIndexOf('.');
        // Ensure dot is not the first character and is not the last character
        if (lastDot > 0 && lastDot < filename.length() - 1) {
            return filename.substring(lastDot + 1).toLowerCase(Locale.ROOT);
        }
        return "";
    }
}

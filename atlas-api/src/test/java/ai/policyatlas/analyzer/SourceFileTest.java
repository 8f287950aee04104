package ai.policyatlas.analyzer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class SourceFileTest {
    @TempDir
    Path root;

    @Test
    public void underRelativizesAgainstRoot() {
        var file = SourceFile.under(root, root.resolve("vendor").resolve("Office.ADMX"));

        assertEquals(Path.of("vendor", "Office.ADMX"), file.getRelPath());
        assertEquals("vendor/Office.ADMX", file.displayPath());
        assertEquals("Office.ADMX", file.getFileName());
        assertEquals("office", file.baseName(), "base name is lowercased and has no extension");
        assertEquals("admx", file.extension(), "extension is lowercased");
        assertEquals(Path.of("vendor"), file.getParent());
    }

    @Test
    public void parentOfTopLevelFileIsEmptyPath() {
        var file = new SourceFile(root.toAbsolutePath().normalize(), "windows.admx");
        assertEquals(Path.of(""), file.getParent());
    }

    @Test
    public void rejectsRelativeRootAndAbsoluteRelPath() {
        assertThrows(IllegalArgumentException.class, () -> new SourceFile(Path.of("relative"), "a.admx"));
        var absRoot = root.toAbsolutePath().normalize();
        assertThrows(IllegalArgumentException.class, () -> new SourceFile(absRoot, absRoot.resolve("a.admx")));
    }

    @Test
    public void equalityUsesRootAndNormalizedPath() {
        var absRoot = root.toAbsolutePath().normalize();
        var a = new SourceFile(absRoot, "x/../a.admx");
        var b = new SourceFile(absRoot, "a.admx");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new SourceFile(absRoot, "b.admx"));
    }
}

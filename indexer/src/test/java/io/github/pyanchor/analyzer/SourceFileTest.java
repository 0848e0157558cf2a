package io.github.pyanchor.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public final class SourceFileTest {
    private static final Path ROOT = Path.of("/src/project");

    @Test
    void testModulePathForPlainModule() {
        assertEquals("pkg.mod", SourceFile.modulePathFor(ROOT, ROOT.resolve("pkg/mod.py")));
        assertEquals("top", SourceFile.modulePathFor(ROOT, ROOT.resolve("top.py")));
    }

    @Test
    void testModulePathForPackageInit() {
        assertEquals("pkg", SourceFile.modulePathFor(ROOT, ROOT.resolve("pkg/__init__.py")));
        assertEquals("pkg.sub", SourceFile.modulePathFor(ROOT, ROOT.resolve("pkg/sub/__init__.py")));
    }

    @Test
    void testModulePathRejectsNonPythonAndOutsideFiles() {
        assertThrows(IllegalArgumentException.class, () -> SourceFile.modulePathFor(ROOT, ROOT.resolve("README.md")));
        assertThrows(IllegalArgumentException.class, () -> SourceFile.modulePathFor(ROOT, Path.of("/elsewhere/x.py")));
        assertThrows(
                IllegalArgumentException.class, () -> SourceFile.modulePathFor(ROOT, ROOT.resolve("my-pkg/mod.py")));
    }

    @Test
    void testReadKeepsRawBytes(@TempDir Path root) throws IOException {
        var file = root.resolve("a/b.py");
        Files.createDirectories(file.getParent());
        byte[] bytes = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'x', '=', '1'};
        Files.write(file, bytes);

        var source = SourceFile.read(root, file);
        assertEquals("a/b.py", source.path());
        assertEquals("a.b", source.modulePath());
        assertArrayEquals(bytes, source.content());
    }

    @Test
    void testContentIsDefensivelyCopied() {
        byte[] bytes = {'p', 'a', 's', 's'};
        var source = new SourceFile("m.py", "m", bytes);
        bytes[0] = 'X';
        assertEquals('p', source.content()[0]);
        assertEquals(source, new SourceFile("m.py", "m", new byte[] {'p', 'a', 's', 's'}));
    }

    @Test
    void testEmptyModulePathRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SourceFile("m.py", "", new byte[0]));
    }
}

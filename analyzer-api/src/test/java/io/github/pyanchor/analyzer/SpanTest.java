package io.github.pyanchor.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

public final class SpanTest {

    @Test
    void testRejectsInvertedRanges() {
        assertThrows(IllegalArgumentException.class, () -> new Span(5, 4, ""));
        assertThrows(IllegalArgumentException.class, () -> new Span(-1, 0, ""));
    }

    @Test
    void testContainmentAndOrder() {
        var outer = new Span(0, 10, "0123456789");
        var inner = new Span(2, 4, "23");
        assertTrue(outer.contains(inner));
        assertFalse(inner.contains(outer));
        assertTrue(inner.compareTo(outer) > 0);
        assertTrue(new Span(3, 3, "").isEmpty());
        assertEquals(2, inner.length());
    }

    @Test
    void testAnchorRequiresFqn() {
        var span = new Span(0, 1, "x");
        assertThrows(IllegalArgumentException.class, () -> new Anchor(span, "", AnchorKind.REFERENCE));
        assertEquals(1, new Anchor(span, "m.x", AnchorKind.BINDING_DEF).end());
    }

    @Test
    void testManifestCopiesContent() {
        byte[] bytes = "x = 1\n".getBytes(StandardCharsets.UTF_8);
        var manifest = FileManifest.python("c", "r", "x.py", bytes);
        bytes[0] = 'y';
        assertEquals('x', manifest.content()[0]);
        assertEquals(manifest, FileManifest.python("c", "r", "x.py", "x = 1\n".getBytes(StandardCharsets.UTF_8)));
        assertEquals("utf-8", manifest.encoding());
    }
}

package io.github.pyanchor.analyzer.fqn;

import static org.junit.jupiter.api.Assertions.*;

import io.github.pyanchor.analyzer.cooked.ScopeKind;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public final class ScopeChainTest {

    @Test
    void testPushSeedsFrameInOrder() {
        var chain = ScopeChain.empty().push(ScopeKind.MODULE, "m.", List.of("b", "a"));
        assertEquals(1, chain.depth());
        assertEquals(List.of("b", "a"), chain.innermost().names());
        assertEquals(Optional.of("m.a"), chain.lookup("a"));
        assertEquals(Optional.empty(), chain.lookup("c"));
    }

    @Test
    void testInnerFramesShadowOuter() {
        var chain = ScopeChain.empty()
                .push(ScopeKind.MODULE, "m.", List.of("x", "y"))
                .push(ScopeKind.FUNCTION, "m.f.<local>.", List.of("x"));
        assertEquals(Optional.of("m.f.<local>.x"), chain.lookup("x"));
        assertEquals(Optional.of("m.y"), chain.lookup("y"));
    }

    @Test
    void testBindNeverLeaksIntoEarlierChains() {
        var outer = ScopeChain.empty().push(ScopeKind.MODULE, "m.", List.of());
        var child = outer.push(ScopeKind.FUNCTION, "m.f.<local>.", List.of());
        var updated = child.bind("t", "m.f.<local>.t");

        assertEquals(Optional.of("m.f.<local>.t"), updated.lookup("t"));
        assertEquals(Optional.empty(), child.lookup("t"));
        assertEquals(Optional.empty(), outer.lookup("t"));
        assertEquals(2, updated.depth());

        var sibling = outer.push(ScopeKind.FUNCTION, "m.g.<local>.", List.of());
        assertEquals(Optional.empty(), sibling.lookup("t"));
    }

    @Test
    void testBindTargetsInnermostFrame() {
        var chain = ScopeChain.empty()
                .push(ScopeKind.MODULE, "m.", List.of())
                .push(ScopeKind.CLASS, "m.C.", List.of())
                .bind("z", "m.C.z");
        assertEquals(List.of("z"), chain.innermost().names());
        assertEquals(ScopeKind.CLASS, chain.innermost().kind());
    }

    @Test
    void testEnclosingFunctionLookupSkipsClassAndModuleFrames() {
        var chain = ScopeChain.empty()
                .push(ScopeKind.MODULE, "m.", List.of("v"))
                .push(ScopeKind.FUNCTION, "m.outer.<local>.", List.of("v", "w"))
                .push(ScopeKind.CLASS, "m.outer.<local>.C.", List.of("w"))
                .push(ScopeKind.FUNCTION, "m.outer.<local>.C.meth.<local>.", List.of("v"));

        assertEquals(Optional.of("m.outer.<local>.v"), chain.lookupEnclosingFunction("v"));
        assertEquals(Optional.of("m.outer.<local>.w"), chain.lookupEnclosingFunction("w"));

        var moduleOnly = ScopeChain.empty()
                .push(ScopeKind.MODULE, "m.", List.of("v"))
                .push(ScopeKind.FUNCTION, "m.f.<local>.", List.of());
        assertEquals(Optional.empty(), moduleOnly.lookupEnclosingFunction("v"));
    }

    @Test
    void testModuleLookupIgnoresInnerFrames() {
        var chain = ScopeChain.empty()
                .push(ScopeKind.MODULE, "m.", List.of("g"))
                .push(ScopeKind.FUNCTION, "m.f.<local>.", List.of("g"));
        assertEquals(Optional.of("m.f.<local>.g"), chain.lookup("g"));
        assertEquals(Optional.of("m.g"), chain.lookupModule("g"));
        assertEquals(Optional.empty(), chain.lookupModule("h"));
        assertEquals(Optional.empty(), ScopeChain.empty().lookupModule("g"));
    }

    @Test
    void testEmptyChain() {
        var empty = ScopeChain.empty();
        assertTrue(empty.isEmpty());
        assertThrows(IllegalStateException.class, empty::innermost);
        assertThrows(IllegalStateException.class, () -> empty.bind("a", "m.a"));
    }
}

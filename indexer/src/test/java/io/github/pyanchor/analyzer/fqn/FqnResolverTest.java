package io.github.pyanchor.analyzer.fqn;

import static org.junit.jupiter.api.Assertions.*;

import io.github.pyanchor.analyzer.InvariantViolationException;
import io.github.pyanchor.analyzer.PythonVersion;
import io.github.pyanchor.analyzer.Span;
import io.github.pyanchor.analyzer.cooked.ComprehensionKind;
import io.github.pyanchor.analyzer.cooked.CookedNode;
import io.github.pyanchor.analyzer.cooked.CookedNode.*;
import io.github.pyanchor.analyzer.testutil.Anchors;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.pcollections.OrderedPSet;

public final class FqnResolverTest {
    private int offset;

    private Span span(String text) {
        var span = new Span(offset, offset + text.length(), text);
        offset += text.length() + 1;
        return span;
    }

    private NameOccurrence bind(String text) {
        return NameOccurrence.binding(span(text));
    }

    private NameOccurrence ref(String text) {
        return NameOccurrence.reference(span(text));
    }

    private static ModuleRoot resolve(ModuleRoot module) {
        return FqnResolver.resolveModule(module, ResolveContext.forModule("m", PythonVersion.PY3));
    }

    private static FunctionDef function(NameOccurrence name, List<CookedNode> body, String... bindings) {
        return new FunctionDef(
                name,
                false,
                CookedNode.omitted(),
                List.of(),
                CookedNode.omitted(),
                body,
                OrderedPSet.from(List.of(bindings)));
    }

    @Test
    void testModuleBindingsAreSeededBeforeUse() {
        // y is read before the statement that binds it
        var read = ref("y");
        var write = bind("y");
        var module = new ModuleRoot(
                "m.py",
                List.of(new ExpressionStatement(List.of(read)), new Assignment(List.of(write), CookedNode.omitted())),
                OrderedPSet.from(List.of("y")));

        var resolved = resolve(module);
        var readResolved = (NameOccurrence) ((ExpressionStatement) resolved.body().get(0)).expressions().get(0);
        var writeResolved = (NameOccurrence) ((Assignment) resolved.body().get(1)).targets().get(0);
        assertEquals("m.y", readResolved.fqn());
        assertEquals("m.y", writeResolved.fqn());
    }

    @Test
    void testUnboundReferencesAreMintedInTheInnermostScope() {
        var first = ref("t");
        var second = ref("t");
        var f = function(bind("f"), List.of(new ExpressionStatement(List.of(first, second))));
        var module = new ModuleRoot("m.py", List.of(f), OrderedPSet.from(List.of("f")));

        var resolvedF = (FunctionDef) resolve(module).body().get(0);
        var names = ((ExpressionStatement) resolvedF.body().get(0)).expressions();
        assertEquals("m.f.<local>.t", ((NameOccurrence) names.get(0)).fqn());
        assertEquals("m.f.<local>.t", ((NameOccurrence) names.get(1)).fqn());
    }

    @Test
    void testSiblingScopesDoNotSeeEachOther() {
        var f = function(bind("f"), List.of(new ExpressionStatement(List.of(ref("t")))));
        var g = function(bind("g"), List.of(new ExpressionStatement(List.of(ref("t")))));
        var module = new ModuleRoot("m.py", List.of(f, g), OrderedPSet.from(List.of("f", "g")));

        var resolved = resolve(module);
        var inF = ((ExpressionStatement) ((FunctionDef) resolved.body().get(0)).body().get(0)).expressions().get(0);
        var inG = ((ExpressionStatement) ((FunctionDef) resolved.body().get(1)).body().get(0)).expressions().get(0);
        assertEquals("m.f.<local>.t", ((NameOccurrence) inF).fqn());
        assertEquals("m.g.<local>.t", ((NameOccurrence) inG).fqn());
    }

    @Test
    void testRawNamesAreLeftAlone() {
        var raw = NameOccurrence.raw(span("member"));
        var module = new ModuleRoot("m.py", List.of(new ExpressionStatement(List.of(raw))), OrderedPSet.empty());
        var resolved = (NameOccurrence) ((ExpressionStatement) resolve(module).body().get(0)).expressions().get(0);
        assertNull(resolved.fqn());
    }

    @Test
    void testMissingDefinitionNameFallsBackToOffset() {
        var missing = NameOccurrence.raw(new Span(40, 40, ""));
        var inner = ref("v");
        var f = function(missing, List.of(new ExpressionStatement(List.of(inner))));
        var module = new ModuleRoot("m.py", List.of(f), OrderedPSet.empty());

        var resolvedF = (FunctionDef) resolve(module).body().get(0);
        var v = (NameOccurrence) ((ExpressionStatement) resolvedF.body().get(0)).expressions().get(0);
        assertEquals("m.<def>[40].<local>.v", v.fqn());
    }

    @Test
    void testComprehensionWithoutForClauseIsAnInvariantViolation() {
        var comprehension = new Comprehension(
                ComprehensionKind.LIST, span("for"), ref("x"), List.of(), OrderedPSet.empty());
        var module = new ModuleRoot(
                "m.py", List.of(new ExpressionStatement(List.of(comprehension))), OrderedPSet.empty());
        assertThrows(InvariantViolationException.class, () -> resolve(module));
    }

    @Test
    void testNonlocalResolvesToEnclosingFunction() {
        var module = Anchors.resolve(
                "def outer():\n    x = 1\n    def inner():\n        nonlocal x\n        x = 2\n", "m", PythonVersion.PY3);
        var outer = (FunctionDef) module.body().get(0);
        var inner = (FunctionDef) outer.body().get(1);
        var nonlocal = (Nonlocal) inner.body().get(0);
        assertEquals("m.outer.<local>.x", nonlocal.names().get(0).fqn());
        var assignment = (Assignment) inner.body().get(1);
        assertEquals("m.outer.<local>.x", ((NameOccurrence) assignment.targets().get(0)).fqn());
    }

    @Test
    void testLambdaAndDefaultScopes() {
        var module = Anchors.resolve("d = 1\ndef f(a=d):\n    return lambda b: a + b\n", "m", PythonVersion.PY3);
        var f = (FunctionDef) module.body().get(1);
        var defaultValue = (NameOccurrence) f.parameters().get(0).defaultValue();
        assertEquals("m.d", defaultValue.fqn());
        var lambda = (Lambda) ((Return) f.body().get(0)).value();
        var b = (NameOccurrence) lambda.parameters().get(0).target();
        int lambdaOffset = lambda.keyword().start();
        assertEquals("m.f.<local>.<lambda>[" + lambdaOffset + "].<local>.b", b.fqn());
        var sum = (BinaryOperation) lambda.body();
        assertEquals("m.f.<local>.a", ((NameOccurrence) sum.left()).fqn());
    }
}

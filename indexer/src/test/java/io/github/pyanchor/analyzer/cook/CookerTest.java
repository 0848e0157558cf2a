package io.github.pyanchor.analyzer.cook;

import static io.github.pyanchor.analyzer.testutil.Anchors.cook;
import static org.junit.jupiter.api.Assertions.*;

import io.github.pyanchor.analyzer.InvariantViolationException;
import io.github.pyanchor.analyzer.NestingTooDeepException;
import io.github.pyanchor.analyzer.PythonVersion;
import io.github.pyanchor.analyzer.cooked.ChildNodes;
import io.github.pyanchor.analyzer.cooked.Classification;
import io.github.pyanchor.analyzer.cooked.CookedNode;
import io.github.pyanchor.analyzer.cooked.CookedNode.*;
import io.github.pyanchor.analyzer.python.PythonSyntaxParser;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public final class CookerTest {

    private static List<NameOccurrence> names(CookedNode root) {
        var result = new ArrayList<NameOccurrence>();
        var stack = new ArrayList<CookedNode>();
        stack.add(root);
        while (!stack.isEmpty()) {
            var node = stack.remove(stack.size() - 1);
            if (node instanceof NameOccurrence name) {
                result.add(name);
            }
            var children = ChildNodes.of(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.add(children.get(i));
            }
        }
        return result;
    }

    private static Classification classificationOf(CookedNode root, String name) {
        var matches = names(root).stream().filter(n -> n.name().equals(name)).toList();
        assertEquals(1, matches.size(), () -> "Expected one occurrence of " + name + " but found " + matches);
        return matches.get(0).classification();
    }

    @Test
    void testScopeBindingSets() {
        var module = cook("class Foo:\n  def bar(self):\n    return self.x\n", PythonVersion.PY3);
        assertEquals(List.of("Foo"), List.copyOf(module.bindings()));

        var classDef = assertInstanceOf(ClassDef.class, module.body().get(0));
        assertEquals(List.of("bar"), List.copyOf(classDef.bindings()));

        var function = assertInstanceOf(FunctionDef.class, classDef.body().get(0));
        assertEquals(List.of("self"), List.copyOf(function.bindings()));
        assertEquals(1, function.parameters().size());

        var ret = assertInstanceOf(Return.class, function.body().get(0));
        var attribute = assertInstanceOf(Attribute.class, ret.value());
        assertEquals(Classification.RAW, attribute.member().classification());
        assertFalse(attribute.target());
    }

    @Test
    void testBindingSetsKeepFirstOccurrenceOrder() {
        var module = cook("b = 1\na = 2\nb = 3\nfor c, a in []:\n    pass\n", PythonVersion.PY3);
        assertEquals(List.of("b", "a", "c"), List.copyOf(module.bindings()));
    }

    @Test
    void testComprehensionDialects() {
        var source = "[x for x in range(x)]\n";

        var isolated = cook(source, PythonVersion.PY3);
        assertTrue(isolated.bindings().isEmpty());
        var comprehension = (Comprehension) ((ExpressionStatement) isolated.body().get(0)).expressions().get(0);
        assertEquals(List.of("x"), List.copyOf(comprehension.bindings()));
        assertEquals(3, comprehension.forKeyword().start());

        var legacy = cook(source, PythonVersion.PY2);
        assertEquals(List.of("x"), List.copyOf(legacy.bindings()));
        var legacyComprehension = (Comprehension) ((ExpressionStatement) legacy.body().get(0)).expressions().get(0);
        assertTrue(legacyComprehension.bindings().isEmpty());
    }

    @Test
    void testWalrusInComprehensionBindsOutside() {
        var module = cook("[y for x in xs if (y := x)]\n", PythonVersion.PY3);
        assertEquals(List.of("y"), List.copyOf(module.bindings()));
        var comprehension = (Comprehension) ((ExpressionStatement) module.body().get(0)).expressions().get(0);
        assertEquals(List.of("x"), List.copyOf(comprehension.bindings()));
    }

    @Test
    void testGlobalAndNonlocalDegradeBindings() {
        var module = cook(
                "def f():\n    global g\n    g = 1\n    def h():\n        nonlocal k\n        k = 2\n    k = 0\n",
                PythonVersion.PY3);
        assertEquals(List.of("f", "g"), List.copyOf(module.bindings()));

        var f = (FunctionDef) module.body().get(0);
        assertEquals(List.of("h", "k"), List.copyOf(f.bindings()));
        var h = (FunctionDef) f.body().get(2);
        assertTrue(h.bindings().isEmpty());

        for (var name : names(module)) {
            if (name.name().equals("g")) {
                assertEquals(Classification.REFERENCE, name.classification());
            }
        }
    }

    @Test
    void testImportClassification() {
        var module = cook("import a.b.c\nimport d.e as f\nfrom g import h, i as j\n", PythonVersion.PY3);
        assertEquals(List.of("a", "f", "h", "j"), List.copyOf(module.bindings()));

        assertEquals(Classification.BINDING, classificationOf(module, "a"));
        assertEquals(Classification.RAW, classificationOf(module, "b"));
        assertEquals(Classification.RAW, classificationOf(module, "d"));
        assertEquals(Classification.RAW, classificationOf(module, "e"));
        assertEquals(Classification.BINDING, classificationOf(module, "f"));
        assertEquals(Classification.RAW, classificationOf(module, "g"));
        assertEquals(Classification.BINDING, classificationOf(module, "h"));
        assertEquals(Classification.RAW, classificationOf(module, "i"));
    }

    @Test
    void testRelativeImportLevel() {
        var module = cook("from ..pkg import name\n", PythonVersion.PY3);
        var importFrom = assertInstanceOf(ImportFrom.class, module.body().get(0));
        assertEquals(2, importFrom.level());
        assertEquals(1, importFrom.module().size());
        assertEquals("pkg", importFrom.module().get(0).name());
    }

    @Test
    void testDecoratorPaths() {
        var module = cook("@functools.wraps(fn)\n@plain\ndef g():\n    pass\n", PythonVersion.PY3);
        assertEquals(Classification.RAW, classificationOf(module, "functools"));
        assertEquals(Classification.RAW, classificationOf(module, "wraps"));
        assertEquals(Classification.REFERENCE, classificationOf(module, "fn"));
        assertEquals(Classification.REFERENCE, classificationOf(module, "plain"));
        assertEquals(Classification.BINDING, classificationOf(module, "g"));
    }

    @Test
    void testParameterDefaultsAreOuterReferences() {
        var module = cook("def f(a, b: int = c, *rest, **kw):\n    return a\n", PythonVersion.PY3);
        var f = (FunctionDef) module.body().get(0);
        assertEquals(List.of("a", "b", "rest", "kw"), List.copyOf(f.bindings()));
        assertEquals(List.of("f"), List.copyOf(module.bindings()));
        assertEquals(Classification.REFERENCE, classificationOf(module, "c"));
        assertEquals(Classification.REFERENCE, classificationOf(module, "int"));
    }

    @Test
    void testAttributeAndSubscriptTargetsDoNotBind() {
        var module = cook("obj.attr = 1\nitems[key] = 2\n", PythonVersion.PY3);
        assertTrue(module.bindings().isEmpty());
        var assignment = (Assignment) module.body().get(0);
        var attribute = assertInstanceOf(Attribute.class, assignment.targets().get(0));
        assertTrue(attribute.target());
        assertEquals(Classification.REFERENCE, classificationOf(module, "obj"));
        assertEquals(Classification.REFERENCE, classificationOf(module, "key"));
    }

    @Test
    void testChainedAssignmentIsFlattened() {
        var module = cook("a = b = c\n", PythonVersion.PY3);
        var assignment = assertInstanceOf(Assignment.class, module.body().get(0));
        assertEquals(2, assignment.targets().size());
        assertEquals(List.of("a", "b"), List.copyOf(module.bindings()));
    }

    @Test
    void testExceptWithAndLambdaBindings() {
        var module = cook(
                "try:\n    pass\nexcept ValueError as err:\n    pass\nwith open(p) as fh:\n    pass\nf = lambda q: q\n",
                PythonVersion.PY3);
        assertEquals(List.of("err", "fh", "f"), List.copyOf(module.bindings()));
        var assignment = (Assignment) module.body().get(2);
        var lambda = assertInstanceOf(Lambda.class, assignment.value());
        assertEquals(List.of("q"), List.copyOf(lambda.bindings()));
    }

    @Test
    void testKeywordArgumentNameIsNotAnOccurrence() {
        var module = cook("f(key=value)\n", PythonVersion.PY3);
        assertTrue(names(module).stream().noneMatch(n -> n.name().equals("key")));
        assertEquals(Classification.REFERENCE, classificationOf(module, "value"));
    }

    @Test
    void testMatchCaptures() {
        var module = cook("match p:\n    case [first, *rest]:\n        pass\n    case _:\n        pass\n", PythonVersion.PY3);
        assertTrue(module.bindings().contains("first"));
        assertTrue(module.bindings().contains("rest"));
        assertFalse(module.bindings().contains("_"));
    }

    @Test
    void testTypeAliasBindsItsName() {
        var module = cook("type Pair = tuple[int, int]\n", PythonVersion.PY3);
        assertEquals(List.of("Pair"), List.copyOf(module.bindings()));
        assertInstanceOf(TypeAlias.class, module.body().get(0));
        assertEquals(Classification.BINDING, classificationOf(module, "Pair"));
        assertEquals(Classification.REFERENCE, classificationOf(module, "tuple"));
    }

    @Test
    void testAbsentOptionalsAreOmitted() {
        var module = cook("def f():\n    return\n", PythonVersion.PY3);
        var f = (FunctionDef) module.body().get(0);
        assertTrue(CookedNode.isOmitted(f.returnType()));
        assertTrue(CookedNode.isOmitted(f.typeParameters()));
        var ret = (Return) f.body().get(0);
        assertTrue(CookedNode.isOmitted(ret.value()));
    }

    @Test
    void testNestingLimit() {
        var source = "x = " + "(".repeat(50) + "1" + ")".repeat(50) + "\n";
        var tree = PythonSyntaxParser.parse(source);
        var ex = assertThrows(
                NestingTooDeepException.class, () -> new Cooker("deep.py", 20).cookModule(tree, PythonVersion.PY3));
        assertEquals(20, ex.getLimit());
        assertDoesNotThrow(() -> new Cooker("deep.py", 100).cookModule(tree, PythonVersion.PY3));
    }

    @Test
    void testNonModuleRootIsRejected() {
        var statement = PythonSyntaxParser.parse("x = 1\n").namedChildren().get(0);
        assertThrows(
                InvariantViolationException.class,
                () -> new Cooker("x.py", 100).cookModule(statement, PythonVersion.PY3));
    }
}

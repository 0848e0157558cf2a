package io.github.pyanchor.analyzer;

import static io.github.pyanchor.analyzer.testutil.Anchors.*;
import static org.junit.jupiter.api.Assertions.*;

import io.github.pyanchor.analyzer.IndexingException.Stage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

public final class PythonIndexerTest {
    private static final Path TEST_ROOT = Path.of("src/test/resources", "testcode-py");

    private static PythonIndexer indexer;

    @BeforeAll
    public static void setup() {
        assertTrue(Files.isDirectory(TEST_ROOT), "Test resource dir missing: " + TEST_ROOT);
        indexer = new PythonIndexer(new IndexerConfig("corpus", "root", PythonVersion.PY3, 30));
    }

    private static SourceFile source(String path, String modulePath, String text) {
        return new SourceFile(path, modulePath, text.getBytes(StandardCharsets.UTF_8));
    }

    private static List<Anchor> anchors(String modulePath, String text) throws IndexingException {
        return indexer.index(source("inline.py", modulePath, text)).anchorList();
    }

    @Test
    void testClassMethodAndSelf() throws IndexingException {
        var anchors = anchors("pkg.mod", "class Foo:\n  def bar(self):\n    return self.x\n");

        assertEquals("pkg.mod.Foo", single(anchors, "Foo", AnchorKind.CLASS_DEF).fqn());
        assertEquals("pkg.mod.Foo.bar", single(anchors, "bar", AnchorKind.FUNCTION_DEF).fqn());

        var selfBinding = single(anchors, "self", AnchorKind.BINDING_DEF);
        assertEquals("pkg.mod.Foo.bar.<local>.self", selfBinding.fqn());
        var selfRef = single(anchors, "self", AnchorKind.REFERENCE);
        assertEquals(selfBinding.fqn(), selfRef.fqn());
        assertTrue(selfRef.start() > selfBinding.start());

        assertTrue(withText(anchors, "x").isEmpty(), "Attribute members are never anchored");
    }

    @Test
    void testDefinitionAnchorPrecedesItsBinding() throws IndexingException {
        var anchors = anchors("m", "def f():\n    pass\n");
        assertEquals(2, anchors.size());
        assertEquals(AnchorKind.FUNCTION_DEF, anchors.get(0).kind());
        assertEquals(AnchorKind.BINDING_DEF, anchors.get(1).kind());
        assertEquals(anchors.get(0).span(), anchors.get(1).span());
        assertEquals("m.f", anchors.get(1).fqn());
    }

    @Test
    void testIsolatedComprehensionScope() throws IndexingException {
        var anchors = anchors("m", "[x for x in range(x)]\n");
        var xs = withText(anchors, "x");
        assertEquals(3, xs.size());

        // source order: element, for-target, iterable argument
        var element = xs.get(0);
        var target = xs.get(1);
        var iterableArg = xs.get(2);
        assertEquals("m.<comp_for>[3].x", target.fqn());
        assertEquals(AnchorKind.BINDING_DEF, target.kind());
        assertEquals(target.fqn(), element.fqn());
        assertEquals("m.x", iterableArg.fqn());
        assertEquals(AnchorKind.REFERENCE, iterableArg.kind());
    }

    @Test
    void testLegacyComprehensionLeaksIntoModule() throws IndexingException {
        var legacy = new PythonIndexer(IndexerConfig.defaults().withPythonVersion(PythonVersion.PY2));
        var anchors = legacy.index(source("inline.py", "m", "[x for x in range(x)]\n")).anchorList();
        var fqns = fqnsOf(anchors, "x");
        assertEquals(List.of("m.x", "m.x", "m.x"), fqns);
    }

    @Test
    void testGlobalDeclarationTargetsModule() throws IndexingException {
        var anchors = anchors("m", "def f():\n    global g\n    g = 1\n");
        var gs = withText(anchors, "g");
        assertEquals(2, gs.size());
        for (var g : gs) {
            assertEquals("m.g", g.fqn());
            assertEquals(AnchorKind.REFERENCE, g.kind());
        }
    }

    @Test
    void testGlobalInNestedFunctionSkipsEnclosingBinding() throws IndexingException {
        var anchors = anchors("m", "def outer():\n    g = 0\n    def inner():\n        global g\n        g = 1\n");
        var gs = withText(anchors, "g");
        assertEquals(3, gs.size());
        assertEquals("m.outer.<local>.g", gs.get(0).fqn());
        assertEquals(AnchorKind.BINDING_DEF, gs.get(0).kind());
        assertEquals("m.g", gs.get(1).fqn());
        assertEquals("m.g", gs.get(2).fqn());
    }

    @Test
    void testGlobalInMethodSkipsClassBinding() throws IndexingException {
        var anchors = anchors("m", "class C:\n    g = 0\n    def m(self):\n        global g\n        g = 1\n");
        var gs = withText(anchors, "g");
        assertEquals(List.of("m.C.g", "m.g", "m.g"), gs.stream().map(Anchor::fqn).toList());
    }

    @Test
    void testLocalBindingBeforeGlobalStaysLocal() throws IndexingException {
        var text = "def f():\n    g = 1\n    global g\n    g = 2\n";
        var anchors = anchors("m", text);
        assertEquals(List.of("m.f.<local>.g", "m.f.<local>.g", "m.f.<local>.g"), fqnsOf(anchors, "g"));
        assertTrue(cook(text, PythonVersion.PY3).bindings().contains("g"), "Module binding set gains the name");
    }

    @Test
    void testTypeAliasStatement() throws IndexingException {
        var anchors = anchors("m", "type X = int\ny: X = 0\n");
        assertEquals("m.X", single(anchors, "X", AnchorKind.BINDING_DEF).fqn());
        assertEquals("m.X", single(anchors, "X", AnchorKind.REFERENCE).fqn());
        assertEquals("m.int", single(anchors, "int", AnchorKind.REFERENCE).fqn());
    }

    @Test
    void testInvalidUtf8FailsAtParse() {
        byte[] bytes = {'x', ' ', '=', ' ', (byte) 0xFF, '\n'};
        var ex = assertThrows(IndexingException.class, () -> indexer.index(new SourceFile("bad.py", "bad", bytes)));
        assertEquals(Stage.PARSE, ex.getStage());
        assertEquals("bad.py", ex.getFile());
    }

    @Test
    void testUnexpectedRuntimeFailureIsReportedAgainstTheFile() {
        var file = source("odd.py", "odd", "pass\n");
        var ex = assertThrows(IndexingException.class, () -> PythonIndexer.runStage(file, Stage.RESOLVE, () -> {
            throw new IndexOutOfBoundsException("Index 0 out of bounds for length 0");
        }));
        assertEquals(Stage.RESOLVE, ex.getStage());
        assertInstanceOf(IndexOutOfBoundsException.class, ex.getCause());
        assertTrue(ex.getMessage().contains("odd.py"));
    }

    @Test
    void testModuleLevelNonlocalIsTolerated() throws IndexingException {
        var anchors = anchors("m", "nonlocal x\ny = 1\n");
        assertTrue(withText(anchors, "x").isEmpty(), "Degenerate nonlocal must not produce an anchor");
        assertEquals("m.y", single(anchors, "y", AnchorKind.BINDING_DEF).fqn());
    }

    @Test
    void testNonlocalWithoutEnclosingFunctionIsTolerated() throws IndexingException {
        var anchors = anchors("m", "def f():\n    nonlocal z\n    return 1\nw = 2\n");
        assertTrue(withText(anchors, "z").isEmpty());
        assertEquals("m.w", single(anchors, "w", AnchorKind.BINDING_DEF).fqn());
    }

    @Test
    void testByteOffsetsAfterMultiByteText() throws IndexingException {
        var anchors = anchors("m", "s = \"é\"\ny = s\n");
        var y = single(anchors, "y", AnchorKind.BINDING_DEF);
        assertEquals(9, y.start());
        assertEquals(10, y.end());
        var sRef = single(anchors, "s", AnchorKind.REFERENCE);
        assertEquals(13, sRef.start());
        assertEquals("m.s", sRef.fqn());
    }

    @Test
    void testByteOrderMarkKeepsOffsetsIntoOriginalBytes() throws IndexingException {
        byte[] body = "x = 1\n".getBytes(StandardCharsets.UTF_8);
        byte[] withBom = new byte[body.length + 3];
        withBom[0] = (byte) 0xEF;
        withBom[1] = (byte) 0xBB;
        withBom[2] = (byte) 0xBF;
        System.arraycopy(body, 0, withBom, 3, body.length);

        var result = indexer.index(new SourceFile("bom.py", "m", withBom));
        var x = single(result.anchorList(), "x", AnchorKind.BINDING_DEF);
        assertEquals(3, x.start());
        assertEquals(4, x.end());
    }

    @Test
    void testRepeatedRunsAreIdentical() throws IndexingException {
        var text = "import os\n\nclass A:\n    def m(self, k=os.sep):\n        return [k for _ in self.items]\n";
        var first = indexer.index(source("a.py", "m", text));
        var second = indexer.index(source("a.py", "m", text));
        assertEquals(first.anchorList(), second.anchorList());
        assertEquals(first.anchorList(), first.anchorList(), "Anchor sequence must be restartable");
    }

    @Test
    void testTestcodeInvariants() throws IOException, IndexingException {
        var file = SourceFile.read(TEST_ROOT, TEST_ROOT.resolve("pkg/mod.py"));
        assertEquals("pkg.mod", file.modulePath());
        var anchors = indexer.index(file).anchorList();
        assertFalse(anchors.isEmpty());

        var fqnsBySpan = new HashMap<Span, Set<String>>();
        for (var anchor : anchors) {
            assertTrue(anchor.fqn().startsWith("pkg.mod."), () -> "Outside module prefix: " + anchor);
            fqnsBySpan.computeIfAbsent(anchor.span(), s -> new HashSet<>()).add(anchor.fqn());
        }
        fqnsBySpan.forEach((span, fqns) -> assertEquals(1, fqns.size(), () -> span + " has " + fqns));

        assertEquals("pkg.mod.os", single(anchors, "os", AnchorKind.BINDING_DEF).fqn());
        assertTrue(withText(anchors, "path").isEmpty());
        assertTrue(withText(anchors, "OrderedDict").isEmpty());
        assertEquals("pkg.mod.OD", single(anchors, "OD", AnchorKind.BINDING_DEF).fqn());
        assertEquals(Set.of("pkg.mod.counter.<local>.count"), Set.copyOf(fqnsOf(anchors, "count")));
        assertEquals("pkg.mod.counter.<local>.bump", single(anchors, "bump", AnchorKind.FUNCTION_DEF).fqn());
        assertEquals(Set.of("pkg.mod.LIMIT"), Set.copyOf(fqnsOf(anchors, "LIMIT")));
        for (var n : withText(anchors, "n")) {
            assertTrue(n.fqn().startsWith("pkg.mod.<comp_for>["), () -> "Comprehension variable escaped: " + n);
        }
    }

    @Test
    void testManifestDescribesFile() throws IndexingException {
        var result = indexer.index(source("pkg/x.py", "pkg.x", "a = 1\n"));
        var manifest = result.manifest();
        assertEquals("corpus", manifest.corpus());
        assertEquals("root", manifest.root());
        assertEquals("pkg/x.py", manifest.path());
        assertEquals(FileManifest.PYTHON, manifest.language());
        assertEquals("YSA9IDEK", manifest.contentBase64());
        assertEquals("pkg.x", result.modulePath());
    }

    @Test
    void testNestingLimitFailsOnlyThatFile() throws IOException {
        var files = List.of(
                SourceFile.read(TEST_ROOT, TEST_ROOT.resolve("pkg/mod.py")),
                SourceFile.read(TEST_ROOT, TEST_ROOT.resolve("deep.py")),
                SourceFile.read(TEST_ROOT, TEST_ROOT.resolve("pkg/__init__.py")));

        var batch = indexer.indexAll(files);

        assertTrue(batch.hasFailures());
        assertEquals(1, batch.failures().size());
        var failure = batch.failures().get(0);
        assertEquals("deep.py", failure.getFile());
        assertEquals(Stage.COOK, failure.getStage());
        assertInstanceOf(NestingTooDeepException.class, failure.getCause());
        assertTrue(failure.getMessage().contains("deep.py"));

        assertEquals(2, batch.indexed().size());
        assertEquals("pkg.mod", batch.indexed().get(0).modulePath());
        var init = batch.indexed().get(1);
        assertEquals("pkg", init.modulePath());
        assertEquals("pkg.Foo", single(init.anchorList(), "Foo", AnchorKind.BINDING_DEF).fqn());
    }

    @Test
    void testSyntaxErrorsDoNotAbortTheFile() throws IndexingException {
        var anchors = anchors("m", "a = 1\ndef broken(:\n    pass\nb = a\n");
        var fqns = fqnsOf(anchors, "a");
        assertFalse(fqns.isEmpty());
        assertEquals(Set.of("m.a"), Set.copyOf(fqns));
    }

    @Test
    void testSharedHelpersAgreeWithIndexer() throws IndexingException {
        var text = "def f(a, *args, **kw):\n    return a\n";
        assertEquals(of(text), anchors("m", text));
    }
}

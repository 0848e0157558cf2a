package io.github.pyanchor.analyzer;

import io.github.pyanchor.analyzer.IndexingException.Stage;
import io.github.pyanchor.analyzer.cook.Cooker;
import io.github.pyanchor.analyzer.cooked.CookedNode.ModuleRoot;
import io.github.pyanchor.analyzer.fqn.FqnResolver;
import io.github.pyanchor.analyzer.fqn.ResolveContext;
import io.github.pyanchor.analyzer.python.PythonSyntaxParser;
import io.github.pyanchor.analyzer.python.SyntaxNode;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs parse, cook and resolve over Python source files and hands back their anchor streams.
 *
 * <p>Each file is processed independently with no state carried between files, so one instance may be shared by
 * several threads.
 */
public class PythonIndexer {
    private static final Logger log = LogManager.getLogger(PythonIndexer.class);

    private final IndexerConfig config;

    public PythonIndexer(IndexerConfig config) {
        this.config = config;
    }

    public PythonIndexer() {
        this(IndexerConfig.fromSystemProperties());
    }

    public IndexerConfig getConfig() {
        return config;
    }

    /** Indexes one file. The returned anchors are emitted lazily from the resolved tree. */
    public IndexedFile index(SourceFile file) throws IndexingException {
        log.debug("Indexing {} as module {}", file.path(), file.modulePath());
        byte[] content = file.content();

        SyntaxNode tree = runStage(file, Stage.PARSE, () -> PythonSyntaxParser.parse(content));
        if (tree.hasError()) {
            log.debug("{} contains syntax errors; indexing the recoverable parts", file.path());
        }

        var cooker = new Cooker(file.path(), config.maxNestingDepth());
        ModuleRoot cooked = runStage(file, Stage.COOK, () -> cooker.cookModule(tree, config.pythonVersion()));

        ModuleRoot resolved = runStage(file, Stage.RESOLVE, () -> FqnResolver.resolveModule(
                cooked, ResolveContext.forModule(file.modulePath(), config.pythonVersion())));

        var manifest = FileManifest.python(config.corpus(), config.root(), file.path(), content);
        return IndexedFile.of(manifest, file.modulePath(), resolved);
    }

    /**
     * Indexes every file, isolating failures: a file that cannot be indexed is logged and recorded in the result
     * while the remaining files are still processed. Anchors of successful files are walked once here so that
     * emission failures are reported against the right file.
     */
    public BatchResult indexAll(List<SourceFile> files) {
        var indexed = new ArrayList<IndexedFile>(files.size());
        var failures = new ArrayList<IndexingException>();
        for (var file : files) {
            try {
                var result = index(file);
                runStage(file, Stage.EMIT, result::anchorList);
                indexed.add(result);
            } catch (IndexingException e) {
                log.error("Skipping {}", file.path(), e);
                failures.add(e);
            }
        }
        log.info("Indexed {} of {} files ({} failed)", indexed.size(), files.size(), failures.size());
        return new BatchResult(List.copyOf(indexed), List.copyOf(failures));
    }

    static <T> T runStage(SourceFile file, Stage stage, Supplier<T> work) throws IndexingException {
        try {
            return work.get();
        } catch (RuntimeException e) {
            throw new IndexingException(String.valueOf(e.getMessage()), e, file.path(), stage);
        } catch (StackOverflowError e) {
            throw new IndexingException("stack exhausted", e, file.path(), stage);
        }
    }

    /** Outcome of {@link #indexAll(List)}: files that indexed cleanly and the failures for the rest. */
    public record BatchResult(List<IndexedFile> indexed, List<IndexingException> failures) {
        public boolean hasFailures() {
            return !failures.isEmpty();
        }
    }
}

package io.github.pyanchor.analyzer;

import io.github.pyanchor.analyzer.anchor.AnchorEmitter;
import io.github.pyanchor.analyzer.cooked.CookedNode.ModuleRoot;
import java.util.List;

/**
 * Result of indexing one file. Anchors are computed on each iteration of {@link #anchors()} from the resolved tree,
 * so the sequence can be walked any number of times.
 */
public record IndexedFile(FileManifest manifest, String modulePath, ModuleRoot resolved, AnchorEmitter anchors) {
    public static IndexedFile of(FileManifest manifest, String modulePath, ModuleRoot resolved) {
        return new IndexedFile(manifest, modulePath, resolved, AnchorEmitter.of(resolved));
    }

    public List<Anchor> anchorList() {
        return anchors.toList();
    }
}

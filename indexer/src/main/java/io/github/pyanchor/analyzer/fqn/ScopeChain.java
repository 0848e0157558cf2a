package io.github.pyanchor.analyzer.fqn;

import io.github.pyanchor.analyzer.cooked.ScopeKind;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.pcollections.ConsPStack;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.pcollections.PStack;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

/**
 * An immutable chain of name-to-FQN frames, innermost first.
 *
 * <p>Every update returns a new chain sharing structure with the old one, so a scope that hands its chain to a child
 * never observes the child's writes.
 */
public final class ScopeChain {
    private static final ScopeChain EMPTY = new ScopeChain(ConsPStack.empty());

    /** One scope's names. {@code order} keeps first-insertion order for deterministic iteration. */
    public record Frame(ScopeKind kind, PMap<String, String> fqns, PVector<String> order) {
        static Frame empty(ScopeKind kind) {
            return new Frame(kind, HashTreePMap.empty(), TreePVector.empty());
        }

        Frame plus(String name, String fqn) {
            var newOrder = fqns.containsKey(name) ? order : order.plus(name);
            return new Frame(kind, fqns.plus(name, fqn), newOrder);
        }

        public @Nullable String get(String name) {
            return fqns.get(name);
        }

        public List<String> names() {
            return order;
        }
    }

    private final PStack<Frame> frames;

    private ScopeChain(PStack<Frame> frames) {
        this.frames = frames;
    }

    public static ScopeChain empty() {
        return EMPTY;
    }

    /** Pushes a frame pre-populated with {@code prefix + name} for every name in {@code seeds}. */
    public ScopeChain push(ScopeKind kind, String prefix, Iterable<String> seeds) {
        var frame = Frame.empty(kind);
        for (var name : seeds) {
            frame = frame.plus(name, prefix + name);
        }
        return new ScopeChain(frames.plus(frame));
    }

    /** Records {@code name} in the innermost frame. */
    public ScopeChain bind(String name, String fqn) {
        if (frames.isEmpty()) {
            throw new IllegalStateException("No frame to bind " + name + " in");
        }
        var updated = frames.get(0).plus(name, fqn);
        return new ScopeChain(frames.minus(0).plus(updated));
    }

    /** Searches innermost to outermost. */
    public Optional<String> lookup(String name) {
        for (var frame : frames) {
            var fqn = frame.get(name);
            if (fqn != null) {
                return Optional.of(fqn);
            }
        }
        return Optional.empty();
    }

    /**
     * The binding a {@code nonlocal} declaration refers to: the nearest enclosing function frame, skipping the
     * innermost frame and any class frames in between.
     */
    public Optional<String> lookupEnclosingFunction(String name) {
        boolean first = true;
        for (var frame : frames) {
            if (first) {
                first = false;
                continue;
            }
            if (!frame.kind().isFunctionLike()) {
                continue;
            }
            var fqn = frame.get(name);
            if (fqn != null) {
                return Optional.of(fqn);
            }
        }
        return Optional.empty();
    }

    /** Searches only the outermost frame, where module-level names live. */
    public Optional<String> lookupModule(String name) {
        if (frames.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(frames.get(frames.size() - 1).get(name));
    }

    public int depth() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public Frame innermost() {
        if (frames.isEmpty()) {
            throw new IllegalStateException("Empty scope chain");
        }
        return frames.get(0);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("ScopeChain[");
        boolean firstFrame = true;
        for (var frame : frames) {
            if (!firstFrame) {
                sb.append(" <- ");
            }
            firstFrame = false;
            sb.append(frame.kind()).append(frame.names());
        }
        return sb.append(']').toString();
    }
}

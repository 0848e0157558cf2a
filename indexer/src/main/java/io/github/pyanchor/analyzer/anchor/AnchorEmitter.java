package io.github.pyanchor.analyzer.anchor;

import io.github.pyanchor.analyzer.Anchor;
import io.github.pyanchor.analyzer.AnchorKind;
import io.github.pyanchor.analyzer.InvariantViolationException;
import io.github.pyanchor.analyzer.cooked.ChildNodes;
import io.github.pyanchor.analyzer.cooked.CookedNode;
import io.github.pyanchor.analyzer.cooked.CookedNode.ClassDef;
import io.github.pyanchor.analyzer.cooked.CookedNode.FunctionDef;
import io.github.pyanchor.analyzer.cooked.CookedNode.NameOccurrence;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Lazily walks a resolved tree and yields its anchors in source order.
 *
 * <p>The sequence is restartable: every {@link #iterator()} starts a fresh walk. The walk uses an explicit stack.
 */
public final class AnchorEmitter implements Iterable<Anchor> {
    private static final Logger log = LogManager.getLogger(AnchorEmitter.class);

    private final CookedNode root;

    private AnchorEmitter(CookedNode root) {
        this.root = root;
    }

    public static AnchorEmitter of(CookedNode resolvedRoot) {
        return new AnchorEmitter(resolvedRoot);
    }

    @Override
    public Iterator<Anchor> iterator() {
        return new Walk(root);
    }

    public Stream<Anchor> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    public List<Anchor> toList() {
        return stream().toList();
    }

    private static final class Walk implements Iterator<Anchor> {
        private final Deque<CookedNode> stack = new ArrayDeque<>();
        private final Deque<Anchor> pending = new ArrayDeque<>();

        Walk(CookedNode root) {
            stack.push(root);
        }

        @Override
        public boolean hasNext() {
            while (pending.isEmpty() && !stack.isEmpty()) {
                var node = stack.pop();
                emit(node);
                var children = ChildNodes.of(node);
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
            return !pending.isEmpty();
        }

        @Override
        public Anchor next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return pending.removeFirst();
        }

        private void emit(CookedNode node) {
            if (node instanceof ClassDef classDef) {
                emitDefinition(classDef.name(), AnchorKind.CLASS_DEF);
            } else if (node instanceof FunctionDef functionDef) {
                emitDefinition(functionDef.name(), AnchorKind.FUNCTION_DEF);
            } else if (node instanceof NameOccurrence name) {
                emitOccurrence(name);
            }
        }

        private void emitDefinition(NameOccurrence name, AnchorKind kind) {
            if (name.hasFqn()) {
                pending.add(new Anchor(name.span(), name.fqn(), kind));
            }
        }

        private void emitOccurrence(NameOccurrence name) {
            switch (name.classification()) {
                case BINDING -> {
                    if (!name.hasFqn()) {
                        throw new InvariantViolationException("Binding " + name.span() + " was never resolved");
                    }
                    pending.add(new Anchor(name.span(), name.fqn(), AnchorKind.BINDING_DEF));
                }
                case REFERENCE -> {
                    if (name.hasFqn()) {
                        pending.add(new Anchor(name.span(), name.fqn(), AnchorKind.REFERENCE));
                    } else {
                        log.trace("No anchor for unresolved reference {}", name.span());
                    }
                }
                case RAW -> {
                    // informational only
                }
            }
        }
    }
}

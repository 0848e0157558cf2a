package io.github.pyanchor.analyzer;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A node of the concrete syntax tree handed to the cooker.
 *
 * <p>Implementations are immutable snapshots of a parser's output. Node kinds are grammar type names; anonymous
 * (keyword and punctuation) tokens are children like any other, with {@link #isNamed()} false.
 */
public interface ConcreteNode {
    String kind();

    boolean isNamed();

    /** True for nodes the parser inserted to recover from a syntax error. */
    boolean isError();

    /** True for zero-width tokens the parser invented because they were expected but absent. */
    boolean isMissing();

    int startByte();

    int endByte();

    /** The literal source text covered by this node. */
    String text();

    default Span span() {
        return new Span(startByte(), endByte(), text());
    }

    List<? extends ConcreteNode> children();

    /** The grammar field name under which the child at {@code index} hangs, if any. */
    @Nullable
    String fieldNameForChild(int index);

    /** The first child hanging under {@code fieldName}, or null. */
    default @Nullable ConcreteNode childByFieldName(String fieldName) {
        var kids = children();
        for (int i = 0; i < kids.size(); i++) {
            if (fieldName.equals(fieldNameForChild(i))) {
                return kids.get(i);
            }
        }
        return null;
    }

    /** Every child hanging under {@code fieldName}, in source order. */
    default List<ConcreteNode> childrenByFieldName(String fieldName) {
        var kids = children();
        var result = new ArrayList<ConcreteNode>();
        for (int i = 0; i < kids.size(); i++) {
            if (fieldName.equals(fieldNameForChild(i))) {
                result.add(kids.get(i));
            }
        }
        return result;
    }

    default List<ConcreteNode> namedChildren() {
        return children().stream().filter(ConcreteNode::isNamed).map(ConcreteNode.class::cast).toList();
    }

    /** True if an anonymous token with exactly this text is a direct child. */
    default boolean hasToken(String token) {
        return children().stream().anyMatch(c -> !c.isNamed() && token.equals(c.kind()));
    }
}

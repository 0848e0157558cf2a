package io.github.pyanchor.analyzer.python;

import io.github.pyanchor.analyzer.ConcreteNode;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Immutable snapshot of a tree-sitter node.
 *
 * <p>{@link TSNode} handles are only valid while their tree is alive and every accessor crosses JNI, so the cooker
 * works on a frozen copy instead. Comments and line continuations are dropped while copying.
 */
public final class SyntaxNode implements ConcreteNode {
    private static final Set<String> EXTRAS = Set.of(PythonNodeTypes.COMMENT, PythonNodeTypes.LINE_CONTINUATION);

    private final String kind;
    private final boolean named;
    private final int startByte;
    private final int endByte;
    private final List<SyntaxNode> children;
    private final List<@Nullable String> fieldNames;
    private final SourceBytes source;
    private final boolean containsError;

    private SyntaxNode(
            String kind,
            boolean named,
            int startByte,
            int endByte,
            List<SyntaxNode> children,
            List<@Nullable String> fieldNames,
            SourceBytes source) {
        this.kind = kind;
        this.named = named;
        this.startByte = startByte;
        this.endByte = endByte;
        this.children = Collections.unmodifiableList(children);
        this.fieldNames = Collections.unmodifiableList(fieldNames);
        this.source = source;
        this.containsError = PythonNodeTypes.ERROR.equals(kind) || children.stream().anyMatch(c -> c.containsError);
    }

    /** The bytes a snapshot was taken from; {@code base} is added to every tree-sitter offset. */
    record SourceBytes(byte[] bytes, int base) {
        String slice(int start, int end) {
            int from = Math.max(0, start - base);
            int to = Math.min(bytes.length, end - base);
            if (from >= to) {
                return "";
            }
            return new String(bytes, from, to - from, StandardCharsets.UTF_8);
        }
    }

    /**
     * Copies the tree rooted at {@code root} using an explicit stack, so arbitrarily deep input cannot overflow the
     * call stack.
     */
    static SyntaxNode snapshot(TSNode root, byte[] bytes, int baseOffset) {
        var source = new SourceBytes(bytes, baseOffset);
        var stack = new ArrayDeque<Pending>();
        stack.push(new Pending(root, null));
        SyntaxNode result = null;
        while (!stack.isEmpty()) {
            var top = stack.peek();
            if (top.nextChild < top.node.getChildCount()) {
                int i = top.nextChild++;
                TSNode child = top.node.getChild(i);
                if (child == null || child.isNull() || EXTRAS.contains(child.getType())) {
                    continue;
                }
                stack.push(new Pending(child, top.node.getFieldNameForChild(i)));
                continue;
            }
            stack.pop();
            var built = new SyntaxNode(
                    top.node.getType(),
                    top.node.isNamed(),
                    top.node.getStartByte() + baseOffset,
                    top.node.getEndByte() + baseOffset,
                    top.children,
                    top.fields,
                    source);
            var parent = stack.peek();
            if (parent == null) {
                result = built;
            } else {
                parent.children.add(built);
                parent.fields.add(top.fieldFromParent);
            }
        }
        assert result != null;
        return result;
    }

    private static final class Pending {
        final TSNode node;
        final @Nullable String fieldFromParent;
        final List<SyntaxNode> children = new ArrayList<>();
        final List<@Nullable String> fields = new ArrayList<>();
        int nextChild;

        Pending(TSNode node, @Nullable String fieldFromParent) {
            this.node = node;
            this.fieldFromParent = fieldFromParent;
        }
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public boolean isNamed() {
        return named;
    }

    @Override
    public boolean isError() {
        return PythonNodeTypes.ERROR.equals(kind);
    }

    /** Whether this node or any node below it is an ERROR node. */
    public boolean hasError() {
        return containsError;
    }

    @Override
    public boolean isMissing() {
        return children.isEmpty() && startByte == endByte;
    }

    @Override
    public int startByte() {
        return startByte;
    }

    @Override
    public int endByte() {
        return endByte;
    }

    @Override
    public String text() {
        return source.slice(startByte, endByte);
    }

    @Override
    public List<SyntaxNode> children() {
        return children;
    }

    @Override
    public @Nullable String fieldNameForChild(int index) {
        return fieldNames.get(index);
    }

    /** S-expression rendering, handy when debugging grammar shapes. */
    public String toSexp() {
        var sb = new StringBuilder();
        appendSexp(sb, null);
        return sb.toString();
    }

    private void appendSexp(StringBuilder sb, @Nullable String field) {
        if (field != null) {
            sb.append(field).append(": ");
        }
        sb.append('(').append(kind);
        for (int i = 0; i < children.size(); i++) {
            var child = children.get(i);
            if (!child.isNamed()) {
                continue;
            }
            sb.append(' ');
            child.appendSexp(sb, fieldNames.get(i));
        }
        sb.append(')');
    }

    @Override
    public String toString() {
        return kind + "[" + startByte + "," + endByte + ")";
    }
}

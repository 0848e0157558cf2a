package io.github.pyanchor.analyzer;

/**
 * A semantic fact binding a source span to a fully qualified name.
 *
 * @param span the source location of the occurrence
 * @param fqn the corpus-wide unique, dotted identity, never empty
 * @param kind what the occurrence does with the identity
 */
public record Anchor(Span span, String fqn, AnchorKind kind) {
    public Anchor {
        if (fqn.isEmpty()) {
            throw new IllegalArgumentException("Anchor at " + span + " has an empty FQN");
        }
    }

    public int start() {
        return span.start();
    }

    public int end() {
        return span.end();
    }

    @Override
    public String toString() {
        return kind + " " + span + " -> " + fqn;
    }
}

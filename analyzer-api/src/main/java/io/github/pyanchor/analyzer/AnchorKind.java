package io.github.pyanchor.analyzer;

/** The kinds of semantic facts emitted for a source span. */
public enum AnchorKind {
    /** A name occurrence that introduces or rebinds the identity. */
    BINDING_DEF("/kythe/edge/defines/binding"),
    /** A name occurrence that reads an existing identity. */
    REFERENCE("/kythe/edge/ref"),
    /** The name of a class definition. */
    CLASS_DEF("/kythe/edge/defines/class"),
    /** The name of a function definition. */
    FUNCTION_DEF("/kythe/edge/defines/function");

    private final String edgeKind;

    AnchorKind(String edgeKind) {
        this.edgeKind = edgeKind;
    }

    /** The Kythe edge kind that downstream graph writers map this anchor to. */
    public String edgeKind() {
        return edgeKind;
    }
}

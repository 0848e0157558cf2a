package io.github.pyanchor.analyzer.cooked;

/** What a name occurrence does. */
public enum Classification {
    /** Introduces or rebinds the name in the current scope. */
    BINDING,
    /** Reads a name visible from the current scope. */
    REFERENCE,
    /** Informational text, such as a dotted import segment or an attribute member; never resolved. */
    RAW
}

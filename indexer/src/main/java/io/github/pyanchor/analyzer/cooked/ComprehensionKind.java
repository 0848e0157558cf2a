package io.github.pyanchor.analyzer.cooked;

public enum ComprehensionKind {
    LIST,
    SET,
    DICT,
    GENERATOR
}

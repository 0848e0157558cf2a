package io.github.pyanchor.analyzer.cooked;

public enum ParameterKind {
    /** A plain, defaulted or annotated parameter. */
    REGULAR,
    /** {@code *args} */
    VAR_POSITIONAL,
    /** {@code **kwargs} */
    VAR_KEYWORD
}

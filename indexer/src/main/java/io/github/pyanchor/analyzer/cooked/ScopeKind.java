package io.github.pyanchor.analyzer.cooked;

public enum ScopeKind {
    MODULE,
    CLASS,
    FUNCTION,
    COMPREHENSION;

    /** Scopes whose bindings a {@code nonlocal} declaration may refer to. */
    public boolean isFunctionLike() {
        return this == FUNCTION;
    }
}

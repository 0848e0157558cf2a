package io.github.pyanchor.analyzer;

import java.util.Locale;

/**
 * Language-version discriminator.
 *
 * <p>Selects the comprehension-scoping dialect and whether the legacy-only statement forms ({@code print x},
 * {@code exec code}, {@code except E, e}) are expected.
 */
public enum PythonVersion {
    /** Legacy dialect: names bound by a comprehension leak into the enclosing scope. */
    PY2,
    /** Isolating dialect: every comprehension introduces its own scope. */
    PY3;

    public boolean comprehensionsIsolated() {
        return this == PY3;
    }

    public boolean allowsLegacyStatements() {
        return this == PY2;
    }

    /** Accepts "2", "3", "py2", "PY3" and the like. */
    public static PythonVersion parse(String value) {
        var normalized = value.trim().toUpperCase(Locale.ROOT);
        if (!normalized.startsWith("PY")) {
            normalized = "PY" + normalized;
        }
        return switch (normalized) {
            case "PY2" -> PY2;
            case "PY3" -> PY3;
            default -> throw new IllegalArgumentException("Unsupported python version: " + value);
        };
    }
}

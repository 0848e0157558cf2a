package io.github.pyanchor.analyzer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Settings shared by every file of one indexing run.
 *
 * @param corpus corpus label written into each {@link FileManifest}
 * @param root root label written into each {@link FileManifest}
 * @param pythonVersion dialect used to decide comprehension scoping
 * @param maxNestingDepth deepest syntax nesting accepted before a file is rejected
 */
public record IndexerConfig(String corpus, String root, PythonVersion pythonVersion, int maxNestingDepth) {
    private static final Logger log = LogManager.getLogger(IndexerConfig.class);

    public static final String CORPUS_PROPERTY = "pyanchor.corpus";
    public static final String ROOT_PROPERTY = "pyanchor.root";
    public static final String PYTHON_VERSION_PROPERTY = "pyanchor.pythonVersion";
    public static final String MAX_NESTING_DEPTH_PROPERTY = "pyanchor.maxNestingDepth";

    public static final int DEFAULT_MAX_NESTING_DEPTH = 400;

    public IndexerConfig {
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
    }

    public static IndexerConfig defaults() {
        return new IndexerConfig("", "", PythonVersion.PY3, DEFAULT_MAX_NESTING_DEPTH);
    }

    /** Reads the {@code pyanchor.*} system properties, falling back to {@link #defaults()} for anything unset. */
    public static IndexerConfig fromSystemProperties() {
        var defaults = defaults();
        return new IndexerConfig(
                getString(CORPUS_PROPERTY, defaults.corpus()),
                getString(ROOT_PROPERTY, defaults.root()),
                getVersion(PYTHON_VERSION_PROPERTY, defaults.pythonVersion()),
                getCap(MAX_NESTING_DEPTH_PROPERTY, defaults.maxNestingDepth()));
    }

    public IndexerConfig withPythonVersion(PythonVersion version) {
        return new IndexerConfig(corpus, root, version, maxNestingDepth);
    }

    public IndexerConfig withMaxNestingDepth(int depth) {
        return new IndexerConfig(corpus, root, pythonVersion, depth);
    }

    private static String getString(String propName, String defVal) {
        String v = System.getProperty(propName);
        return v == null ? defVal : v.trim();
    }

    private static PythonVersion getVersion(String propName, PythonVersion defVal) {
        String v = System.getProperty(propName);
        if (v == null || v.isBlank()) return defVal;
        try {
            return PythonVersion.parse(v);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring {}={}: {}", propName, v, e.getMessage());
            return defVal;
        }
    }

    private static int getCap(String propName, int defVal) {
        String v = System.getProperty(propName);
        if (v == null || v.isBlank()) return defVal;
        try {
            int parsed = Integer.parseInt(v.trim());
            return parsed > 0 ? parsed : defVal;
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {}={}", propName, v);
            return defVal;
        }
    }
}

package io.github.pyanchor.analyzer;

/** Thrown when a source file nests deeper than the configured maximum. */
public class NestingTooDeepException extends RuntimeException {
    private final int limit;

    public NestingTooDeepException(int limit, int byteOffset) {
        super("Nesting deeper than " + limit + " levels at byte offset " + byteOffset);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}

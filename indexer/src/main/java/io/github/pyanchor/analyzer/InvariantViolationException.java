package io.github.pyanchor.analyzer;

/**
 * Thrown when a tree does not have a shape the grammar or an earlier pass guarantees. Processing of the current file
 * is abandoned; other files are unaffected.
 */
public class InvariantViolationException extends RuntimeException {
    public InvariantViolationException(String message) {
        super(message);
    }
}

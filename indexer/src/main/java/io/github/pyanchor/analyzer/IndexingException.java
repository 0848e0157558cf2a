package io.github.pyanchor.analyzer;

/** A single source file could not be indexed. Other files of the same run are unaffected. */
public class IndexingException extends Exception {
    /** Pipeline step that was running when the file failed. */
    public enum Stage {
        PARSE,
        COOK,
        RESOLVE,
        EMIT
    }

    private final String file;
    private final Stage stage;

    public IndexingException(String message, String file, Stage stage) {
        super(message);
        this.file = file;
        this.stage = stage;
    }

    public IndexingException(String message, Throwable cause, String file, Stage stage) {
        super(message, cause);
        this.file = file;
        this.stage = stage;
    }

    public String getFile() {
        return file;
    }

    public Stage getStage() {
        return stage;
    }

    @Override
    public String getMessage() {
        return String.format("Indexing failed during %s for file %s: %s", stage, file, super.getMessage());
    }
}

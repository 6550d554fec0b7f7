package com.syntex.natiq.error;

/**
 * Base type for every deterministic content defect found while converting a
 * source document. None of these are transient, so nothing is retried.
 */
public class ConversionException extends Exception {

    private final Stage stage;
    private final String file;
    private final String detail;

    public ConversionException(Stage stage, String file, String detail) {
        this(stage, file, detail, null);
    }

    public ConversionException(Stage stage, String file, String detail, Throwable cause) {
        super(format(stage, file, detail), cause);
        this.stage = stage;
        this.file = file;
        this.detail = detail;
    }

    public Stage getStage() {
        return stage;
    }

    /** Source file name, or {@code null} when the defect is not tied to a file. */
    public String getFile() {
        return file;
    }

    public String getDetail() {
        return detail;
    }

    private static String format(Stage stage, String file, String detail) {
        String prefix = "[" + stage.label() + "] ";
        return file == null ? prefix + detail : prefix + file + ": " + detail;
    }
}

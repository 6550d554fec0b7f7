package com.syntex.natiq.error;

/**
 * Missing elements or attributes, unparseable XML, a file name outside the
 * {@code {language}.{author}.{extension}} convention or an unsupported
 * extension. Fatal for the file; bulk runs report it and move on.
 */
public class MalformedInputException extends ConversionException {

    public MalformedInputException(Stage stage, String file, String detail) {
        super(stage, file, detail);
    }

    public MalformedInputException(Stage stage, String file, String detail, Throwable cause) {
        super(stage, file, detail, cause);
    }
}

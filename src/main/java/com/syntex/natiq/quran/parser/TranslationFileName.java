package com.syntex.natiq.quran.parser;

import java.nio.file.Path;

import com.syntex.natiq.error.MalformedInputException;
import com.syntex.natiq.error.Stage;

import lombok.Value;

/**
 * Language and translator encoded in a Tanzil translation file name, e.g.
 * {@code en.mahdi.xml}.
 */
@Value
public class TranslationFileName {

    String language;
    String author;
    String extension;

    /** Accepts a bare file name or a path; only the last segment is used. */
    public static TranslationFileName parse(String path) throws MalformedInputException {
        Path fileName = Path.of(path).getFileName();
        String name = fileName == null ? path : fileName.toString();
        String[] parts = name.split("\\.", -1);
        if (parts.length != 3) {
            throw new MalformedInputException(Stage.METADATA, name,
                    "expected {language}.{author}.{extension} but found " + parts.length + " dot separated segments");
        }
        for (String part : parts) {
            if (part.isBlank()) {
                throw new MalformedInputException(Stage.METADATA, name,
                        "expected {language}.{author}.{extension} but a segment is empty");
            }
        }
        return new TranslationFileName(parts[0], parts[1], parts[2]);
    }

    public TranslationFileName requireExtension(String expected) throws MalformedInputException {
        if (!extension.equalsIgnoreCase(expected)) {
            throw new MalformedInputException(Stage.METADATA, fileName(),
                    "unsupported extension '" + extension + "', only ." + expected + " translations can be parsed");
        }
        return this;
    }

    public String fileName() {
        return language + "." + author + "." + extension;
    }
}

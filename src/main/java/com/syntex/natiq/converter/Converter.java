package com.syntex.natiq.converter;

import java.io.IOException;
import java.io.InputStream;

import com.syntex.natiq.error.ConversionException;
import com.syntex.natiq.error.Stage;

public interface Converter<T> {
    String getName();  // e.g. "quran-hafs", "en.mahdi"

    /**
     * Reads the whole stream and converts it into a validated tree.
     */
    T convert(InputStream inputStream) throws ConversionException;

    static byte[] readAll(InputStream inputStream, String file) throws ConversionException {
        try {
            return inputStream.readAllBytes();
        } catch (IOException e) {
            throw new ConversionException(Stage.READ, file, "could not read source: " + e.getMessage(), e);
        }
    }
}

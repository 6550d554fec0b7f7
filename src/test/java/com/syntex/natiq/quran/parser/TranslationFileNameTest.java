package com.syntex.natiq.quran.parser;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.syntex.natiq.error.MalformedInputException;
import com.syntex.natiq.error.Stage;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
public class TranslationFileNameTest {

    @Test void testParse() throws MalformedInputException {
        TranslationFileName name = TranslationFileName.parse("en.mahdi.xml");
        assertEquals("en", name.getLanguage());
        assertEquals("mahdi", name.getAuthor());
        assertEquals("xml", name.getExtension());
    }

    @Test void testParseUsesLastPathSegment() throws MalformedInputException {
        TranslationFileName name = TranslationFileName.parse("/data/tanzil.net/translations/fa.makarem.xml");
        assertEquals("fa", name.getLanguage());
        assertEquals("makarem", name.getAuthor());
    }

    @Test void testTooManySegments() {
        MalformedInputException e = assertThrows(MalformedInputException.class,
                () -> TranslationFileName.parse("en.mahdi.extra.xml"));
        assertEquals(Stage.METADATA, e.getStage());
        assertEquals("en.mahdi.extra.xml", e.getFile());
        assertTrue(e.getMessage().contains("4"), e.getMessage());
    }

    @Test void testTooFewSegments() {
        assertThrows(MalformedInputException.class, () -> TranslationFileName.parse("en.xml"));
        assertThrows(MalformedInputException.class, () -> TranslationFileName.parse("README"));
    }

    @Test void testEmptySegment() {
        assertThrows(MalformedInputException.class, () -> TranslationFileName.parse("en..xml"));
        assertThrows(MalformedInputException.class, () -> TranslationFileName.parse(".mahdi.xml"));
    }

    @Test void testRequireExtension() throws MalformedInputException {
        assertDoesNotThrow(() -> TranslationFileName.parse("en.mahdi.XML").requireExtension("xml"));
        TranslationFileName text = TranslationFileName.parse("en.mahdi.txt");
        MalformedInputException e = assertThrows(MalformedInputException.class, () -> text.requireExtension("xml"));
        assertEquals(Stage.METADATA, e.getStage());
    }
}

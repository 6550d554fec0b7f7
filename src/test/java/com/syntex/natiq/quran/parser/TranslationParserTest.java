package com.syntex.natiq.quran.parser;

import java.time.LocalDate;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.syntex.natiq.Fixtures;
import com.syntex.natiq.error.MalformedInputException;
import com.syntex.natiq.quran.model.AyahTranslation;
import com.syntex.natiq.quran.model.Translation;
import com.syntex.natiq.quran.model.TranslationSurah;
import com.syntex.natiq.quran.text.TextCleanser;

import static com.syntex.natiq.Fixtures.aya;
import static com.syntex.natiq.Fixtures.document;
import static com.syntex.natiq.Fixtures.sura;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Tag("unit")
public class TranslationParserTest {

    private static final TranslationInfo INFO = new TranslationInfo("hafs", "en", "tanzil.net", "sample", null);

    private static Translation parse(String xml, TranslationInfo info) throws MalformedInputException {
        return new TranslationParser("en.sample.xml").parse(XmlDocuments.parse(xml, "en.sample.xml"), info);
    }

    @Test void testFixture() throws MalformedInputException {
        String xml = TextCleanser.stripComments(Fixtures.bytes(Fixtures.TRANSLATION));
        Translation translation = parse(xml, INFO);

        assertEquals("hafs", translation.getMushaf());
        assertEquals("en", translation.getLanguage());
        assertEquals("tanzil.net", translation.getSource());
        assertEquals("sample", translation.getTranslatorUsername());
        assertNull(translation.getReleaseDate());
        assertEquals("In the name of God, the Gracious, the Merciful.", translation.getBismillahText());
        assertEquals(3, translation.getSurahs().size());
        assertEquals(6, translation.ayahCount());

        TranslationSurah baqara = translation.getSurahs().get(1);
        assertEquals(2, baqara.getNumber());
        assertEquals("The Heifer", baqara.getName());
        assertEquals("This is the Book in which there&quot;s no doubt, a guidance for the righteous.",
                baqara.getAyahTranslations().get(1).getText());

        AyahTranslation last = translation.getSurahs().get(2).getAyahTranslations().get(1);
        assertEquals(19, last.getNumber());
        assertEquals("No! Don&quot;t obey him; but kneel down and draw near.", last.getText());
    }

    @Test void testRawFixtureIsNotWellFormed() {
        String raw = new String(Fixtures.bytes(Fixtures.TRANSLATION), java.nio.charset.StandardCharsets.UTF_8);
        assertThrows(MalformedInputException.class, () -> XmlDocuments.parse(raw, "en.sample.xml"));
    }

    @Test void testSampleTextIsNotEscaped() throws MalformedInputException {
        Translation translation = parse(document(sura(1, "The Opening", aya(1, "In God's name"))), INFO);
        assertEquals("In God's name", translation.getBismillahText());
        assertEquals("In God&quot;s name", translation.getSurahs().get(0).getAyahTranslations().get(0).getText());
    }

    @Test void testReleaseDateCopied() throws MalformedInputException {
        TranslationInfo info = new TranslationInfo("hafs", "en", "tanzil.net", "sample", LocalDate.of(2021, 5, 1));
        Translation translation = parse(document(sura(1, "The Opening", aya(1, "x"))), info);
        assertEquals(LocalDate.of(2021, 5, 1), translation.getReleaseDate());
    }

    @Test void testMissingText() {
        String xml = document(sura(1, "The Opening", "<aya index=\"1\"/>"));
        assertThrows(MalformedInputException.class, () -> parse(xml, INFO));
    }

    @Test void testNoSurahs() {
        assertThrows(MalformedInputException.class, () -> parse(document(), INFO));
    }
}

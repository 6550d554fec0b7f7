package com.syntex.natiq;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;

import com.syntex.natiq.converter.QuranConverter;
import com.syntex.natiq.error.ConversionException;
import com.syntex.natiq.quran.SourceValidator;
import com.syntex.natiq.quran.model.Mushaf;
import com.syntex.natiq.quran.model.Quran;
import com.syntex.natiq.quran.parser.ParserOptions;
import com.syntex.natiq.quran.text.TextCleanser;

/**
 * Test resources under {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

    public static final String QURAN = "quran-mini.xml";
    public static final String TRANSLATION = "translations/en.sample.xml";
    public static final Mushaf HAFS = new Mushaf("hafs", "Hafs an Asim", "tanzil");

    /** Code points of the basmala as written in the Tanzil Uthmani text, word by word. */
    private static final int[][] BASMALA_WORDS = {
            {0x0628, 0x0650, 0x0633, 0x0652, 0x0645, 0x0650},
            {0x0671, 0x0644, 0x0644, 0x0651, 0x064E, 0x0647, 0x0650},
            {0x0671, 0x0644, 0x0631, 0x0651, 0x064E, 0x062D, 0x0652, 0x0645, 0x064E, 0x0640, 0x0670, 0x0646, 0x0650},
            {0x0671, 0x0644, 0x0631, 0x0651, 0x064E, 0x062D, 0x0650, 0x064A, 0x0645, 0x0650},
    };

    /** The Tanzil basmala, built without {@link TextCleanser#BISMILLAH}. */
    public static final String TANZIL_BASMALA = basmala();

    private Fixtures() {
    }

    public static byte[] bytes(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalStateException("missing fixture " + name);
            }
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Path path(String name) {
        URL url = Fixtures.class.getResource("/fixtures/" + name);
        if (url == null) {
            throw new IllegalStateException("missing fixture " + name);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static String quranDigest() {
        return SourceValidator.digest(bytes(QURAN));
    }

    /** The mini Quran fixture, verified against its own digest and parsed. */
    public static Quran quran() throws ConversionException {
        byte[] raw = bytes(QURAN);
        return new QuranConverter(HAFS, SourceValidator.digest(raw), ParserOptions.defaults(), QURAN)
                .convert(new ByteArrayInputStream(raw));
    }

    /** Wrap sura elements in a Tanzil root element. */
    public static String document(String... suras) {
        return "<?xml version=\"1.0\" encoding=\"utf-8\" ?>\n<quran>\n" + String.join("\n", suras) + "\n</quran>\n";
    }

    public static String sura(int index, String name, String... ayas) {
        return "<sura index=\"" + index + "\" name=\"" + name + "\">" + String.join("", ayas) + "</sura>";
    }

    public static String aya(int index, String text) {
        return "<aya index=\"" + index + "\" text=\"" + text + "\"/>";
    }

    public static String aya(int index, String text, String bismillah) {
        return "<aya index=\"" + index + "\" text=\"" + text + "\" bismillah=\"" + bismillah + "\"/>";
    }

    public static String basmalaAya(int index) {
        return aya(index, TANZIL_BASMALA);
    }

    private static String basmala() {
        StringBuilder text = new StringBuilder();
        for (int[] word : BASMALA_WORDS) {
            if (text.length() > 0) {
                text.append(' ');
            }
            for (int codePoint : word) {
                text.appendCodePoint(codePoint);
            }
        }
        return text.toString();
    }
}

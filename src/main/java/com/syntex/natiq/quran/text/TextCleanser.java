package com.syntex.natiq.quran.text;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Text level cleanup applied before and during parsing.
 */
public final class TextCleanser {

    /** The basmala exactly as the Tanzil Uthmani source spells it. */
    public static final String BISMILLAH = "\u0628\u0650\u0633\u0652\u0645\u0650 \u0671\u0644\u0644\u0651\u064E\u0647\u0650 \u0671\u0644\u0631\u0651\u064E\u062D\u0652\u0645\u064E\u0640\u0670\u0646\u0650 \u0671\u0644\u0631\u0651\u064E\u062D\u0650\u064A\u0645\u0650";

    /** ARABIC PLACE OF SAJDAH (U+06E9). */
    public static final String SAJDAH_GLYPH = "\u06E9";

    // Tanzil translations ship comments that are not well formed XML ("--" inside)
    private static final Pattern COMMENT = Pattern.compile("<!--.*?-->", Pattern.DOTALL);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextCleanser() {
    }

    /**
     * Decode UTF-8 bytes and drop every {@code <!-- ... -->} block, including
     * ones spanning lines and ones directly adjacent to each other.
     */
    public static String stripComments(byte[] raw) {
        return stripComments(new String(raw, StandardCharsets.UTF_8));
    }

    public static String stripComments(String source) {
        return COMMENT.matcher(source).replaceAll("");
    }

    public static String stripSajdahGlyph(String text) {
        return text.replace(SAJDAH_GLYPH, "");
    }

    /**
     * Split ayah text into words after removing the sajdah glyph. Runs of
     * whitespace count as one separator and empty tokens are dropped.
     */
    public static List<String> tokenize(String text) {
        String cleaned = stripSajdahGlyph(text).strip();
        if (cleaned.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(WHITESPACE.split(cleaned))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Replace every apostrophe with {@code &quot;}. Downstream loaders depend
     * on this exact substitution even though the entity names a double quote.
     */
    public static String escapeQuotes(String text) {
        return text.replace("'", "&quot;");
    }

    /**
     * When {@code text} starts with the basmala followed by more of the ayah,
     * return what follows it.
     */
    public static Optional<String> separateBismillah(String text) {
        if (!text.startsWith(BISMILLAH + " ")) {
            return Optional.empty();
        }
        String rest = text.substring(BISMILLAH.length()).strip();
        return rest.isEmpty() ? Optional.empty() : Optional.of(rest);
    }
}

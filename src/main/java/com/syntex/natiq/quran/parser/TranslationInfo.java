package com.syntex.natiq.quran.parser;

import java.time.LocalDate;

import lombok.Value;

/**
 * Metadata a translation carries that is not in its XML.
 */
@Value
public class TranslationInfo {
    String mushaf;
    String language;
    String source;
    String translatorUsername;
    LocalDate releaseDate;
}

package com.syntex.natiq.quran.model;

import lombok.Value;

@Value
public class AyahTranslation {
    int number;
    /** Translated text with every apostrophe replaced by {@code &quot;}. */
    String text;
}

package com.syntex.natiq.quran.model;

import java.util.List;

import lombok.Value;

@Value
public class TranslationSurah {
    int number;
    String name;
    List<AyahTranslation> ayahTranslations;
}

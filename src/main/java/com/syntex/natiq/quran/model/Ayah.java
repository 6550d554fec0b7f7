package com.syntex.natiq.quran.model;

import java.util.List;

import lombok.Value;

@Value
public class Ayah {

    int number;
    Sajdah sajdah;
    boolean isBismillah;
    /** Declared or separated preface text; null when the ayah has none. */
    String bismillahText;
    List<Word> words;
}

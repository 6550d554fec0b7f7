package com.syntex.natiq.quran.model;

import java.util.List;

import lombok.Value;

@Value
public class Surah {

    String name;
    int number;
    Period period;
    /** True when the surah opens with the bismillah in any form. */
    boolean bismillahStatus;
    /** True when the first ayah is the bismillah itself (al-Fatiha convention). */
    boolean bismillahAsFirstAyah;
    List<Ayah> ayahs;
}

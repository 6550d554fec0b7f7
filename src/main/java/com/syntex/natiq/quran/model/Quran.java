package com.syntex.natiq.quran.model;

import java.util.List;

import lombok.Value;

/**
 * Root of one converted Quran document. Owns the whole surah, ayah and word
 * tree for the duration of a run.
 */
@Value
public class Quran {

    Mushaf mushaf;
    List<Surah> surahs;

    public int ayahCount() {
        return surahs.stream().mapToInt(s -> s.getAyahs().size()).sum();
    }

    public int wordCount() {
        return surahs.stream()
                .flatMap(s -> s.getAyahs().stream())
                .mapToInt(a -> a.getWords().size())
                .sum();
    }
}

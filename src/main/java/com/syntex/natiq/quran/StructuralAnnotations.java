package com.syntex.natiq.quran;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.syntex.natiq.error.LookupGapException;
import com.syntex.natiq.quran.model.Period;
import com.syntex.natiq.quran.model.Sajdah;

/**
 * Static classification tables for surahs and ayat. Both tables are fixed
 * scholarly data and are never written after class initialisation.
 */
public final class StructuralAnnotations {

    public static final int SURAH_COUNT = 114;

    private static final Set<Integer> MADANI_SURAHS = Set.of(
            2, 3, 4, 5, 8, 9, 13, 22, 24, 33, 47, 48, 49, 55,
            57, 58, 59, 60, 61, 62, 63, 64, 65, 66, 76, 98, 99, 110);

    private static final Map<Integer, Period> PERIODS;
    private static final Map<VerseKey, Sajdah> SAJDAHS;

    static {
        Map<Integer, Period> periods = new HashMap<>();
        for (int surah = 1; surah <= SURAH_COUNT; surah++) {
            periods.put(surah, MADANI_SURAHS.contains(surah) ? Period.MADANI : Period.MAKKI);
        }
        PERIODS = Collections.unmodifiableMap(periods);

        SAJDAHS = Map.ofEntries(
                Map.entry(new VerseKey(32, 15), Sajdah.VAJIB),
                Map.entry(new VerseKey(41, 37), Sajdah.VAJIB),
                Map.entry(new VerseKey(53, 62), Sajdah.VAJIB),
                Map.entry(new VerseKey(96, 19), Sajdah.VAJIB),
                Map.entry(new VerseKey(7, 206), Sajdah.MUSTAHAB),
                Map.entry(new VerseKey(13, 15), Sajdah.MUSTAHAB),
                Map.entry(new VerseKey(16, 50), Sajdah.MUSTAHAB),
                Map.entry(new VerseKey(17, 109), Sajdah.MUSTAHAB),
                Map.entry(new VerseKey(19, 58), Sajdah.MUSTAHAB),
                Map.entry(new VerseKey(22, 18), Sajdah.MUSTAHAB),
                Map.entry(new VerseKey(25, 60), Sajdah.MUSTAHAB),
                Map.entry(new VerseKey(27, 26), Sajdah.MUSTAHAB),
                Map.entry(new VerseKey(38, 24), Sajdah.MUSTAHAB),
                Map.entry(new VerseKey(84, 21), Sajdah.MUSTAHAB));
    }

    private StructuralAnnotations() {
    }

    public static Optional<Period> findPeriod(int surah) {
        return Optional.ofNullable(PERIODS.get(surah));
    }

    /** Period of a surah read from {@code file}; a number outside 1..114 is a lookup gap. */
    public static Period periodOf(int surah, String file) throws LookupGapException {
        return findPeriod(surah).orElseThrow(() -> new LookupGapException(file, surah));
    }

    public static Sajdah sajdahOf(int surah, int ayah) {
        return SAJDAHS.getOrDefault(new VerseKey(surah, ayah), Sajdah.NONE);
    }

    /** Every (surah, ayah) pair that carries a sajdah, with its classification. */
    public static Map<VerseKey, Sajdah> sajdahTable() {
        return SAJDAHS;
    }

    public record VerseKey(int surah, int ayah) {
    }
}

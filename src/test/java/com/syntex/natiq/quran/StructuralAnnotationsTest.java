package com.syntex.natiq.quran;

import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.syntex.natiq.error.LookupGapException;
import com.syntex.natiq.quran.StructuralAnnotations.VerseKey;
import com.syntex.natiq.quran.model.Period;
import com.syntex.natiq.quran.model.Sajdah;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
public class StructuralAnnotationsTest {

    private static final Set<Integer> MADANI = Set.of(
            2, 3, 4, 5, 8, 9, 13, 22, 24, 33, 47, 48, 49, 55, 57, 58, 59, 60,
            61, 62, 63, 64, 65, 66, 76, 98, 99, 110);

    @Test void testPeriodTableHasNoGaps() {
        for (int surah = 1; surah <= StructuralAnnotations.SURAH_COUNT; surah++) {
            assertTrue(StructuralAnnotations.findPeriod(surah).isPresent(), "surah " + surah);
        }
    }

    @Test void testPeriodCounts() {
        int madani = 0;
        for (int surah = 1; surah <= 114; surah++) {
            if (StructuralAnnotations.findPeriod(surah).orElseThrow() == Period.MADANI) {
                madani++;
            }
        }
        assertEquals(28, madani);
    }

    @Test void testEveryPeriod() throws LookupGapException {
        for (int surah = 1; surah <= 114; surah++) {
            Period expected = MADANI.contains(surah) ? Period.MADANI : Period.MAKKI;
            assertEquals(expected, StructuralAnnotations.periodOf(surah, "quran.xml"), "surah " + surah);
        }
    }

    @Test void testPeriodOutsideTable() {
        assertFalse(StructuralAnnotations.findPeriod(0).isPresent());
        assertFalse(StructuralAnnotations.findPeriod(115).isPresent());
        LookupGapException e = assertThrows(LookupGapException.class,
                () -> StructuralAnnotations.periodOf(115, "quran.xml"));
        assertEquals(115, e.getSurahNumber());
        assertEquals("quran.xml", e.getFile());
    }

    @Test void testSajdahTable() {
        Map<VerseKey, Sajdah> table = StructuralAnnotations.sajdahTable();
        assertEquals(14, table.size());
        assertEquals(4, table.values().stream().filter(s -> s == Sajdah.VAJIB).count());
        assertEquals(10, table.values().stream().filter(s -> s == Sajdah.MUSTAHAB).count());
    }

    @Test void testKnownSajdahs() {
        assertEquals(Sajdah.VAJIB, StructuralAnnotations.sajdahOf(32, 15));
        assertEquals(Sajdah.VAJIB, StructuralAnnotations.sajdahOf(96, 19));
        assertEquals(Sajdah.MUSTAHAB, StructuralAnnotations.sajdahOf(7, 206));
        assertEquals(Sajdah.MUSTAHAB, StructuralAnnotations.sajdahOf(84, 21));
        assertEquals(Sajdah.NONE, StructuralAnnotations.sajdahOf(1, 1));
        assertEquals(Sajdah.NONE, StructuralAnnotations.sajdahOf(32, 16));
        assertEquals(Sajdah.NONE, StructuralAnnotations.sajdahOf(15, 32));
    }

    @Test void testOnlyListedPairsCarrySajdah() {
        Map<VerseKey, Sajdah> table = StructuralAnnotations.sajdahTable();
        for (int surah = 1; surah <= 114; surah++) {
            for (int ayah = 1; ayah <= 286; ayah++) {
                Sajdah sajdah = StructuralAnnotations.sajdahOf(surah, ayah);
                if (table.containsKey(new VerseKey(surah, ayah))) {
                    assertNotEquals(Sajdah.NONE, sajdah);
                } else {
                    assertEquals(Sajdah.NONE, sajdah, surah + ":" + ayah);
                }
            }
        }
    }
}

package com.syntex.natiq.error;

/**
 * A surah number the revelation period table does not cover. The table is
 * exhaustive for 1..114, so this always points at a corrupt source.
 */
public class LookupGapException extends ConversionException {

    private final int surahNumber;

    public LookupGapException(String file, int surahNumber) {
        super(Stage.ANNOTATE, file, "no revelation period for surah " + surahNumber + " (expected 1..114)");
        this.surahNumber = surahNumber;
    }

    public int getSurahNumber() {
        return surahNumber;
    }
}

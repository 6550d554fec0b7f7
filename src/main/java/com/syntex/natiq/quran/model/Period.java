package com.syntex.natiq.quran.model;

import com.google.gson.annotations.SerializedName;

/**
 * Revelation period of a surah.
 */
public enum Period {
    @SerializedName("makki")
    MAKKI("makki"),
    @SerializedName("madani")
    MADANI("madani");

    private final String label;

    Period(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}

package com.syntex.natiq.quran.model;

import com.google.gson.annotations.SerializedName;

/**
 * Prostration classification of an ayah.
 */
public enum Sajdah {
    @SerializedName("vajib")
    VAJIB("vajib"),
    @SerializedName("mustahab")
    MUSTAHAB("mustahab"),
    @SerializedName("none")
    NONE("none");

    private final String label;

    Sajdah(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}

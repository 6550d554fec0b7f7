package com.syntex.natiq.env;

public enum EnvKey {
    DEBUG("DEBUG"),
    NATIQ_QURAN_DIGEST("NATIQ_QURAN_DIGEST"),
    NATIQ_TRANSLATION_SOURCE("NATIQ_TRANSLATION_SOURCE"),
    NATIQ_OUTPUT_DIR("NATIQ_OUTPUT_DIR");

    private final String key;

    EnvKey(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}

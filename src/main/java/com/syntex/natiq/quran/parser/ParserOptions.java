package com.syntex.natiq.quran.parser;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ParserOptions {

    /**
     * Move a basmala that prefixes the first words of an ayah into
     * {@code bismillah_text}, leaving only the ayah proper as words.
     */
    @Builder.Default
    boolean separateBismillah = false;

    public static ParserOptions defaults() {
        return ParserOptions.builder().build();
    }
}

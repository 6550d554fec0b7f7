package com.syntex.natiq.quran.model;

import java.time.LocalDate;
import java.util.List;

import lombok.Value;

/**
 * Root of one converted translation document.
 */
@Value
public class Translation {

    /** Short name of the mushaf this translation is aligned to. */
    String mushaf;
    String language;
    String source;
    /** Literal text of the first translated ayah, used as a display sample. */
    String bismillahText;
    String translatorUsername;
    LocalDate releaseDate;
    List<TranslationSurah> surahs;

    public int ayahCount() {
        return surahs.stream().mapToInt(s -> s.getAyahTranslations().size()).sum();
    }
}

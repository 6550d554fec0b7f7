package com.syntex.natiq.export;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.syntex.natiq.error.MalformedInputException;
import com.syntex.natiq.error.Stage;
import com.syntex.natiq.quran.StructuralAnnotations.VerseKey;
import com.syntex.natiq.quran.model.Ayah;
import com.syntex.natiq.quran.model.AyahTranslation;
import com.syntex.natiq.quran.model.Quran;
import com.syntex.natiq.quran.model.Surah;
import com.syntex.natiq.quran.model.Translation;
import com.syntex.natiq.quran.model.TranslationSurah;
import com.syntex.natiq.quran.model.Word;
import com.syntex.natiq.quran.text.TextCleanser;

/**
 * Flattens converted trees into row batches for the relational loader.
 * <p>
 * Surah and ayah ids are ordinal positions starting at 1, which is what a
 * fresh store assigns when the batches are loaded in order. Ayah ids run
 * across the whole mushaf.
 */
public class RowExporter {

    public static final String MUSHAFS = "mushafs";
    public static final String QURAN_SURAHS = "quran_surahs";
    public static final String QURAN_AYAHS = "quran_ayahs";
    public static final String QURAN_WORDS = "quran_words";
    public static final String TRANSLATIONS_TEXT = "translations_text";

    private final Quran quran;
    private final int mushafId;
    private final Map<VerseKey, Integer> ayahIds = new HashMap<>();

    /**
     * @param file source of {@code quran}, named when a (surah, ayah)
     *             coordinate occurs twice and ids could not be aligned
     */
    public RowExporter(Quran quran, int mushafId, String file) throws MalformedInputException {
        this.quran = quran;
        this.mushafId = mushafId;
        int ayahId = 1;
        for (Surah surah : quran.getSurahs()) {
            for (Ayah ayah : surah.getAyahs()) {
                Integer previous = ayahIds.putIfAbsent(new VerseKey(surah.getNumber(), ayah.getNumber()), ayahId);
                if (previous != null) {
                    throw new MalformedInputException(Stage.ALIGN, file, "ayah " + surah.getNumber() + ":"
                            + ayah.getNumber() + " occurs twice (ayah ids " + previous + " and " + ayahId + ")");
                }
                ayahId++;
            }
        }
    }

    /** mushafs, quran_surahs, quran_ayahs and quran_words, in load order. */
    public List<RowBatch> quranBatches() {
        return List.of(mushafRows(), surahRows(), ayahRows(), wordRows());
    }

    public RowBatch mushafRows() {
        List<List<String>> rows = List.of(List.of(
                String.valueOf(mushafId),
                quran.getMushaf().getShortName(),
                quran.getMushaf().getSourceLabel(),
                TextCleanser.BISMILLAH));
        return new RowBatch(MUSHAFS, List.of("id", "name", "source", "bismillah_text"), rows);
    }

    public RowBatch surahRows() {
        List<List<String>> rows = new ArrayList<>();
        for (Surah surah : quran.getSurahs()) {
            rows.add(List.of(
                    surah.getName(),
                    surah.getPeriod().label(),
                    String.valueOf(surah.getNumber()),
                    String.valueOf(surah.isBismillahStatus()),
                    String.valueOf(surah.isBismillahAsFirstAyah()),
                    String.valueOf(mushafId)));
        }
        return new RowBatch(QURAN_SURAHS,
                List.of("name", "period", "number", "bismillah_status", "bismillah_as_first_ayah", "mushaf_id"),
                List.copyOf(rows));
    }

    public RowBatch ayahRows() {
        List<List<String>> rows = new ArrayList<>();
        int surahId = 1;
        for (Surah surah : quran.getSurahs()) {
            for (Ayah ayah : surah.getAyahs()) {
                rows.add(List.of(
                        String.valueOf(surahId),
                        String.valueOf(ayah.getNumber()),
                        ayah.getSajdah().label()));
            }
            surahId++;
        }
        return new RowBatch(QURAN_AYAHS, List.of("surah_id", "ayah_number", "sajdah"), List.copyOf(rows));
    }

    public RowBatch wordRows() {
        List<List<String>> rows = new ArrayList<>();
        int ayahId = 1;
        for (Surah surah : quran.getSurahs()) {
            for (Ayah ayah : surah.getAyahs()) {
                for (Word word : ayah.getWords()) {
                    rows.add(List.of(String.valueOf(ayahId), word.getText()));
                }
                ayahId++;
            }
        }
        return new RowBatch(QURAN_WORDS, List.of("ayah_id", "word"), List.copyOf(rows));
    }

    /**
     * translations_text rows for one translation. Every translated ayah must
     * exist in the mushaf; a coordinate the mushaf lacks is an alignment error.
     */
    public RowBatch translationRows(Translation translation, int translationId, String file)
            throws MalformedInputException {
        List<List<String>> rows = new ArrayList<>();
        for (TranslationSurah surah : translation.getSurahs()) {
            for (AyahTranslation ayah : surah.getAyahTranslations()) {
                Integer ayahId = ayahIds.get(new VerseKey(surah.getNumber(), ayah.getNumber()));
                if (ayahId == null) {
                    throw new MalformedInputException(Stage.ALIGN, file, "translated ayah " + surah.getNumber() + ":"
                            + ayah.getNumber() + " does not exist in mushaf " + quran.getMushaf().getShortName());
                }
                rows.add(List.of(ayah.getText(), String.valueOf(translationId), String.valueOf(ayahId)));
            }
        }
        return new RowBatch(TRANSLATIONS_TEXT, List.of("text", "translation_id", "ayah_id"), List.copyOf(rows));
    }

    /** Concatenate batches of the same table, keeping their order. */
    public static RowBatch merge(String table, List<String> columns, List<RowBatch> batches) {
        List<List<String>> rows = new ArrayList<>();
        for (RowBatch batch : batches) {
            if (!batch.getTable().equals(table)) {
                throw new IllegalArgumentException("cannot merge " + batch.getTable() + " into " + table);
            }
            rows.addAll(batch.getRows());
        }
        return new RowBatch(table, columns, List.copyOf(rows));
    }
}

package com.syntex.natiq.export;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.opencsv.CSVReader;
import com.syntex.natiq.quran.text.TextCleanser;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
public class CsvRowWriterTest {

    @Test void testWriteWithHeader(@TempDir Path tmp) throws Exception {
        RowBatch batch = new RowBatch("translations_text", List.of("text", "translation_id", "ayah_id"), List.of(
                List.of("In the name of God, the Gracious", "1", "1"),
                List.of("say \"peace\"", "1", "2"),
                List.of(TextCleanser.BISMILLAH, "2", "1")));

        Path target = new CsvRowWriter(tmp.resolve("rows")).write(batch);
        assertEquals(tmp.resolve("rows").resolve("translations_text.csv"), target);

        List<String[]> lines;
        try (Reader in = Files.newBufferedReader(target, StandardCharsets.UTF_8); CSVReader csv = new CSVReader(in)) {
            lines = csv.readAll();
        }
        assertEquals(4, lines.size());
        assertArrayEquals(new String[] {"text", "translation_id", "ayah_id"}, lines.get(0));
        for (int i = 0; i < batch.size(); i++) {
            assertEquals(batch.getRows().get(i), Arrays.asList(lines.get(i + 1)));
        }
    }

    @Test void testHeaderOnlyForEmptyBatch(@TempDir Path tmp) throws Exception {
        RowBatch words = new RowBatch("quran_words", List.of("ayah_id", "word"), List.of(List.of("1", "alif")));
        RowBatch ayahs = new RowBatch("quran_ayahs", List.of("surah_id", "ayah_number", "sajdah"), List.of());

        CsvRowWriter writer = new CsvRowWriter(tmp);
        writer.write(words);
        writer.write(ayahs);
        assertTrue(Files.exists(tmp.resolve("quran_words.csv")));
        assertEquals(1, Files.readAllLines(tmp.resolve("quran_ayahs.csv"), StandardCharsets.UTF_8).size());
    }
}

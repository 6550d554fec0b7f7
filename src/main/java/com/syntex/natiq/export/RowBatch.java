package com.syntex.natiq.export;

import java.util.List;

import lombok.Value;

/**
 * Rows for one external table, e.g. {@code quran_words(ayah_id, word)}.
 * Values are already rendered as text.
 */
@Value
public class RowBatch {

    String table;
    List<String> columns;
    List<List<String>> rows;

    /** Table reference in {@code name(col, col, ...)} form. */
    public String schema() {
        return table + "(" + String.join(", ", columns) + ")";
    }

    public int size() {
        return rows.size();
    }
}

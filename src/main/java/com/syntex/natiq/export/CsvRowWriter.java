package com.syntex.natiq.export;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.opencsv.CSVWriter;
import com.syntex.natiq.error.ConversionException;
import com.syntex.natiq.error.Stage;

/**
 * Writes each {@link RowBatch} to {@code <dir>/<table>.csv} with a header row.
 */
public class CsvRowWriter {

    private static final Logger LOG = LoggerFactory.getLogger(CsvRowWriter.class);

    private final Path directory;

    public CsvRowWriter(Path directory) {
        this.directory = directory;
    }

    public Path write(RowBatch batch) throws ConversionException {
        Path target = directory.resolve(batch.getTable() + ".csv");
        try {
            Files.createDirectories(directory);
            try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
                 CSVWriter csv = new CSVWriter(out)) {
                csv.writeNext(batch.getColumns().toArray(String[]::new));
                for (List<String> row : batch.getRows()) {
                    csv.writeNext(row.toArray(String[]::new));
                }
            }
        } catch (IOException e) {
            throw new ConversionException(Stage.WRITE, target.toString(), "could not write rows: " + e.getMessage(), e);
        }
        LOG.debug("wrote {} rows of {} to {}", batch.size(), batch.schema(), target);
        return target;
    }
}

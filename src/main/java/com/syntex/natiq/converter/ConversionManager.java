package com.syntex.natiq.converter;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.syntex.natiq.error.ConversionException;
import com.syntex.natiq.error.IntegrityException;
import com.syntex.natiq.error.MalformedInputException;
import com.syntex.natiq.error.Stage;
import com.syntex.natiq.export.JsonExporter;

/**
 * Runs conversions one file at a time and writes each result as JSON. A bad
 * file is reported and skipped; an integrity failure stops the whole run.
 */
public class ConversionManager {

    private static final Logger LOG = LoggerFactory.getLogger(ConversionManager.class);

    private final JsonExporter exporter;

    public ConversionManager(JsonExporter exporter) {
        this.exporter = exporter;
    }

    public ConversionReport runConversions(List<ConversionTask> tasks) {
        ConversionReport report = new ConversionReport();
        for (ConversionTask task : tasks) {
            if (!runOne(task, report)) {
                break;
            }
        }
        return report;
    }

    /**
     * Convert every {@code {language}.{author}.xml} file in {@code directory}
     * (sorted by name) to {@code {language}.{author}.json} in {@code outputDir}.
     */
    public ConversionReport runTranslationDirectory(Path directory, Path outputDir, String mushaf, String source,
            LocalDate releaseDate) throws ConversionException {
        List<Path> files = listFiles(directory);
        LOG.info("Found {} translation files in {}", files.size(), directory);

        ConversionReport report = new ConversionReport();
        for (Path file : files) {
            String name = file.getFileName().toString();
            TranslationConverter converter;
            try {
                converter = TranslationConverter.forFile(file, mushaf, source, releaseDate);
            } catch (MalformedInputException e) {
                LOG.warn("Skipping {}: {}", name, e.getMessage());
                report.addFailure(name, e);
                continue;
            }
            Path output = outputDir.resolve(converter.getName() + ".json");
            if (!runOne(new ConversionTask(converter, file, output), report)) {
                break;
            }
        }
        return report;
    }

    /** Returns false when the run must stop. */
    private boolean runOne(ConversionTask task, ConversionReport report) {
        String name = task.converter().getName();
        LOG.info("Converting {} ...", name);
        try (InputStream in = Files.newInputStream(task.source())) {
            Object tree = task.converter().convert(in);
            exporter.write(tree, task.output());
            report.addSuccess(name, task.output());
            return true;
        } catch (IntegrityException e) {
            LOG.error("Aborting run, {}", e.getMessage());
            report.addFailure(name, e);
            report.abort();
            return false;
        } catch (ConversionException e) {
            LOG.error("Conversion failed for {}: {}", name, e.getMessage());
            report.addFailure(name, e);
            return true;
        } catch (IOException e) {
            LOG.error("Could not read {}: {}", task.source(), e.getMessage());
            report.addFailure(name, new ConversionException(Stage.READ, task.source().toString(),
                    "could not read source: " + e.getMessage(), e));
            return true;
        }
    }

    /** Regular files of a directory, sorted by name. */
    public static List<Path> listFiles(Path directory) throws ConversionException {
        if (!Files.isDirectory(directory)) {
            throw new ConversionException(Stage.READ, directory.toString(), "not a directory");
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.filter(Files::isRegularFile).sorted().toList();
        } catch (IOException e) {
            throw new ConversionException(Stage.READ, directory.toString(), "could not list directory: " + e.getMessage(), e);
        }
    }

    public record ConversionTask(Converter<?> converter, Path source, Path output) {}
}

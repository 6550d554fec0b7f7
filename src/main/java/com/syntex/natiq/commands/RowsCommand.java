package com.syntex.natiq.commands;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import com.syntex.natiq.Config;
import com.syntex.natiq.cli.CommandCategory;
import com.syntex.natiq.cli.Console;
import com.syntex.natiq.converter.ConversionManager;
import com.syntex.natiq.converter.QuranConverter;
import com.syntex.natiq.converter.TranslationConverter;
import com.syntex.natiq.error.ConversionException;
import com.syntex.natiq.export.CsvRowWriter;
import com.syntex.natiq.export.RowBatch;
import com.syntex.natiq.export.RowExporter;
import com.syntex.natiq.quran.model.Mushaf;
import com.syntex.natiq.quran.model.Quran;
import com.syntex.natiq.quran.model.Translation;
import com.syntex.natiq.quran.parser.ParserOptions;

import picocli.CommandLine;

@CommandLine.Command(
        name = "rows",
        description = "Write mushafs, quran_surahs, quran_ayahs, quran_words and translations_text rows as CSV files"
)
@CommandCategory("Export")
public class RowsCommand implements Callable<Integer> {

    private static final List<String> TRANSLATION_COLUMNS = List.of("text", "translation_id", "ayah_id");

    @CommandLine.Parameters(index = "0", paramLabel = "XML_FILE", description = "Tanzil Quran XML")
    private Path xmlFile;

    @CommandLine.Option(names = {"--short-name"}, description = "Mushaf short name (default: ${DEFAULT-VALUE})")
    private String shortName = "hafs";

    @CommandLine.Option(names = {"--full-name"}, description = "Mushaf full name (default: ${DEFAULT-VALUE})")
    private String fullName = "Hafs an Asim";

    @CommandLine.Option(names = {"--mushaf-source"}, description = "Mushaf source label (default: ${DEFAULT-VALUE})")
    private String mushafSource = "tanzil";

    @CommandLine.Option(names = {"--mushaf-id"}, description = "Primary key of the mushaf row (default: ${DEFAULT-VALUE})")
    private int mushafId = 1;

    @CommandLine.Option(names = {"--translations"}, paramLabel = "DIR", description = "Directory of {language}.{author}.xml translations")
    private Path translationsDir;

    @CommandLine.Option(names = {"--first-translation-id"}, description = "translation_id of the first translation file (default: ${DEFAULT-VALUE})")
    private int firstTranslationId = 1;

    @CommandLine.Option(names = {"--separate-bismillah"}, description = "Split a basmala prefixed to an ayah's text into bismillah_text")
    private boolean separateBismillah;

    @CommandLine.Option(names = {"--expected-digest"}, paramLabel = "SHA256",
            description = "Approved SHA-256 of the source (default: pinned Tanzil release)")
    private String expectedDigest;

    @CommandLine.Option(names = {"-o", "--output-dir"}, description = "Output directory (default: output.dir / NATIQ_OUTPUT_DIR)")
    private Path outputDir;

    @Override
    public Integer call() {
        Config config = new Config();
        String digest = expectedDigest != null ? expectedDigest : config.quranDigest();
        Path dir = outputDir != null ? outputDir : config.outputDir();
        CsvRowWriter writer = new CsvRowWriter(dir);

        RowExporter exporter;
        Console.progress("Converting " + xmlFile + " ...");
        try (InputStream in = Files.newInputStream(xmlFile)) {
            ParserOptions options = ParserOptions.builder().separateBismillah(separateBismillah).build();
            Quran quran = new QuranConverter(new Mushaf(shortName, fullName, mushafSource), digest, options,
                    xmlFile.getFileName().toString()).convert(in);
            exporter = new RowExporter(quran, mushafId, xmlFile.getFileName().toString());
            for (RowBatch batch : exporter.quranBatches()) {
                Path target = writer.write(batch);
                Console.success(batch.schema() + ": " + batch.size() + " rows -> " + target);
            }
        } catch (ConversionException e) {
            Console.failure(e);
            return 1;
        } catch (IOException e) {
            Console.failure("[read] " + xmlFile + ": " + e.getMessage());
            return 1;
        }

        if (translationsDir == null) {
            return 0;
        }
        return writeTranslations(exporter, writer, config.translationSource());
    }

    private int writeTranslations(RowExporter exporter, CsvRowWriter writer, String source) {
        List<Path> files;
        try {
            files = ConversionManager.listFiles(translationsDir);
        } catch (ConversionException e) {
            Console.failure(e);
            return 1;
        }

        List<RowBatch> batches = new ArrayList<>();
        int failures = 0;
        int translationId = firstTranslationId;
        for (Path file : files) {
            try (InputStream in = Files.newInputStream(file)) {
                TranslationConverter converter = TranslationConverter.forFile(file, shortName, source, null);
                Translation translation = converter.convert(in);
                batches.add(exporter.translationRows(translation, translationId, file.getFileName().toString()));
                System.out.println("  translation_id " + translationId + " = " + converter.getName());
                translationId++;
            } catch (ConversionException e) {
                Console.failure(e);
                failures++;
            } catch (IOException e) {
                Console.failure("[read] " + file + ": " + e.getMessage());
                failures++;
            }
        }

        try {
            RowBatch merged = RowExporter.merge(RowExporter.TRANSLATIONS_TEXT, TRANSLATION_COLUMNS, batches);
            Path target = writer.write(merged);
            Console.success(merged.schema() + ": " + merged.size() + " rows -> " + target);
        } catch (ConversionException e) {
            Console.failure(e);
            return 1;
        }
        if (failures > 0) {
            Console.warn(failures + " translation file(s) skipped");
            return 1;
        }
        return 0;
    }
}

package com.syntex.natiq.commands;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.concurrent.Callable;

import com.syntex.natiq.Config;
import com.syntex.natiq.cli.CommandCategory;
import com.syntex.natiq.cli.Console;
import com.syntex.natiq.converter.ConversionManager;
import com.syntex.natiq.converter.ConversionReport;
import com.syntex.natiq.error.ConversionException;
import com.syntex.natiq.export.JsonExporter;

import picocli.CommandLine;

@CommandLine.Command(
        name = "translation-bulk",
        description = "Export every {language}.{author}.xml file of a directory; bad files are reported and skipped"
)
@CommandCategory("Export")
public class TranslationBulkCommand implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", paramLabel = "TRANSLATIONS_DIR", description = "Directory of Tanzil translation XML files")
    private Path translationsDir;

    @CommandLine.Parameters(index = "1", paramLabel = "OUTPUT_DIR", description = "Directory for the JSON files")
    private Path outputDir;

    @CommandLine.Parameters(index = "2", paramLabel = "MUSHAF", description = "Short name of the mushaf they translate")
    private String mushaf;

    @CommandLine.Option(names = {"--source"}, description = "Source label (default: translation.source, tanzil.net)")
    private String source;

    @CommandLine.Option(names = {"--release-date"}, paramLabel = "YYYY-MM-DD", description = "Release date applied to every file")
    private LocalDate releaseDate;

    @CommandLine.Option(names = {"--pretty"}, description = "Indent the JSON output")
    private boolean pretty;

    @Override
    public Integer call() {
        String label = source != null ? source : new Config().translationSource();
        ConversionManager manager = new ConversionManager(new JsonExporter(pretty));

        Console.progress("Converting translations in " + translationsDir + " ...");
        ConversionReport report;
        try {
            report = manager.runTranslationDirectory(translationsDir, outputDir, mushaf, label, releaseDate);
        } catch (ConversionException e) {
            Console.failure(e);
            return 1;
        }

        return Console.report(report);
    }
}

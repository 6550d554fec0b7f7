package com.syntex.natiq.commands;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.Callable;

import com.syntex.natiq.Config;
import com.syntex.natiq.cli.CommandCategory;
import com.syntex.natiq.cli.Console;
import com.syntex.natiq.converter.ConversionManager;
import com.syntex.natiq.converter.ConversionManager.ConversionTask;
import com.syntex.natiq.converter.TranslationConverter;
import com.syntex.natiq.export.JsonExporter;
import com.syntex.natiq.quran.parser.TranslationInfo;

import picocli.CommandLine;

@CommandLine.Command(
        name = "translation",
        description = "Export one Tanzil translation XML file as <LANGUAGE>.<AUTHOR>.json"
)
@CommandCategory("Export")
public class TranslationCommand implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", paramLabel = "XML_FILE", description = "Tanzil translation XML")
    private Path xmlFile;

    @CommandLine.Parameters(index = "1", paramLabel = "MUSHAF", description = "Short name of the mushaf it translates")
    private String mushaf;

    @CommandLine.Parameters(index = "2", paramLabel = "LANGUAGE", description = "Language code (e.g. en)")
    private String language;

    @CommandLine.Parameters(index = "3", paramLabel = "AUTHOR", description = "Translator username")
    private String author;

    @CommandLine.Option(names = {"--source"}, description = "Source label (default: translation.source, tanzil.net)")
    private String source;

    @CommandLine.Option(names = {"--release-date"}, paramLabel = "YYYY-MM-DD", description = "Release date of the translation")
    private LocalDate releaseDate;

    @CommandLine.Option(names = {"--pretty"}, description = "Indent the JSON output")
    private boolean pretty;

    @CommandLine.Option(names = {"-o", "--output-dir"}, description = "Output directory (default: output.dir / NATIQ_OUTPUT_DIR)")
    private Path outputDir;

    @Override
    public Integer call() {
        Config config = new Config();
        String label = source != null ? source : config.translationSource();
        Path dir = outputDir != null ? outputDir : config.outputDir();
        TranslationConverter converter = new TranslationConverter(
                new TranslationInfo(mushaf, language, label, author, releaseDate), xmlFile.getFileName().toString());

        Console.progress("Converting " + xmlFile + " ...");
        ConversionTask task = new ConversionTask(converter, xmlFile, dir.resolve(converter.getName() + ".json"));
        return Console.report(new ConversionManager(new JsonExporter(pretty)).runConversions(List.of(task)));
    }
}

package com.syntex.natiq.commands;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import com.syntex.natiq.Config;
import com.syntex.natiq.cli.CommandCategory;
import com.syntex.natiq.cli.Console;
import com.syntex.natiq.converter.ConversionManager;
import com.syntex.natiq.converter.ConversionManager.ConversionTask;
import com.syntex.natiq.converter.QuranConverter;
import com.syntex.natiq.export.JsonExporter;
import com.syntex.natiq.quran.model.Mushaf;
import com.syntex.natiq.quran.parser.ParserOptions;

import picocli.CommandLine;

@CommandLine.Command(
        name = "quran",
        description = "Verify a Tanzil Quran XML file and export it as <SHORT_NAME>.json"
)
@CommandCategory("Export")
public class QuranCommand implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", paramLabel = "XML_FILE", description = "Tanzil Quran XML (e.g. quran-uthmani.xml)")
    private Path xmlFile;

    @CommandLine.Parameters(index = "1", paramLabel = "SHORT_NAME", description = "Mushaf short name (e.g. hafs)")
    private String shortName;

    @CommandLine.Parameters(index = "2", paramLabel = "FULL_NAME", description = "Mushaf full name")
    private String fullName;

    @CommandLine.Parameters(index = "3", paramLabel = "SOURCE", description = "Source label (e.g. tanzil)")
    private String source;

    @CommandLine.Option(names = {"--pretty"}, description = "Indent the JSON output")
    private boolean pretty;

    @CommandLine.Option(names = {"-o", "--output-dir"}, description = "Output directory (default: output.dir / NATIQ_OUTPUT_DIR)")
    private Path outputDir;

    @CommandLine.Option(names = {"--separate-bismillah"}, description = "Split a basmala prefixed to an ayah's text into bismillah_text")
    private boolean separateBismillah;

    @CommandLine.Option(names = {"--expected-digest"}, paramLabel = "SHA256",
            description = "Approved SHA-256 of the source (default: pinned Tanzil release)")
    private String expectedDigest;

    @Override
    public Integer call() {
        Config config = new Config();
        String digest = expectedDigest != null ? expectedDigest : config.quranDigest();
        Path dir = outputDir != null ? outputDir : config.outputDir();
        ParserOptions options = ParserOptions.builder().separateBismillah(separateBismillah).build();
        QuranConverter converter = new QuranConverter(new Mushaf(shortName, fullName, source), digest, options,
                xmlFile.getFileName().toString());

        Console.progress("Converting " + xmlFile + " ...");
        ConversionTask task = new ConversionTask(converter, xmlFile, dir.resolve(shortName + ".json"));
        return Console.report(new ConversionManager(new JsonExporter(pretty)).runConversions(List.of(task)));
    }
}

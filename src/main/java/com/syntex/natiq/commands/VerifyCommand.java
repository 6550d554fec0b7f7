package com.syntex.natiq.commands;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import com.syntex.natiq.Config;
import com.syntex.natiq.cli.CommandCategory;
import com.syntex.natiq.cli.Console;
import com.syntex.natiq.quran.SourceValidator;

import picocli.CommandLine;

@CommandLine.Command(
        name = "verify",
        description = "Check a Quran source file against the approved SHA-256 digest"
)
@CommandCategory("Export")
public class VerifyCommand implements Callable<Integer> {

    @CommandLine.Parameters(index = "0", paramLabel = "XML_FILE", description = "Tanzil Quran XML")
    private Path xmlFile;

    @CommandLine.Option(names = {"--expected-digest"}, paramLabel = "SHA256",
            description = "Approved SHA-256 (default: pinned Tanzil release)")
    private String expectedDigest;

    @Override
    public Integer call() {
        String expected = expectedDigest != null ? expectedDigest : new Config().quranDigest();
        byte[] raw;
        try {
            raw = Files.readAllBytes(xmlFile);
        } catch (IOException e) {
            Console.failure("[read] " + xmlFile + ": " + e.getMessage());
            return 1;
        }

        String actual = SourceValidator.digest(raw);
        System.out.println("sha256 " + actual + "  " + xmlFile);
        if (SourceValidator.validate(raw, expected)) {
            Console.success(xmlFile + " is the approved source");
            return 0;
        }
        Console.failure("[validate] " + xmlFile + ": expected " + expected + ", use the original Tanzil Quran source");
        return 1;
    }
}

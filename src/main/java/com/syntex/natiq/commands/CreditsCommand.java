package com.syntex.natiq.commands;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;

import com.syntex.natiq.cli.Color;
import com.syntex.natiq.cli.CommandCategory;

import picocli.CommandLine;

@CommandLine.Command(
    name = "credits",
    description = "Show the Tanzil attribution that must accompany exported text"
)
@CommandCategory("Information")
public class CreditsCommand implements Runnable {

    @Override
    public void run() {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("credits.txt")) {
            if (in == null) {
                System.out.println(Color.RED.wrap("credits.txt not found in resources."));
                return;
            }
            String content = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))
                    .lines()
                    .collect(Collectors.joining("\n"));
            System.out.println(Color.CYAN.wrap("\n=== Sources & Attribution ===\n"));
            System.out.println(content);
        } catch (IOException e) {
            System.out.println(Color.RED.wrap("Error reading credits.txt: " + e.getMessage()));
        }
    }
}

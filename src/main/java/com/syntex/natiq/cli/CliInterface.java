package com.syntex.natiq.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Scanner;

import com.syntex.natiq.Config;

import picocli.CommandLine;

/**
 * Interactive shell, started when the exporter runs without arguments.
 * Banner, prompt and colours come from {@code config.properties}.
 */
public class CliInterface {

    private final Config config;
    private final CommandLine cmd;
    private final Scanner scanner;

    public CliInterface(Config config, CommandLine cmd) {
        this.config = config;
        this.cmd = cmd;
        this.scanner = new Scanner(System.in);
    }

    public void start() {
        Color bannerColor = Color.from(config.get("cli.color.banner"));
        System.out.println(bannerColor.wrap(config.get("cli.banner").replace("\\n", "\n")));
        loop();
    }

    private void loop() {
        String prompt = config.get("cli.prompt");
        Color promptColor = Color.from(config.get("cli.color.prompt"));
        Color errorColor = Color.from(config.get("cli.color.error"));

        while (true) {
            System.out.print(promptColor.wrap(prompt));
            if (!scanner.hasNextLine()) {
                break;
            }
            String input = scanner.nextLine().trim();
            if (input.isEmpty()) {
                continue;
            }
            if (input.equalsIgnoreCase("exit") || input.equalsIgnoreCase("quit")) {
                System.out.println(Color.from(config.get("cli.color.exit")).wrap(config.get("cli.exit")));
                break;
            }

            List<String> args = splitArguments(input);
            if (args == null) {
                System.out.println(errorColor.wrap(config.get("cli.error.prefix") + "unterminated quote"));
                continue;
            }
            cmd.execute(args.toArray(String[]::new));
        }
    }

    /**
     * Split a shell line on whitespace, keeping single or double quoted
     * segments together (mushaf full names contain spaces). Returns null
     * when a quote is left open.
     */
    public static List<String> splitArguments(String line) {
        List<String> args = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inToken = false;
        char quote = 0;
        for (char c : line.toCharArray()) {
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    args.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (quote != 0) {
            return null;
        }
        if (inToken) {
            args.add(current.toString());
        }
        return args;
    }
}

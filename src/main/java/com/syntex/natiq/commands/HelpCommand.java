package com.syntex.natiq.commands;

import java.nio.charset.Charset;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.syntex.natiq.cli.Color;
import com.syntex.natiq.cli.CommandCategory;

import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;

@CommandLine.Command(
        name = "help",
        description = "Show available commands or details for a specific command"
)
@CommandCategory("Information")
public class HelpCommand implements Runnable {

    @CommandLine.Spec
    CommandSpec spec;

    @CommandLine.Parameters(
            index = "0",
            arity = "0..1",
            paramLabel = "COMMAND",
            description = "Optional command name to show details for"
    )
    private String commandName;

    @Override
    public void run() {
        CommandLine root = spec.commandLine().getParent() == null
                ? spec.commandLine()
                : spec.commandLine().getParent();

        if (commandName == null) {
            printTree(root);
        } else {
            printCommandDetails(root, commandName);
        }
    }

    private void printTree(CommandLine root) {
        // category -> (command -> description), both sorted
        Map<String, Map<String, String>> categorized = new TreeMap<>();
        for (Map.Entry<String, CommandLine> entry : root.getSubcommands().entrySet()) {
            CommandLine cmd = entry.getValue();
            CommandCategory cat = cmd.getCommand().getClass().getAnnotation(CommandCategory.class);
            categorized.computeIfAbsent(cat != null ? cat.value() : "Other", k -> new TreeMap<>())
                    .put(entry.getKey(), String.join(" ", cmd.getCommandSpec().usageMessage().description()));
        }
        categorized.computeIfAbsent("System", k -> new TreeMap<>()).put("exit", "Leave the interactive shell");

        boolean utf8 = Charset.defaultCharset().name().equalsIgnoreCase("UTF-8");
        String branch = utf8 ? " ├─ " : " |-- ";
        String lastBranch = utf8 ? " └─ " : " \\-- ";

        System.out.println(Color.CYAN.wrap("\n Natiq Exporter"));
        System.out.println(Color.WHITE.wrap("Available Commands:\n"));
        for (Map.Entry<String, Map<String, String>> category : categorized.entrySet()) {
            System.out.println(Color.YELLOW.wrap(category.getKey() + ":"));
            List<String> names = List.copyOf(category.getValue().keySet());
            int longest = names.stream().mapToInt(String::length).max().orElse(10);
            for (int i = 0; i < names.size(); i++) {
                String name = names.get(i);
                System.out.printf("%s%s  %s%s%n",
                        i == names.size() - 1 ? lastBranch : branch,
                        Color.GREEN.wrap(name),
                        " ".repeat(longest - name.length()),
                        Color.WHITE.wrap(category.getValue().get(name)));
            }
            System.out.println();
        }
        System.out.println(Color.YELLOW.wrap("Tip: Use 'help <command>' for arguments and options.\n"));
    }

    private void printCommandDetails(CommandLine root, String name) {
        CommandLine cmd = root.getSubcommands().get(name);
        if (cmd == null) {
            System.out.println(Color.RED.wrap("Unknown command: " + name));
            return;
        }
        System.out.println(Color.CYAN.wrap("\n Command: " + name));
        cmd.usage(System.out, CommandLine.Help.Ansi.OFF);
    }
}

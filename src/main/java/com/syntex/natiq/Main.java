package com.syntex.natiq;

import com.syntex.natiq.cli.CliInterface;
import com.syntex.natiq.cli.CommandLoader;
import com.syntex.natiq.env.EnvKey;
import com.syntex.natiq.env.EnvManager;

import picocli.CommandLine;

@CommandLine.Command(
        name = "natiq",
        description = "Converts Tanzil Quran and translation XML into JSON and relational rows"
)
public class Main implements Runnable {

    static final String COMMANDS_PACKAGE = "com.syntex.natiq.commands";

    @Override
    public void run() {
        Config config = new Config();
        CliInterface cli = new CliInterface(config, buildCommandLine());
        cli.start();
    }

    public static void main(String[] args) {
        // must happen before the first logger is created
        if (EnvManager.getInstance().getBoolean(EnvKey.DEBUG, false)) {
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        }
        if (args.length > 0) {
            System.exit(buildCommandLine().execute(args));
        } else {
            new Main().run();
        }
    }

    public static CommandLine buildCommandLine() {
        CommandLine root = new CommandLine(new Main());
        CommandLoader.registerCommands(root, COMMANDS_PACKAGE);
        return root;
    }
}

package com.syntex.natiq.cli;

import java.util.Comparator;
import java.util.List;

import org.reflections.Reflections;
import org.reflections.scanners.Scanners;

import picocli.CommandLine;

/**
 * Registers every {@code @Command} class in a package as a subcommand.
 */
public class CommandLoader {

    public static void registerCommands(CommandLine root, String basePackage) {
        Reflections reflections = new Reflections(basePackage, Scanners.TypesAnnotated);

        List<Class<?>> commands = reflections.getTypesAnnotatedWith(CommandLine.Command.class).stream()
                .filter(type -> type.getPackageName().startsWith(basePackage))
                .sorted(Comparator.comparing(Class::getName))
                .toList();
        for (Class<?> cmdClass : commands) {
            try {
                Object instance = cmdClass.getDeclaredConstructor().newInstance();
                CommandLine.Command annotation = cmdClass.getAnnotation(CommandLine.Command.class);
                root.addSubcommand(annotation.name(), instance);
            } catch (ReflectiveOperationException e) {
                System.err.println("⚠️ Failed to load command: " + cmdClass.getName() + " -> " + e.getMessage());
            }
        }
    }
}

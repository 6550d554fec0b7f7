package com.syntex.natiq.cli;

/**
 * ANSI colours for terminal output. Disabled when {@code NO_COLOR} is set.
 */
public enum Color {
    RESET("\u001B[0m"),
    RED("\u001B[31m"),
    GREEN("\u001B[32m"),
    YELLOW("\u001B[33m"),
    CYAN("\u001B[36m"),
    WHITE("\u001B[37m"),
    NONE("");

    private static final boolean ENABLED = System.getenv("NO_COLOR") == null;

    private final String code;

    Color(String code) {
        this.code = code;
    }

    public String wrap(String text) {
        if (!ENABLED || this == NONE) {
            return text;
        }
        return code + text + RESET.code;
    }

    /** Lookup by name, case insensitive; unknown names give {@link #NONE}. */
    public static Color from(String name) {
        if (name == null) return NONE;
        try {
            return Color.valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return NONE;
        }
    }
}

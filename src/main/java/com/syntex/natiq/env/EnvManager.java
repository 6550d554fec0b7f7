package com.syntex.natiq.env;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Reads {@code .env} from the working directory and falls back to system
 * environment variables.
 */
public class EnvManager {

    private static EnvManager instance;
    private final Dotenv dotenv;

    private EnvManager(Dotenv dotenv) {
        this.dotenv = dotenv;
    }

    public static EnvManager getInstance() {
        if (instance == null) {
            instance = of(Dotenv.configure()
                    .ignoreIfMissing()
                    .load());
        }
        return instance;
    }

    /** Manager over an explicit {@link Dotenv}, e.g. one loaded from another directory. */
    public static EnvManager of(Dotenv dotenv) {
        return new EnvManager(dotenv);
    }

    public String get(EnvKey key) {
        return dotenv.get(key.key());
    }

    public String getOrDefault(EnvKey key, String defaultValue) {
        return dotenv.get(key.key(), defaultValue);
    }

    public boolean getBoolean(EnvKey key, boolean defaultValue) {
        String value = getOrDefault(key, String.valueOf(defaultValue));
        return value.equalsIgnoreCase("true")
                || value.equalsIgnoreCase("1")
                || value.equalsIgnoreCase("yes");
    }
}

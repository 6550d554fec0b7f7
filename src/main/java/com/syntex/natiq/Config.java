package com.syntex.natiq;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Properties;

import com.syntex.natiq.env.EnvKey;
import com.syntex.natiq.env.EnvManager;
import com.syntex.natiq.quran.SourceValidator;

/**
 * Settings from {@code config.properties}, with selected keys overridable from
 * the environment (or {@code .env}). Command line options win over both.
 */
public class Config {

    private final Properties props;
    private final EnvManager env;

    public Config() {
        this(load("config.properties"), EnvManager.getInstance());
    }

    public Config(Properties props, EnvManager env) {
        this.props = props;
        this.env = env;
    }

    public String get(String key) {
        return props.getProperty(key, "");
    }

    /** Environment value when set and non blank, otherwise the property. */
    public String get(EnvKey envKey, String propertyKey) {
        String fromEnv = env.get(envKey);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv.strip();
        }
        return get(propertyKey).strip();
    }

    public String quranDigest() {
        String digest = get(EnvKey.NATIQ_QURAN_DIGEST, "quran.sha256");
        return digest.isEmpty() ? SourceValidator.TANZIL_QURAN_SHA256 : digest;
    }

    public String translationSource() {
        String source = get(EnvKey.NATIQ_TRANSLATION_SOURCE, "translation.source");
        return source.isEmpty() ? "tanzil.net" : source;
    }

    public Path outputDir() {
        String dir = get(EnvKey.NATIQ_OUTPUT_DIR, "output.dir");
        return Path.of(dir.isEmpty() ? "." : dir);
    }

    private static Properties load(String resource) {
        Properties props = new Properties();
        try (InputStream input = Config.class.getClassLoader().getResourceAsStream(resource)) {
            if (input != null) {
                props.load(input);
            } else {
                System.err.println("⚠ " + resource + " not found!");
            }
        } catch (IOException e) {
            System.err.println("⚠ Error loading " + resource + ": " + e.getMessage());
        }
        return props;
    }
}

package com.syntex.natiq;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.syntex.natiq.env.EnvKey;
import com.syntex.natiq.env.EnvManager;
import com.syntex.natiq.quran.SourceValidator;

import io.github.cdimascio.dotenv.Dotenv;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
public class ConfigTest {

    private static EnvManager env(Path dir, String contents) throws IOException {
        Files.writeString(dir.resolve(".env"), contents, StandardCharsets.UTF_8);
        return EnvManager.of(Dotenv.configure().directory(dir.toString()).load());
    }

    private static EnvManager noEnv(Path dir) {
        return EnvManager.of(Dotenv.configure().directory(dir.toString()).ignoreIfMissing().load());
    }

    @Test void testClasspathProperties() {
        Config config = new Config();
        assertEquals("natiq> ", config.get("cli.prompt"));
        assertEquals("tanzil.net", config.get("translation.source"));
        assertEquals(SourceValidator.TANZIL_QURAN_SHA256, config.get("quran.sha256"));
    }

    @Test void testDefaultsWithoutProperties(@TempDir Path tmp) {
        Config config = new Config(new Properties(), noEnv(tmp));
        assertEquals(SourceValidator.TANZIL_QURAN_SHA256, config.quranDigest());
        assertEquals("tanzil.net", config.translationSource());
        assertEquals(Path.of("."), config.outputDir());
        assertEquals("", config.get("missing.key"));
    }

    @Test void testPropertiesUsedWhenEnvironmentSilent(@TempDir Path tmp) {
        Properties props = new Properties();
        props.setProperty("quran.sha256", " ABC ");
        props.setProperty("output.dir", "exports");
        Config config = new Config(props, noEnv(tmp));
        assertEquals("ABC", config.quranDigest());
        assertEquals(Path.of("exports"), config.outputDir());
    }

    @Test void testEnvironmentOverridesProperties(@TempDir Path tmp) throws IOException {
        Properties props = new Properties();
        props.setProperty("translation.source", "tanzil.net");
        props.setProperty("output.dir", "exports");
        Config config = new Config(props, env(tmp, "NATIQ_TRANSLATION_SOURCE=quran.example\n"));

        assertEquals("quran.example", config.translationSource());
        assertEquals(Path.of("exports"), config.outputDir());
    }

    @Test void testEnvManagerBoolean(@TempDir Path tmp) throws IOException {
        EnvManager manager = env(tmp, "DEBUG=yes\n");
        assertTrue(manager.getBoolean(EnvKey.DEBUG, false));
        assertEquals("fallback", manager.getOrDefault(EnvKey.NATIQ_QURAN_DIGEST, "fallback"));
    }
}

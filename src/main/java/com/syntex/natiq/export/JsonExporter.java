package com.syntex.natiq.export;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.syntex.natiq.error.ConversionException;
import com.syntex.natiq.error.MalformedInputException;
import com.syntex.natiq.error.Stage;
import com.syntex.natiq.quran.model.Quran;
import com.syntex.natiq.quran.model.Translation;

/**
 * Renders converted trees as JSON and reads them back.
 * <p>
 * Field names are snake_case in declaration order, absent optional values are
 * written as {@code null} rather than omitted, and text is written as is
 * (no HTML escaping, no {@code \\u} escapes for Arabic).
 */
public class JsonExporter {

    private static final Logger LOG = LoggerFactory.getLogger(JsonExporter.class);

    private final Gson gson;

    public JsonExporter(boolean pretty) {
        GsonBuilder builder = new GsonBuilder()
                .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
                .registerTypeAdapter(LocalDate.class, new LocalDateAdapter())
                .serializeNulls()
                .disableHtmlEscaping();
        if (pretty) {
            builder.setPrettyPrinting();
        }
        this.gson = builder.create();
    }

    public static JsonExporter pretty() {
        return new JsonExporter(true);
    }

    public static JsonExporter compact() {
        return new JsonExporter(false);
    }

    public String toJson(Quran quran) {
        return gson.toJson(quran);
    }

    public String toJson(Translation translation) {
        return gson.toJson(translation);
    }

    /** Write any converted tree to {@code target}, creating parent directories. */
    public void write(Object tree, Path target) throws ConversionException {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                gson.toJson(tree, writer);
            }
            LOG.debug("wrote {}", target);
        } catch (IOException e) {
            throw new ConversionException(Stage.WRITE, target.toString(), "could not write JSON: " + e.getMessage(), e);
        }
    }

    public Quran readQuran(String json, String file) throws MalformedInputException {
        return read(json, Quran.class, file);
    }

    public Translation readTranslation(String json, String file) throws MalformedInputException {
        return read(json, Translation.class, file);
    }

    private <T> T read(String json, Class<T> type, String file) throws MalformedInputException {
        try {
            T tree = gson.fromJson(json, type);
            if (tree == null) {
                throw new MalformedInputException(Stage.SERIALIZE, file, "empty JSON document");
            }
            return tree;
        } catch (JsonParseException | DateTimeParseException e) {
            throw new MalformedInputException(Stage.SERIALIZE, file,
                    "not a " + type.getSimpleName() + " document: " + e.getMessage(), e);
        }
    }
}

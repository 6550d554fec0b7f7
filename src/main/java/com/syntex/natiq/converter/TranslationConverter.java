package com.syntex.natiq.converter;

import java.io.InputStream;
import java.nio.file.Path;
import java.time.LocalDate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import com.syntex.natiq.error.ConversionException;
import com.syntex.natiq.error.MalformedInputException;
import com.syntex.natiq.quran.model.Translation;
import com.syntex.natiq.quran.parser.TranslationFileName;
import com.syntex.natiq.quran.parser.TranslationInfo;
import com.syntex.natiq.quran.parser.TranslationParser;
import com.syntex.natiq.quran.parser.XmlDocuments;
import com.syntex.natiq.quran.text.TextCleanser;

public class TranslationConverter implements Converter<Translation> {

    private static final Logger LOG = LoggerFactory.getLogger(TranslationConverter.class);

    private final TranslationInfo info;
    private final String file;

    public TranslationConverter(TranslationInfo info, String file) {
        this.info = info;
        this.file = file;
    }

    /**
     * Derive language and translator from a {@code {language}.{author}.xml}
     * file name.
     */
    public static TranslationConverter forFile(Path path, String mushaf, String source, LocalDate releaseDate)
            throws MalformedInputException {
        TranslationFileName name = TranslationFileName.parse(path.toString()).requireExtension("xml");
        TranslationInfo info = new TranslationInfo(mushaf, name.getLanguage(), source, name.getAuthor(), releaseDate);
        return new TranslationConverter(info, name.fileName());
    }

    @Override
    public String getName() {
        return info.getLanguage() + "." + info.getTranslatorUsername();
    }

    @Override
    public Translation convert(InputStream inputStream) throws ConversionException {
        byte[] raw = Converter.readAll(inputStream, file);
        Document document = XmlDocuments.parse(TextCleanser.stripComments(raw), file);
        Translation translation = new TranslationParser(file).parse(document, info);
        LOG.info("{}: {} surahs, {} ayat", file, translation.getSurahs().size(), translation.ayahCount());
        return translation;
    }
}

package com.syntex.natiq.converter;

import java.io.InputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import com.syntex.natiq.error.ConversionException;
import com.syntex.natiq.quran.SourceValidator;
import com.syntex.natiq.quran.model.Mushaf;
import com.syntex.natiq.quran.model.Quran;
import com.syntex.natiq.quran.parser.ParserOptions;
import com.syntex.natiq.quran.parser.QuranParser;
import com.syntex.natiq.quran.parser.XmlDocuments;
import com.syntex.natiq.quran.text.TextCleanser;

/**
 * Tanzil Quran XML to {@link Quran}. The digest check runs on the raw bytes
 * before anything is decoded or parsed.
 */
public class QuranConverter implements Converter<Quran> {

    private static final Logger LOG = LoggerFactory.getLogger(QuranConverter.class);

    private final Mushaf mushaf;
    private final String expectedDigest;
    private final ParserOptions options;
    private final String file;

    public QuranConverter(Mushaf mushaf, String expectedDigest, ParserOptions options, String file) {
        this.mushaf = mushaf;
        this.expectedDigest = expectedDigest;
        this.options = options;
        this.file = file;
    }

    @Override
    public String getName() {
        return "quran-" + mushaf.getShortName();
    }

    @Override
    public Quran convert(InputStream inputStream) throws ConversionException {
        byte[] raw = Converter.readAll(inputStream, file);
        SourceValidator.requireValid(raw, expectedDigest, file);

        Document document = XmlDocuments.parse(TextCleanser.stripComments(raw), file);
        Quran quran = new QuranParser(options, file).parse(document, mushaf);
        LOG.info("{}: {} surahs, {} ayat, {} words", file, quran.getSurahs().size(), quran.ayahCount(), quran.wordCount());
        return quran;
    }
}

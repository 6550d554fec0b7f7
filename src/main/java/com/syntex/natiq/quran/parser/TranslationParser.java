package com.syntex.natiq.quran.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import com.syntex.natiq.error.MalformedInputException;
import com.syntex.natiq.error.Stage;
import com.syntex.natiq.quran.model.AyahTranslation;
import com.syntex.natiq.quran.model.Translation;
import com.syntex.natiq.quran.model.TranslationSurah;
import com.syntex.natiq.quran.text.TextCleanser;

/**
 * Builds a {@link Translation} from a Tanzil translation document. Same
 * element shape as the Quran source but the text is neither tokenized nor
 * annotated.
 */
public class TranslationParser {

    private static final Logger LOG = LoggerFactory.getLogger(TranslationParser.class);

    private final String file;

    public TranslationParser(String file) {
        this.file = file;
    }

    public Translation parse(Document document, TranslationInfo info) throws MalformedInputException {
        Element root = document.getDocumentElement();
        List<Element> suras = XmlDocuments.elements(root, "sura");
        if (suras.isEmpty()) {
            throw new MalformedInputException(Stage.PARSE, file, "no <sura> elements under <" + root.getTagName() + ">");
        }

        String sample = null;
        List<TranslationSurah> surahs = new ArrayList<>(suras.size());
        for (Element sura : suras) {
            TranslationSurah surah = parseSurah(sura);
            if (sample == null) {
                // literal first ayah, before apostrophe escaping
                sample = XmlDocuments.requiredAttribute(XmlDocuments.elements(sura, "aya").get(0), "text", file);
            }
            surahs.add(surah);
        }

        Translation translation = new Translation(info.getMushaf(), info.getLanguage(), info.getSource(), sample,
                info.getTranslatorUsername(), info.getReleaseDate(), List.copyOf(surahs));
        LOG.debug("{}: parsed {} surahs, {} ayat", file, surahs.size(), translation.ayahCount());
        return translation;
    }

    public TranslationSurah parseSurah(Element sura) throws MalformedInputException {
        int number = XmlDocuments.indexAttribute(sura, "index", file);
        String name = XmlDocuments.requiredAttribute(sura, "name", file);
        List<Element> ayas = XmlDocuments.elements(sura, "aya");
        if (ayas.isEmpty()) {
            throw new MalformedInputException(Stage.PARSE, file, "<sura index=" + number + "> has no <aya> elements");
        }

        List<AyahTranslation> translations = new ArrayList<>(ayas.size());
        for (Element aya : ayas) {
            int ayahNumber = XmlDocuments.indexAttribute(aya, "index", file);
            String text = XmlDocuments.requiredAttribute(aya, "text", file);
            translations.add(new AyahTranslation(ayahNumber, TextCleanser.escapeQuotes(text)));
        }
        return new TranslationSurah(number, name, List.copyOf(translations));
    }
}

package com.syntex.natiq.quran.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import com.syntex.natiq.error.ConversionException;
import com.syntex.natiq.error.MalformedInputException;
import com.syntex.natiq.error.Stage;
import com.syntex.natiq.quran.StructuralAnnotations;
import com.syntex.natiq.quran.model.Ayah;
import com.syntex.natiq.quran.model.Mushaf;
import com.syntex.natiq.quran.model.Period;
import com.syntex.natiq.quran.model.Quran;
import com.syntex.natiq.quran.model.Sajdah;
import com.syntex.natiq.quran.model.Surah;
import com.syntex.natiq.quran.model.Word;
import com.syntex.natiq.quran.text.TextCleanser;

/**
 * Builds an annotated {@link Quran} tree from a Tanzil document
 * ({@code <quran><sura index name><aya index text bismillah?/>...}).
 * <p>
 * Surahs are taken in document order, which is trusted as the canonical
 * order. Indices are not checked for being sequential.
 */
public class QuranParser {

    private static final Logger LOG = LoggerFactory.getLogger(QuranParser.class);

    private final ParserOptions options;
    private final String file;

    public QuranParser(ParserOptions options, String file) {
        this.options = options;
        this.file = file;
    }

    public Quran parse(Document document, Mushaf mushaf) throws ConversionException {
        Element root = document.getDocumentElement();
        List<Element> suras = XmlDocuments.elements(root, "sura");
        if (suras.isEmpty()) {
            throw new MalformedInputException(Stage.PARSE, file, "no <sura> elements under <" + root.getTagName() + ">");
        }

        List<Surah> surahs = new ArrayList<>(suras.size());
        for (Element sura : suras) {
            surahs.add(parseSurah(sura));
        }
        Quran quran = new Quran(mushaf, List.copyOf(surahs));
        LOG.debug("{}: parsed {} surahs, {} ayat, {} words", file, surahs.size(), quran.ayahCount(), quran.wordCount());
        return quran;
    }

    public Surah parseSurah(Element sura) throws ConversionException {
        int number = XmlDocuments.indexAttribute(sura, "index", file);
        String name = XmlDocuments.requiredAttribute(sura, "name", file);
        Period period = StructuralAnnotations.periodOf(number, file);

        List<Element> ayas = XmlDocuments.elements(sura, "aya");
        if (ayas.isEmpty()) {
            throw new MalformedInputException(Stage.PARSE, file, "<sura index=" + number + "> has no <aya> elements");
        }

        List<Ayah> ayahs = new ArrayList<>(ayas.size());
        int bismillahAyat = 0;
        for (Element aya : ayas) {
            Ayah ayah = parseAyah(number, aya);
            if (ayah.isBismillah()) {
                bismillahAyat++;
            }
            ayahs.add(ayah);
        }
        if (bismillahAyat > 1) {
            throw new MalformedInputException(Stage.ANNOTATE, file,
                    "<sura index=" + number + "> has " + bismillahAyat + " ayat consisting of the bismillah, at most one is allowed");
        }

        Ayah first = ayahs.get(0);
        boolean asFirstAyah = first.isBismillah();
        boolean status = asFirstAyah || first.getBismillahText() != null;
        return new Surah(name, number, period, status, asFirstAyah, List.copyOf(ayahs));
    }

    public Ayah parseAyah(int surahNumber, Element aya) throws MalformedInputException {
        int number = XmlDocuments.indexAttribute(aya, "index", file);
        String text = XmlDocuments.requiredAttribute(aya, "text", file);
        String bismillahText = aya.hasAttribute("bismillah") ? aya.getAttribute("bismillah") : null;
        boolean isBismillah = TextCleanser.BISMILLAH.equals(text);

        if (options.isSeparateBismillah() && bismillahText == null && !isBismillah) {
            Optional<String> rest = TextCleanser.separateBismillah(text);
            if (rest.isPresent()) {
                LOG.debug("{}: separated bismillah from {}:{}", file, surahNumber, number);
                bismillahText = TextCleanser.BISMILLAH;
                text = rest.get();
            }
        }

        List<Word> words = TextCleanser.tokenize(text).stream()
                .map(Word::new)
                .toList();
        Sajdah sajdah = StructuralAnnotations.sajdahOf(surahNumber, number);
        return new Ayah(number, sajdah, isBismillah, bismillahText, words);
    }
}

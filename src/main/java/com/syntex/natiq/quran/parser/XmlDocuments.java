package com.syntex.natiq.quran.parser;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import com.syntex.natiq.error.MalformedInputException;
import com.syntex.natiq.error.Stage;

/**
 * DOM helpers shared by the Quran and translation parsers.
 */
public final class XmlDocuments {

    private static final Logger LOG = LoggerFactory.getLogger(XmlDocuments.class);

    private XmlDocuments() {
    }

    /**
     * Parse already cleansed XML text. External entities and DTDs are never
     * loaded.
     */
    public static Document parse(String xml, String file) throws MalformedInputException {
        try {
            DocumentBuilder builder = newFactory().newDocumentBuilder();
            builder.setErrorHandler(new QuietErrorHandler(file));
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXParseException e) {
            throw new MalformedInputException(Stage.PARSE, file,
                    "invalid XML at line " + e.getLineNumber() + ", column " + e.getColumnNumber() + ": " + e.getMessage(), e);
        } catch (SAXException | IOException e) {
            throw new MalformedInputException(Stage.PARSE, file, "invalid XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser not configurable", e);
        }
    }

    /** Descendant elements with the given tag, in document order. */
    public static List<Element> elements(Element parent, String tagName) {
        NodeList nodes = parent.getElementsByTagName(tagName);
        List<Element> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    public static String requiredAttribute(Element element, String name, String file) throws MalformedInputException {
        if (!element.hasAttribute(name)) {
            throw new MalformedInputException(Stage.PARSE, file,
                    "<" + element.getTagName() + "> is missing the '" + name + "' attribute" + position(element));
        }
        return element.getAttribute(name);
    }

    /** Positive integer attribute such as {@code index}. */
    public static int indexAttribute(Element element, String name, String file) throws MalformedInputException {
        String value = requiredAttribute(element, name, file);
        int parsed;
        try {
            parsed = Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            throw new MalformedInputException(Stage.PARSE, file, notAnIndex(element, name, value), e);
        }
        if (parsed <= 0) {
            throw new MalformedInputException(Stage.PARSE, file, notAnIndex(element, name, value));
        }
        return parsed;
    }

    private static String notAnIndex(Element element, String name, String value) {
        return "<" + element.getTagName() + "> has " + name + "='" + value + "', expected a positive integer" + position(element);
    }

    private static String position(Element element) {
        Element parent = element.getParentNode() instanceof Element ? (Element) element.getParentNode() : null;
        if (parent != null && parent.hasAttribute("index")) {
            return " (inside <" + parent.getTagName() + " index=" + parent.getAttribute("index") + ">)";
        }
        return "";
    }

    private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setValidating(false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        return factory;
    }

    /** Keeps the JDK parser from printing "[Fatal Error]" lines to stderr. */
    private static final class QuietErrorHandler implements ErrorHandler {

        private final String file;

        QuietErrorHandler(String file) {
            this.file = file;
        }

        @Override
        public void warning(SAXParseException e) {
            LOG.warn("{}: XML warning at line {}: {}", file, e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }
}

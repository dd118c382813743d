package dev.feedcraft.parser;

import dev.feedcraft.exception.RssInputException;
import dev.feedcraft.exception.XmlSyntaxException;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Turns untrusted text into a DOM document, refusing anything that could make the XML engine
 * expand entities or fetch external resources.
 * <p>
 * Two independent gates:
 * <ol>
 *   <li>a textual pre-scan that rejects any input containing {@code <!DOCTYPE} or {@code <!ENTITY}
 *       (case-insensitive, anywhere in the document) before a parser is involved</li>
 *   <li>a {@link DocumentBuilderFactory} with DTDs, external entities, XInclude and entity
 *       expansion disabled and secure processing on</li>
 * </ol>
 * The pre-scan also rejects feeds that merely mention those tokens in escaped text; that false
 * positive is accepted.
 * <p>
 * Thread-safe: the factory is configured once and only read afterwards, and every call gets its
 * own {@link DocumentBuilder}.
 */
@Slf4j
public class SafeDocumentLoader {

    public static final int DEFAULT_MAX_DOCUMENT_LENGTH = 10 * 1024 * 1024;

    private static final String DOCTYPE_TOKEN = "<!DOCTYPE";
    private static final String ENTITY_TOKEN = "<!ENTITY";
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final DocumentBuilderFactory factory;
    private final int maxDocumentLength;

    public SafeDocumentLoader() {
        this(DEFAULT_MAX_DOCUMENT_LENGTH);
    }

    /**
     * @param maxDocumentLength largest accepted input in characters; zero or less means unlimited
     */
    public SafeDocumentLoader(int maxDocumentLength) {
        this.maxDocumentLength = maxDocumentLength;
        this.factory = hardenedFactory();
    }

    public int getMaxDocumentLength() {
        return maxDocumentLength;
    }

    /**
     * Decode strict UTF-8 and load.
     *
     * @throws RssInputException  if the bytes are null or not valid UTF-8, or the text is rejected
     * @throws XmlSyntaxException if the document is not well-formed
     */
    public Document load(byte[] utf8) {
        if (utf8 == null) {
            throw new RssInputException("RSS payload must be provided as text.");
        }
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(utf8))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new RssInputException("RSS payload is not valid UTF-8 text.", e);
        }
        return load(text);
    }

    /**
     * Screen and parse a document.
     *
     * @throws RssInputException  if the text is null, blank, too long, or declares a DOCTYPE/ENTITY
     * @throws XmlSyntaxException if the document is not well-formed
     */
    public Document load(String rss) {
        String stripped = screen(rss);
        DocumentBuilder builder = newBuilder();
        try {
            return builder.parse(new InputSource(new StringReader(stripped)));
        } catch (SAXParseException e) {
            throw new XmlSyntaxException(
                    "Unable to parse RSS XML document at line " + e.getLineNumber()
                            + ", column " + e.getColumnNumber() + ": " + e.getMessage(),
                    e.getLineNumber(), e.getColumnNumber(), e);
        } catch (SAXException e) {
            throw new XmlSyntaxException("Unable to parse RSS XML document: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new XmlSyntaxException("Unable to read RSS XML document: " + e.getMessage(), e);
        }
    }

    /**
     * Textual checks only. Returns the input without its leading whitespace and byte order mark.
     */
    String screen(String rss) {
        if (rss == null) {
            throw new RssInputException("RSS payload must be provided as a string.");
        }
        if (maxDocumentLength > 0 && rss.length() > maxDocumentLength) {
            throw new RssInputException("RSS payload exceeds the maximum length of "
                    + maxDocumentLength + " characters.");
        }
        String stripped = stripLeading(rss);
        if (stripped.isEmpty()) {
            throw new RssInputException("Empty RSS payload provided.");
        }
        String upper = stripped.toUpperCase(Locale.ROOT);
        if (upper.contains(DOCTYPE_TOKEN)) {
            throw new RssInputException("Refusing to process RSS feeds that declare a document type.");
        }
        if (upper.contains(ENTITY_TOKEN)) {
            throw new RssInputException("Refusing to process RSS feeds that declare custom entities.");
        }
        return stripped;
    }

    private static String stripLeading(String rss) {
        int start = 0;
        while (start < rss.length()
                && (rss.charAt(start) == BYTE_ORDER_MARK || Character.isWhitespace(rss.charAt(start)))) {
            start++;
        }
        return rss.substring(start);
    }

    private DocumentBuilder newBuilder() {
        try {
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new RethrowingErrorHandler());
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser could not be configured", e);
        }
    }

    private static DocumentBuilderFactory hardenedFactory() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support the required hardening features", e);
        }
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        factory.setNamespaceAware(false);
        factory.setValidating(false);
        factory.setCoalescing(false);
        return factory;
    }

    /**
     * Logs warnings, turns errors into exceptions so they are never skipped.
     */
    private static final class RethrowingErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException exception) {
            log.debug("XML parser warning at line {}: {}", exception.getLineNumber(), exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}

package dev.feedcraft.parser;

import dev.feedcraft.exception.FeedParseException;
import dev.feedcraft.exception.MissingElementException;
import dev.feedcraft.model.Channel;
import dev.feedcraft.model.RssFeed;
import dev.feedcraft.util.XmlUtil;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Entry point: RSS 2.0 text in, validated {@link RssFeed} out.
 * <p>
 * Each call runs straight through: load and screen the document, locate {@code <rss>} and its
 * {@code <channel>}, extract fields, build the model, validate. A call either returns a complete
 * feed or throws exactly one {@link FeedParseException}; no partial result is ever exposed.
 * <p>
 * Holds no per-call state, so one instance can serve any number of threads.
 */
@Slf4j
public class RssParser {

    private final SafeDocumentLoader loader;
    private final RssElementExtractor extractor;
    private final FeedValidator validator;

    public RssParser() {
        this(new SafeDocumentLoader());
    }

    public RssParser(SafeDocumentLoader loader) {
        this(loader, new RssElementExtractor(), new FeedValidator());
    }

    public RssParser(SafeDocumentLoader loader, RssElementExtractor extractor, FeedValidator validator) {
        this.loader = loader;
        this.extractor = extractor;
        this.validator = validator;
    }

    /**
     * Parse an RSS 2.0 document.
     *
     * @param rss complete document text
     * @return the validated feed
     * @throws dev.feedcraft.exception.RssInputException       if the input is empty or unsafe
     * @throws dev.feedcraft.exception.XmlSyntaxException      if the XML is not well-formed
     * @throws MissingElementException                         if rss, channel or a channel skeleton element is missing
     * @throws dev.feedcraft.exception.FeedValidationException if the assembled feed breaks an invariant
     */
    public RssFeed parse(String rss) {
        return toFeed(loader.load(rss));
    }

    /**
     * Same as {@link #parse(String)} for a UTF-8 encoded document.
     */
    public RssFeed parse(byte[] utf8) {
        return toFeed(loader.load(utf8));
    }

    private RssFeed toFeed(Document document) {
        Element rss = XmlUtil.findFirst(document.getDocumentElement(), "rss");
        if (rss == null) {
            throw new MissingElementException("rss", "Missing <rss> root element.");
        }

        String version = XmlUtil.attribute(rss, "version");
        if (version == null || version.isEmpty()) {
            version = RssFeed.SUPPORTED_VERSION;
        }

        Element channelElement = XmlUtil.firstChild(rss, "channel");
        if (channelElement == null) {
            throw new MissingElementException("channel", "Missing <channel> element inside <rss>.");
        }

        Channel channel = extractor.channel(channelElement);
        RssFeed feed = RssFeed.builder()
                .channel(channel)
                .version(version)
                .build();

        validator.validate(feed);
        log.debug("Parsed RSS {} channel '{}' with {} item(s)", version, channel.getTitle(), channel.getItems().size());
        return feed;
    }
}

package dev.feedcraft.service;

import dev.feedcraft.exception.DateGrammarException;
import dev.feedcraft.exception.FeedParseException;
import dev.feedcraft.metrics.FeedParseMetrics;
import dev.feedcraft.model.Item;
import dev.feedcraft.model.RssFeed;
import dev.feedcraft.parser.RssParser;
import dev.feedcraft.util.RssDates;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Application-facing wrapper around {@link RssParser} that adds logging, metrics and the
 * configured default zone for item dates.
 */
@Slf4j
@RequiredArgsConstructor
public class FeedParsingService {

    private final RssParser rssParser;
    private final FeedParseMetrics metrics;
    private final ZoneOffset defaultZone;

    /**
     * Parse a document, recording the outcome.
     *
     * @throws FeedParseException the parser's failure, unchanged
     */
    public RssFeed parse(String rss) {
        long start = System.nanoTime();
        try {
            RssFeed feed = rssParser.parse(rss);
            metrics.recordSuccess(feed.getChannel().getItems().size(), System.nanoTime() - start);
            log.info("Parsed feed '{}' ({} items)", feed.getChannel().getTitle(), feed.getChannel().getItems().size());
            return feed;
        } catch (FeedParseException e) {
            metrics.recordFailure(e.getKind(), System.nanoTime() - start);
            throw e;
        }
    }

    /**
     * Batch-friendly variant: a rejected document is logged and reported as empty so the caller
     * can move on to the next one.
     *
     * @param label identifies the document in log output, e.g. a file name
     */
    public Optional<RssFeed> tryParse(String label, String rss) {
        try {
            return Optional.of(parse(rss));
        } catch (FeedParseException e) {
            log.warn("Rejected feed {} ({}): {}", label, e.getKind(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Publication date of an item, using the configured default zone for zone-less dates.
     *
     * @throws DateGrammarException if the item carries a pubDate that is not RFC 822
     */
    public Optional<OffsetDateTime> publishedAt(Item item) {
        return RssDates.parseOptional(item.getPubDate(), defaultZone);
    }
}

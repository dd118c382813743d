package dev.feedcraft.exception;

/**
 * Thrown when a date string does not follow the RFC 822 grammar used by {@code pubDate} and
 * {@code lastBuildDate}.
 *
 * <p>
 * Deliberately not a {@link FeedParseException}: dates stay as text in the feed model and are only
 * parsed on request, so a bad date never fails a feed parse.
 */
public class DateGrammarException extends RuntimeException {

    public DateGrammarException(String message) {
        super(message);
    }

    public DateGrammarException(String message, Throwable cause) {
        super(message, cause);
    }
}

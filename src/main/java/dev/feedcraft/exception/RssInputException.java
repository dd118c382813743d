package dev.feedcraft.exception;

/**
 * Thrown when the raw input is rejected before any XML parsing is attempted:
 * missing, blank, undecodable, oversized, or carrying a DOCTYPE / ENTITY declaration.
 */
public class RssInputException extends FeedParseException {

    public RssInputException(String message) {
        super(ErrorKind.INPUT, message);
    }

    public RssInputException(String message, Throwable cause) {
        super(ErrorKind.INPUT, message, cause);
    }
}

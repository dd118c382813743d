package dev.feedcraft.exception;

/**
 * Thrown when an assembled feed model violates one of its invariants.
 */
public class FeedValidationException extends FeedParseException {

    public FeedValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}

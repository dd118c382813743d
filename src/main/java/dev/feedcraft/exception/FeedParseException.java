package dev.feedcraft.exception;

/**
 * Base type for every failure that aborts parsing of an RSS document.
 *
 * <p>
 * Unchecked, like the rest of the project's exceptions. Callers that need to branch on the
 * failure category can use {@link #getKind()} instead of a chain of {@code instanceof} checks.
 */
public abstract class FeedParseException extends RuntimeException {

    private final ErrorKind kind;

    protected FeedParseException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected FeedParseException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}

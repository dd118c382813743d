package dev.feedcraft.exception;

/**
 * Thrown when a structurally required element ({@code <rss>}, {@code <channel>} or one of the
 * channel's title / link / description) is absent or empty.
 */
public class MissingElementException extends FeedParseException {

    private final String elementName;

    public MissingElementException(String elementName, String message) {
        super(ErrorKind.MISSING_ELEMENT, message);
        this.elementName = elementName;
    }

    public String getElementName() {
        return elementName;
    }
}

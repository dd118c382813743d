package dev.feedcraft.exception;

/**
 * Thrown when the document is not well-formed XML.
 */
public class XmlSyntaxException extends FeedParseException {

    private final int lineNumber;
    private final int columnNumber;

    public XmlSyntaxException(String message, int lineNumber, int columnNumber, Throwable cause) {
        super(ErrorKind.XML_SYNTAX, message, cause);
        this.lineNumber = lineNumber;
        this.columnNumber = columnNumber;
    }

    public XmlSyntaxException(String message, Throwable cause) {
        this(message, -1, -1, cause);
    }

    /** Line of the first syntax error, or -1 when the parser did not report one. */
    public int getLineNumber() {
        return lineNumber;
    }

    public int getColumnNumber() {
        return columnNumber;
    }
}

package dev.feedcraft.exception;

/**
 * Failure categories a single {@code RssParser.parse} call can end in.
 */
public enum ErrorKind {
    INPUT,
    XML_SYNTAX,
    MISSING_ELEMENT,
    VALIDATION
}

package org.channelsim.io.json;

/**
 * Thrown when an input document is not well-formed JSON or does not match the expected shape
 * (for example a string where a number is required).
 */
public class DocumentReadException extends Exception {

    public DocumentReadException(String message) {
        super(message);
    }

    public DocumentReadException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.gridview.app.exceptions;

/**
 * Thrown when loaded bytes cannot be read as tabular text.
 * The session's existing grid is left untouched.
 */
public class MalformedDocumentException extends RuntimeException {
    public MalformedDocumentException(String message) {
        super(message);
    }

    public MalformedDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}

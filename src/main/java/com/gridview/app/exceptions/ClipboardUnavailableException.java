package com.gridview.app.exceptions;

/**
 * Thrown by a clipboard transport that cannot reach its clipboard.
 * Never fatal: copy/cut still return the extracted text.
 */
public class ClipboardUnavailableException extends RuntimeException {
    public ClipboardUnavailableException(String message) {
        super(message);
    }
}

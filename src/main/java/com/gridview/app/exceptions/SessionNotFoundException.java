package com.gridview.app.exceptions;

/**
 * Thrown when attempting to access a session ID
 * that doesn't exist in the in-memory registry.
 */
public class SessionNotFoundException extends RuntimeException {
    public SessionNotFoundException(String message) {
        super(message);
    }
}

package com.gridview.app.exceptions;

/**
 * Thrown when the grid cannot be encoded for saving.
 * Grid and dirty flag stay as they were so the save can be retried.
 */
public class DocumentSaveException extends RuntimeException {
    public DocumentSaveException(String message, Throwable cause) {
        super(message, cause);
    }
}

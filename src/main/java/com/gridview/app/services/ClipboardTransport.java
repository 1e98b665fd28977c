package com.gridview.app.services;

/**
 * Hands clipboard text to whatever clipboard the host environment has.
 * Implementations signal an unreachable clipboard with
 * {@link com.gridview.app.exceptions.ClipboardUnavailableException}.
 */
public interface ClipboardTransport {

    void setText(String text);

    /**
     * Current clipboard text, or null when the clipboard holds none.
     */
    String getText();
}

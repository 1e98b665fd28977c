package com.gridview.app.services;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local clipboard shared by all sessions of this server.
 */
@Component
public class InMemoryClipboardTransport implements ClipboardTransport {

    private final AtomicReference<String> text = new AtomicReference<>();

    @Override
    public void setText(String value) {
        text.set(value);
    }

    @Override
    public String getText() {
        return text.get();
    }
}

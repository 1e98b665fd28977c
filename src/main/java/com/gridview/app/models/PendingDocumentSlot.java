package com.gridview.app.models;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-slot mailbox between an asynchronous file read and the session.
 * Holds at most one (bytes, name) pair; a later offer replaces one that
 * was never consumed.
 */
public class PendingDocumentSlot {

    public record PendingDocument(byte[] bytes, String name) {
    }

    private final AtomicReference<PendingDocument> slot = new AtomicReference<>();

    public void offer(byte[] bytes, String name) {
        slot.set(new PendingDocument(bytes, name));
    }

    /**
     * Atomically takes the pending document, leaving the slot empty.
     */
    public Optional<PendingDocument> poll() {
        return Optional.ofNullable(slot.getAndSet(null));
    }
}

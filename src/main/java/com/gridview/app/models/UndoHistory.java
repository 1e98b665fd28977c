package com.gridview.app.models;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Linear undo/redo over full grid snapshots.
 * - Recording a new snapshot clears the redo side
 * - The undo side is bounded; the oldest snapshot is evicted first
 */
public class UndoHistory {

    public static final int DEFAULT_DEPTH = 50;

    private final int maxDepth;
    // Most recent snapshot first
    private final Deque<List<List<String>>> undoStack = new ArrayDeque<>();
    private final Deque<List<List<String>>> redoStack = new ArrayDeque<>();

    public UndoHistory() {
        this(DEFAULT_DEPTH);
    }

    public UndoHistory(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("History depth must be at least 1, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Pushes a snapshot taken before a mutation.
     */
    public void record(List<List<String>> snapshot) {
        undoStack.push(snapshot);
        redoStack.clear();
        while (undoStack.size() > maxDepth) {
            undoStack.removeLast();
        }
    }

    /**
     * Pops the last recorded snapshot, remembering {@code current} for redo.
     * Empty when there is nothing to undo.
     */
    public Optional<List<List<String>>> undo(List<List<String>> current) {
        if (undoStack.isEmpty()) {
            return Optional.empty();
        }
        redoStack.push(current);
        return Optional.of(undoStack.pop());
    }

    public Optional<List<List<String>>> redo(List<List<String>> current) {
        if (redoStack.isEmpty()) {
            return Optional.empty();
        }
        undoStack.push(current);
        return Optional.of(redoStack.pop());
    }

    public void clear() {
        undoStack.clear();
        redoStack.clear();
    }

    public int undoDepth() {
        return undoStack.size();
    }

    public int redoDepth() {
        return redoStack.size();
    }
}

package com.regulatory.conflict.store;

/**
 * Thrown when a conflict kept changing under a writer for longer than its retry budget.
 */
public class ConcurrentConflictModificationException extends RuntimeException {

    private final String conflictId;
    private final int attempts;

    public ConcurrentConflictModificationException(String conflictId, int attempts) {
        super("Conflict " + conflictId + " was modified concurrently, gave up after " + attempts + " attempts");
        this.conflictId = conflictId;
        this.attempts = attempts;
    }

    public String getConflictId() {
        return conflictId;
    }

    public int getAttempts() {
        return attempts;
    }
}

package com.jakewins.deadlock;

/**
 * Thrown when a thread takes or releases a {@link HierarchicalMutex} out of order. Nothing has been locked or
 * unlocked when this is thrown, so the caller can back off and try again in the right order.
 */
public class HierarchyViolationException extends RuntimeException {
    private final long requestedLevel;
    private final long currentLevel;

    public HierarchyViolationException(String message, long requestedLevel, long currentLevel) {
        super(message);
        this.requestedLevel = requestedLevel;
        this.currentLevel = currentLevel;
    }

    /** Level of the mutex the thread tried to lock or unlock */
    public long requestedLevel() {
        return requestedLevel;
    }

    /** Level of the most recently locked hierarchical mutex on the thread, or {@link Long#MAX_VALUE} for none */
    public long currentLevel() {
        return currentLevel;
    }
}

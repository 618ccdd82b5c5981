package com.property.reconciliation.reconcile;

/**
 * Every attempt lost the optimistic-concurrency race. Nothing from this call was written.
 */
public class ConcurrentUpdateException extends RuntimeException {

    private final int attempts;

    public ConcurrentUpdateException(String message, int attempts) {
        super(message);
        this.attempts = attempts;
    }

    public ConcurrentUpdateException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}

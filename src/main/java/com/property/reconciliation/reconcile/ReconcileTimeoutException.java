package com.property.reconciliation.reconcile;

/**
 * The caller's deadline passed between attempts. Nothing from this call was written.
 */
public class ReconcileTimeoutException extends RuntimeException {

    private final int attempts;

    public ReconcileTimeoutException(String message, int attempts) {
        super(message);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}

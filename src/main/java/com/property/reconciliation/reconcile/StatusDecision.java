package com.property.reconciliation.reconcile;

/**
 * What happened to the status claim of a request.
 */
public enum StatusDecision {
    NOT_REQUESTED,
    ACCEPTED,

    /**
     * The claimed status equals the stored one.
     */
    UNCHANGED,

    /**
     * A more trusted or more recent source owns the status.
     */
    TRUST_REJECTED,

    /**
     * The state machine does not allow the move (including any move out of a terminal status).
     */
    ILLEGAL_TRANSITION;

    public boolean isAccepted() {
        return this == ACCEPTED || this == UNCHANGED;
    }
}

package com.property.reconciliation.audit;

/**
 * An administrator's ruling on a refused write.
 */
public enum ConflictResolution {
    /**
     * The stored value stands.
     */
    KEEP_CURRENT,

    /**
     * The refused value is re-applied as an admin override.
     */
    ACCEPT_INCOMING
}

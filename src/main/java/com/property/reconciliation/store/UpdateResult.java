package com.property.reconciliation.store;

/**
 * Result of a conditional update.
 */
public enum UpdateResult {
    UPDATED,

    /**
     * The stored version no longer matched; nothing was written.
     */
    CONFLICT
}

package com.property.reconciliation.trust;

/**
 * How an accepted incoming value combines with the stored one.
 */
public enum MergeMode {
    /**
     * The incoming value replaces the stored value.
     */
    OVERRIDE,

    /**
     * Incoming elements are appended to the stored collection; nothing is removed
     * unless the caller explicitly asks for a replacement.
     */
    UNION
}

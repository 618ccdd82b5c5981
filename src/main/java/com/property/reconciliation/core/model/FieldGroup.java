package com.property.reconciliation.core.model;

/**
 * Fields that share one row of the trust table.
 */
public enum FieldGroup {
    PRICING_STATUS,
    CONTACT,
    DESCRIPTIVE,
    MEDIA,
    ADMIN_ONLY
}

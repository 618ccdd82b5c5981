package com.property.reconciliation.core.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Lifecycle status of a property.
 * Properties are never physically deleted; removal is modeled by a terminal status
 * so bookings and reports that reference the record stay resolvable.
 */
public enum PropertyStatus {
    /**
     * Created but not yet publishable (no media yet).
     */
    PENDING_IMAGES("pending_images"),

    ACTIVE("active"),

    /**
     * Reads as {@link #ACTIVE} but is its own predecessor for transition checks.
     */
    AVAILABLE("available"),

    /**
     * Under contract.
     */
    PENDING("pending"),

    SOLD("sold"),

    WITHDRAWN("withdrawn"),

    DELETED("deleted");

    private static final Map<String, PropertyStatus> ALIASES = Map.of(
            "off_market", WITHDRAWN,
            "expired", WITHDRAWN,
            "under_contract", PENDING
    );

    private final String value;

    PropertyStatus(String value) {
        this.value = value;
    }

    /**
     * Wire value used by collaborators and the persisted status column.
     */
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == SOLD || this == WITHDRAWN || this == DELETED;
    }

    /**
     * Status as presented to readers: {@link #AVAILABLE} is folded into {@link #ACTIVE}.
     */
    public PropertyStatus readStatus() {
        return this == AVAILABLE ? ACTIVE : this;
    }

    /**
     * Whether public listing pages may show a property in this status.
     */
    public boolean isPubliclyVisible() {
        return this == ACTIVE || this == AVAILABLE || this == PENDING;
    }

    /**
     * Parses a boundary status string, accepting canonical values, enum names and known aliases.
     *
     * @return the status, or empty if the value is not recognized
     */
    public static Optional<PropertyStatus> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (PropertyStatus status : values()) {
            if (status.value.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.ofNullable(ALIASES.get(normalized));
    }
}

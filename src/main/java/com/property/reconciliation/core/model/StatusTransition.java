package com.property.reconciliation.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable entry of the per-property transition log.
 * Kept for audit even though the live record only shows the current status.
 *
 * @param sequence 1-based position in the property's log
 */
public record StatusTransition(
        String propertyId,
        int sequence,
        PropertyStatus fromStatus,
        PropertyStatus toStatus,
        PropertySource source,
        String sourceId,
        Instant transitionedAt
) {
    public StatusTransition {
        Objects.requireNonNull(propertyId, "propertyId is required");
        Objects.requireNonNull(toStatus, "toStatus is required");
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(transitionedAt, "transitionedAt is required");
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be >= 1");
        }
    }

    public boolean isCreation() {
        return fromStatus == null;
    }
}

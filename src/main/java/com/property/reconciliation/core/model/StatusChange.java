package com.property.reconciliation.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A status transition accepted by a reconcile call but not yet written.
 * The store assigns the log sequence number when it commits the change
 * together with the state write.
 *
 * @param fromStatus previous status, or {@code null} for the creation entry
 */
public record StatusChange(PropertyStatus fromStatus,
                           PropertyStatus toStatus,
                           PropertySource source,
                           String sourceId,
                           Instant changedAt) {

    public StatusChange {
        Objects.requireNonNull(toStatus, "toStatus is required");
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(changedAt, "changedAt is required");
    }

    public static StatusChange creation(PropertySource source, String sourceId, Instant at) {
        return new StatusChange(null, PropertyStatus.PENDING_IMAGES, source, sourceId, at);
    }

    public StatusTransition toTransition(String propertyId, int sequence) {
        return new StatusTransition(propertyId, sequence, fromStatus, toStatus, source, sourceId, changedAt);
    }
}

package com.property.reconciliation.audit;

import com.property.reconciliation.core.model.PropertyField;
import com.property.reconciliation.core.model.PropertySource;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Ledger entry for a write the trust policy refused.
 * The incoming address, if any, is held only as its encrypted envelope.
 *
 * @param resolution {@code null} while the conflict is open
 */
public record PropertyConflict(String id,
                               String propertyId,
                               PropertyField field,
                               Object incomingValue,
                               PropertySource incomingSource,
                               String incomingSourceId,
                               PropertySource currentSource,
                               Instant observedAt,
                               Instant detectedAt,
                               ConflictResolution resolution,
                               String resolvedBy,
                               Instant resolvedAt) {

    public PropertyConflict {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(propertyId, "propertyId is required");
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(incomingSource, "incomingSource is required");
        Objects.requireNonNull(detectedAt, "detectedAt is required");
    }

    public static PropertyConflict open(String propertyId, PropertyField field, Object incomingValue,
                                        PropertySource incomingSource, String incomingSourceId,
                                        PropertySource currentSource, Instant observedAt, Instant detectedAt) {
        return new PropertyConflict(UUID.randomUUID().toString(), propertyId, field, incomingValue,
                incomingSource, incomingSourceId, currentSource, observedAt, detectedAt, null, null, null);
    }

    public boolean isResolved() {
        return resolution != null;
    }

    public PropertyConflict resolve(ConflictResolution resolution, String actor, Instant at) {
        Objects.requireNonNull(resolution, "resolution is required");
        return new PropertyConflict(id, propertyId, field, incomingValue, incomingSource, incomingSourceId,
                currentSource, observedAt, detectedAt, resolution, actor, at);
    }

    @Override
    public String toString() {
        return "PropertyConflict{id='" + id + "', propertyId='" + propertyId + "', field=" + field
                + ", incomingSource=" + incomingSource + ", currentSource=" + currentSource
                + ", resolution=" + resolution + '}';
    }
}

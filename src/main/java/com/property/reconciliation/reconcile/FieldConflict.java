package com.property.reconciliation.reconcile;

import com.property.reconciliation.core.model.PropertyField;
import com.property.reconciliation.core.model.PropertySource;

import java.time.Instant;
import java.util.Objects;

/**
 * A trust-rejected write, kept so an administrator can review it later.
 *
 * @param incomingValue the refused value; for the address this is the encrypted envelope
 */
public record FieldConflict(PropertyField field,
                            Object incomingValue,
                            PropertySource incomingSource,
                            String incomingSourceId,
                            PropertySource currentSource,
                            Instant observedAt) {

    public FieldConflict {
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(incomingSource, "incomingSource is required");
        Objects.requireNonNull(observedAt, "observedAt is required");
    }

    // Values are not printed: the address envelope and notes stay out of logs.
    @Override
    public String toString() {
        return "FieldConflict{field=" + field + ", incomingSource=" + incomingSource
                + ", currentSource=" + currentSource + '}';
    }
}

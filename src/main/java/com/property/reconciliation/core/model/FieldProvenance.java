package com.property.reconciliation.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Which source last won the right to set a field, and when.
 *
 * @param source    trust tier of the writer
 * @param sourceId  raw identifier the writer supplied (e.g. "har", "fub")
 * @param updatedAt when the winning value was observed
 */
public record FieldProvenance(PropertySource source, String sourceId, Instant updatedAt) {

    public FieldProvenance {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(updatedAt, "updatedAt is required");
    }
}

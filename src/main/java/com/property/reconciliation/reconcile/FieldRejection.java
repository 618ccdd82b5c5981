package com.property.reconciliation.reconcile;

import com.property.reconciliation.core.model.PropertyField;
import com.property.reconciliation.core.model.PropertySource;

import java.util.Objects;

/**
 * A field the request carried but the engine refused to write.
 *
 * @param winningSource source that owns the stored value, or {@code null} when there is none
 */
public record FieldRejection(PropertyField field, Reason reason, PropertySource winningSource) {

    public enum Reason {
        /**
         * The stored value came from a source with higher rank, or equal rank and newer data.
         */
        TRUST_REJECTED,

        /**
         * The source may never write this field.
         */
        SOURCE_NOT_PERMITTED
    }

    public FieldRejection {
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(reason, "reason is required");
    }
}

package com.property.reconciliation.reconcile;

import com.property.reconciliation.core.model.PropertyField;
import com.property.reconciliation.core.model.PropertyStatus;

import java.util.List;
import java.util.Optional;

/**
 * Field-by-field account of a reconcile call.
 *
 * @param propertyId      the record the call resolved to or created
 * @param created         whether the call created the record
 * @param applied         fields written, including the status when accepted
 * @param rejected        fields refused
 * @param unchanged       fields already holding the incoming value
 * @param statusDecision  fate of the status claim
 * @param requestedStatus the claimed status, or {@code null}
 * @param retries         conflicting writes this call had to retry past
 * @param persisted       whether anything was written
 * @param version         the record version after the call
 */
public record ReconciliationOutcome(String propertyId,
                                    boolean created,
                                    List<PropertyField> applied,
                                    List<FieldRejection> rejected,
                                    List<PropertyField> unchanged,
                                    StatusDecision statusDecision,
                                    PropertyStatus requestedStatus,
                                    int retries,
                                    boolean persisted,
                                    long version) {

    public ReconciliationOutcome {
        applied = List.copyOf(applied);
        rejected = List.copyOf(rejected);
        unchanged = List.copyOf(unchanged);
    }

    /**
     * True when the status claim was taken or was already true.
     */
    public boolean statusAccepted() {
        return statusDecision.isAccepted();
    }

    public boolean isApplied(PropertyField field) {
        return applied.contains(field);
    }

    public Optional<FieldRejection> rejectionFor(PropertyField field) {
        return rejected.stream().filter(r -> r.field() == field).findFirst();
    }

    public boolean isRejected(PropertyField field) {
        return rejectionFor(field).isPresent();
    }
}

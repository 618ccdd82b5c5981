package com.property.reconciliation.reconcile;

import com.property.reconciliation.core.model.PropertyField;
import com.property.reconciliation.core.model.PropertyState;
import com.property.reconciliation.core.model.StatusChange;

import java.util.List;

/**
 * Result of merging one request into one snapshot, before anything is written.
 *
 * @param state         the merged state; the input snapshot itself when {@code changed} is false
 * @param changed       whether a write is needed
 * @param statusChanges transition log entries to commit with the write
 */
record MergeResult(PropertyState state,
                   boolean changed,
                   List<PropertyField> applied,
                   List<FieldRejection> rejected,
                   List<PropertyField> unchanged,
                   StatusDecision statusDecision,
                   List<StatusChange> statusChanges,
                   List<FieldConflict> conflicts) {

    MergeResult {
        applied = List.copyOf(applied);
        rejected = List.copyOf(rejected);
        unchanged = List.copyOf(unchanged);
        statusChanges = List.copyOf(statusChanges);
        conflicts = List.copyOf(conflicts);
    }
}

package com.property.reconciliation.reconcile;

import com.property.reconciliation.core.model.PropertyState;

import java.util.Objects;

/**
 * The canonical state after a reconcile call plus what the call did to it.
 */
public record ReconciliationResult(PropertyState state, ReconciliationOutcome outcome) {

    public ReconciliationResult {
        Objects.requireNonNull(state, "state is required");
        Objects.requireNonNull(outcome, "outcome is required");
    }
}

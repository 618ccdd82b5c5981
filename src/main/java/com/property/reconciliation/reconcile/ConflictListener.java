package com.property.reconciliation.reconcile;

import com.property.reconciliation.core.model.PropertyState;

import java.util.List;

/**
 * Notified after a reconcile call that refused one or more writes on trust grounds.
 */
public interface ConflictListener {

    /**
     * @param state     the record as it stands after the call
     * @param conflicts refused writes, in field order
     */
    void onConflicts(PropertyState state, List<FieldConflict> conflicts);
}

package com.property.reconciliation.reconcile;

import com.property.reconciliation.store.InMemoryPropertyStore;
import com.property.reconciliation.store.PropertyStore;

class InMemoryReconcileStoreContractTest extends AbstractReconcileStoreContractTest {

    @Override
    protected PropertyStore createStore() {
        return new InMemoryPropertyStore();
    }
}

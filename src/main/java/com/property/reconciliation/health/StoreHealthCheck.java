package com.property.reconciliation.health;

import com.property.reconciliation.store.PropertyStore;
import com.property.reconciliation.store.StoreUnavailableException;

import java.util.Objects;

/**
 * Pings the property store and reports the round-trip time.
 */
public class StoreHealthCheck implements HealthCheck {

    private static final long SLOW_THRESHOLD_MS = 1_000;

    private final PropertyStore store;

    public StoreHealthCheck(PropertyStore store) {
        this.store = Objects.requireNonNull(store, "store is required");
    }

    @Override
    public String getName() {
        return "propertyStore";
    }

    @Override
    public HealthStatus check() {
        long start = System.nanoTime();
        try {
            store.ping();
        } catch (StoreUnavailableException e) {
            return HealthStatus.down("Store unreachable: " + e.getMessage());
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        HealthStatus base = elapsedMs > SLOW_THRESHOLD_MS
                ? HealthStatus.degraded("Store responding slowly")
                : HealthStatus.up();
        return base.withDetail("latencyMs", elapsedMs);
    }
}

package com.property.reconciliation.metrics;

import com.property.reconciliation.core.model.PropertyField;
import com.property.reconciliation.core.model.PropertySource;
import com.property.reconciliation.core.model.PropertyStatus;

import java.time.Duration;

/**
 * Discards every measurement.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordReconcileDuration(String result, Duration duration) {
    }

    @Override
    public void incrementPropertyCreated(PropertySource source) {
    }

    @Override
    public void incrementFieldRejected(PropertyField field) {
    }

    @Override
    public void incrementIllegalTransition(PropertyStatus from, PropertyStatus to) {
    }

    @Override
    public void recordRetries(int retries) {
    }

    @Override
    public void incrementConcurrentUpdateFailure() {
    }

    @Override
    public void incrementDecryptionFailure() {
    }

    @Override
    public void recordStatsCacheHit() {
    }

    @Override
    public void recordStatsCacheMiss() {
    }
}

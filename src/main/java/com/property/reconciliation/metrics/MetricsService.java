package com.property.reconciliation.metrics;

import com.property.reconciliation.core.model.PropertyField;
import com.property.reconciliation.core.model.PropertySource;
import com.property.reconciliation.core.model.PropertyStatus;

import java.time.Duration;

/**
 * Sink for reconciliation metrics.
 * {@link NoOpMetricsService} is the default so the library runs without Micrometer on the classpath.
 */
public interface MetricsService {

    /**
     * @param result outcome label: {@code created}, {@code updated}, {@code unchanged} or {@code failed}
     */
    void recordReconcileDuration(String result, Duration duration);

    void incrementPropertyCreated(PropertySource source);

    void incrementFieldRejected(PropertyField field);

    void incrementIllegalTransition(PropertyStatus from, PropertyStatus to);

    void recordRetries(int retries);

    void incrementConcurrentUpdateFailure();

    void incrementDecryptionFailure();

    void recordStatsCacheHit();

    void recordStatsCacheMiss();
}

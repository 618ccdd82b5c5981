package com.property.reconciliation.metrics;

import com.property.reconciliation.core.model.PropertyField;
import com.property.reconciliation.core.model.PropertySource;
import com.property.reconciliation.core.model.PropertyStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Micrometer-backed {@link MetricsService}. Requires {@code micrometer-core} (optional dependency).
 *
 * <ul>
 *   <li>{@code property.reconcile.duration}: Timer (tag: result)</li>
 *   <li>{@code property.created}: Counter (tag: source)</li>
 *   <li>{@code property.field.rejected}: Counter (tag: field)</li>
 *   <li>{@code property.status.illegal}: Counter (tags: from, to)</li>
 *   <li>{@code property.reconcile.retries}: DistributionSummary</li>
 *   <li>{@code property.reconcile.concurrent.failure}: Counter</li>
 *   <li>{@code property.address.decrypt.failure}: Counter</li>
 *   <li>{@code property.stats.cache.hit} / {@code property.stats.cache.miss}: Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final DistributionSummary retrySummary;
    private final Counter concurrentFailureCounter;
    private final Counter decryptionFailureCounter;
    private final Counter statsCacheHitCounter;
    private final Counter statsCacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.retrySummary = DistributionSummary.builder("property.reconcile.retries")
                .description("Optimistic-concurrency retries per reconcile call")
                .register(registry);
        this.concurrentFailureCounter = Counter.builder("property.reconcile.concurrent.failure")
                .description("Reconcile calls that exhausted their retries")
                .register(registry);
        this.decryptionFailureCounter = Counter.builder("property.address.decrypt.failure")
                .description("Stored addresses no configured key could open")
                .register(registry);
        this.statsCacheHitCounter = Counter.builder("property.stats.cache.hit")
                .description("Stats reads served from the snapshot cache")
                .register(registry);
        this.statsCacheMissCounter = Counter.builder("property.stats.cache.miss")
                .description("Stats reads that recomputed the snapshot")
                .register(registry);
    }

    @Override
    public void recordReconcileDuration(String result, Duration duration) {
        Timer timer = timers.computeIfAbsent(result, r ->
                Timer.builder("property.reconcile.duration")
                        .description("Duration of reconcile calls")
                        .tag("result", r)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementPropertyCreated(PropertySource source) {
        counter("created:" + source.name(), () -> Counter.builder("property.created")
                .description("Properties created by reconcile")
                .tag("source", source.name())
                .register(registry)).increment();
    }

    @Override
    public void incrementFieldRejected(PropertyField field) {
        counter("rejected:" + field.name(), () -> Counter.builder("property.field.rejected")
                .description("Field writes rejected by the trust policy")
                .tag("field", field.name())
                .register(registry)).increment();
    }

    @Override
    public void incrementIllegalTransition(PropertyStatus from, PropertyStatus to) {
        counter("illegal:" + from.name() + ":" + to.name(), () -> Counter.builder("property.status.illegal")
                .description("Status changes refused by the transition rules")
                .tag("from", from.value())
                .tag("to", to.value())
                .register(registry)).increment();
    }

    @Override
    public void recordRetries(int retries) {
        retrySummary.record(retries);
    }

    @Override
    public void incrementConcurrentUpdateFailure() {
        concurrentFailureCounter.increment();
    }

    @Override
    public void incrementDecryptionFailure() {
        decryptionFailureCounter.increment();
    }

    @Override
    public void recordStatsCacheHit() {
        statsCacheHitCounter.increment();
    }

    @Override
    public void recordStatsCacheMiss() {
        statsCacheMissCounter.increment();
    }

    private Counter counter(String key, Supplier<Counter> factory) {
        return counters.computeIfAbsent(key, k -> factory.get());
    }
}

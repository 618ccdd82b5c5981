package com.property.reconciliation.stats;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.property.reconciliation.core.model.PropertyStatus;
import com.property.reconciliation.metrics.MetricsService;
import com.property.reconciliation.store.PropertyCriteria;
import com.property.reconciliation.store.PropertyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Computes {@link PropertyStats} from the store's aggregate queries and keeps the last
 * snapshot in a Caffeine cache, so steady-state dashboard reads issue no queries.
 * Snapshots are eventually consistent with writes: at most one TTL old unless
 * {@link #refresh()} is called.
 */
public class StatsAggregator {
    private static final Logger log = LoggerFactory.getLogger(StatsAggregator.class);

    private static final String SNAPSHOT = "snapshot";

    private final PropertyStore store;
    private final MetricsService metrics;
    private final Clock clock;
    private final Cache<String, PropertyStats> cache;

    public StatsAggregator(PropertyStore store, Duration ttl, MetricsService metrics, Clock clock) {
        this(store, ttl, metrics, clock, Ticker.systemTicker());
    }

    StatsAggregator(PropertyStore store, Duration ttl, MetricsService metrics, Clock clock, Ticker ticker) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.cache = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .build();
        log.info("StatsAggregator initialized: ttl={}s", ttl.toSeconds());
    }

    /**
     * The cached snapshot, recomputed when it has expired.
     */
    public PropertyStats getStats() {
        PropertyStats cached = cache.getIfPresent(SNAPSHOT);
        if (cached != null) {
            metrics.recordStatsCacheHit();
            return cached;
        }
        metrics.recordStatsCacheMiss();
        return cache.get(SNAPSHOT, key -> compute());
    }

    /**
     * Recomputes the snapshot now and caches it.
     */
    public PropertyStats refresh() {
        PropertyStats stats = compute();
        cache.put(SNAPSHOT, stats);
        return stats;
    }

    public void invalidate() {
        cache.invalidateAll();
    }

    private PropertyStats compute() {
        long started = System.nanoTime();
        Map<PropertyStatus, Long> byStatus = store.countByStatus();
        long total = byStatus.values().stream().mapToLong(Long::longValue).sum();
        PropertyCriteria listed = PropertyCriteria.listed();
        long listedCount = byStatus.getOrDefault(PropertyStatus.ACTIVE, 0L)
                + byStatus.getOrDefault(PropertyStatus.AVAILABLE, 0L);
        PropertyStats stats = new PropertyStats(total, byStatus, listedCount,
                store.averagePrice(listed).orElse(null), clock.instant());
        log.debug("stats.computed total={} listed={} tookMs={}",
                total, listedCount, (System.nanoTime() - started) / 1_000_000);
        return stats;
    }
}

package com.property.reconciliation.api;

import com.property.reconciliation.audit.ConflictRepository;
import com.property.reconciliation.audit.ConflictResolution;
import com.property.reconciliation.audit.ConflictService;
import com.property.reconciliation.audit.InMemoryConflictRepository;
import com.property.reconciliation.audit.PropertyConflict;
import com.property.reconciliation.config.ReconciliationConfig;
import com.property.reconciliation.core.model.PropertyState;
import com.property.reconciliation.core.model.PropertyStatus;
import com.property.reconciliation.core.model.PropertyView;
import com.property.reconciliation.core.model.StatusTransition;
import com.property.reconciliation.crypto.AesGcmFieldCodec;
import com.property.reconciliation.crypto.DecryptionException;
import com.property.reconciliation.crypto.FieldCodec;
import com.property.reconciliation.health.CodecHealthCheck;
import com.property.reconciliation.health.HealthCheckRegistry;
import com.property.reconciliation.health.HealthStatus;
import com.property.reconciliation.health.StoreHealthCheck;
import com.property.reconciliation.metrics.MetricsService;
import com.property.reconciliation.metrics.NoOpMetricsService;
import com.property.reconciliation.reconcile.ReconciliationEngine;
import com.property.reconciliation.reconcile.ReconciliationResult;
import com.property.reconciliation.stats.PropertyStats;
import com.property.reconciliation.stats.StatsAggregator;
import com.property.reconciliation.store.PropertyStore;
import com.property.reconciliation.tracing.NoOpTracingService;
import com.property.reconciliation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Single entry point handed to collaborators (webhook handlers, scraper jobs, the admin console,
 * booking and dashboard handlers). Mutation only happens through {@link #reconcile}; nothing
 * here exposes the store.
 *
 * <pre>
 * PropertyStateManager manager = PropertyStateManager.builder()
 *         .store(new InMemoryPropertyStore())
 *         .config(ReconciliationConfig.fromEnvironment())
 *         .build();
 *
 * ReconciliationResult result = manager.reconcile(PropertyUpdateRequest.builder("har")
 *         .listingId("MLS123")
 *         .address("123 Main St")
 *         .price(new BigDecimal("300000"))
 *         .build());
 * </pre>
 */
public class PropertyStateManager {
    private static final Logger log = LoggerFactory.getLogger(PropertyStateManager.class);

    private static final Comparator<PropertyState> CREATION_ORDER =
            Comparator.comparing(PropertyState::getCreatedAt).thenComparing(PropertyState::getId);

    private final PropertyStore store;
    private final FieldCodec codec;
    private final ReconciliationEngine engine;
    private final ConflictService conflictService;
    private final StatsAggregator statsAggregator;
    private final HealthCheckRegistry healthChecks;
    private final MetricsService metrics;

    private PropertyStateManager(Builder builder) {
        this.store = builder.store;
        this.metrics = builder.metrics;
        this.codec = builder.codec != null ? builder.codec : new AesGcmFieldCodec(builder.config.keyRing());
        ReconciliationOptions options = builder.config.options();
        this.engine = ReconciliationEngine.builder()
                .store(store)
                .codec(codec)
                .trustPolicy(builder.config.trustPolicy())
                .options(options)
                .metrics(metrics)
                .tracing(builder.tracing)
                .clock(builder.clock)
                .build();
        this.conflictService = new ConflictService(builder.conflictRepository, engine, codec, builder.clock);
        this.engine.addConflictListener(conflictService);
        this.statsAggregator = new StatsAggregator(store, options.getStatsTtl(), metrics, builder.clock);
        this.healthChecks = new HealthCheckRegistry();
        this.healthChecks.register(new StoreHealthCheck(store));
        this.healthChecks.register(new CodecHealthCheck(codec));
        log.info("PropertyStateManager initialized: store={}, maxRetries={}, timeoutMs={}",
                store.getClass().getSimpleName(), options.getMaxRetries(), options.getTimeout().toMillis());
    }

    /**
     * Merges one source's update into the canonical record, creating it if needed.
     *
     * @see ReconciliationEngine#reconcile(PropertyUpdateRequest)
     */
    public ReconciliationResult reconcile(PropertyUpdateRequest request) {
        return engine.reconcile(request);
    }

    public ReconciliationResult reconcile(PropertyUpdateRequest request, Instant deadline) {
        return engine.reconcile(request, deadline);
    }

    public Optional<PropertyView> getByIdentity(String propertyId) {
        return store.findById(propertyId).map(this::view);
    }

    public Optional<PropertyView> getByListingId(String listingId) {
        return store.findByListingId(listingId).map(this::view);
    }

    public List<PropertyView> listByStatus(PropertyStatus status) {
        return store.listByStatus(status).stream().map(this::view).toList();
    }

    public Page<PropertyView> listByStatus(PropertyStatus status, PageRequest page) {
        return store.listByStatus(status, page).map(this::view);
    }

    /**
     * Records a public listing page may show: active, available and pending.
     */
    public List<PropertyView> listPublic() {
        List<PropertyState> visible = new ArrayList<>();
        for (PropertyStatus status : PropertyStatus.values()) {
            if (status.isPubliclyVisible()) {
                visible.addAll(store.listByStatus(status));
            }
        }
        visible.sort(CREATION_ORDER);
        return visible.stream().map(this::view).toList();
    }

    public PropertyStats getStats() {
        return statsAggregator.getStats();
    }

    public PropertyStats refreshStats() {
        return statsAggregator.refresh();
    }

    public List<StatusTransition> transitionsFor(String propertyId) {
        return store.transitionsFor(propertyId);
    }

    public List<PropertyConflict> unresolvedConflicts() {
        return conflictService.unresolved();
    }

    public List<PropertyConflict> unresolvedConflicts(String propertyId) {
        return conflictService.unresolvedFor(propertyId);
    }

    public PropertyConflict resolveConflict(String conflictId, ConflictResolution resolution, String actor) {
        return conflictService.resolve(conflictId, resolution, actor);
    }

    public HealthStatus checkHealth() {
        return healthChecks.checkAll();
    }

    private PropertyView view(PropertyState state) {
        String envelope = state.getAddressCiphertext();
        if (envelope == null) {
            return PropertyView.of(state, null);
        }
        try {
            return PropertyView.of(state, codec.decrypt(envelope));
        } catch (DecryptionException e) {
            metrics.incrementDecryptionFailure();
            log.warn("read.address_unavailable propertyId={} reason={}", state.getId(), e.getMessage());
            return PropertyView.addressUnavailable(state);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PropertyStore store;
        private ReconciliationConfig config;
        private FieldCodec codec;
        private ConflictRepository conflictRepository = new InMemoryConflictRepository();
        private MetricsService metrics = new NoOpMetricsService();
        private TracingService tracing = new NoOpTracingService();
        private Clock clock = Clock.systemUTC();

        public Builder store(PropertyStore store) {
            this.store = store;
            return this;
        }

        public Builder config(ReconciliationConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Replaces the AES-GCM codec built from the config's key ring.
         */
        public Builder codec(FieldCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder conflictRepository(ConflictRepository conflictRepository) {
            this.conflictRepository = conflictRepository;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder tracing(TracingService tracing) {
            this.tracing = tracing;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public PropertyStateManager build() {
            Objects.requireNonNull(store, "store is required");
            Objects.requireNonNull(config, "config is required");
            return new PropertyStateManager(this);
        }
    }
}

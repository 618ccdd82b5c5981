package com.property.reconciliation.reconcile;

import com.property.reconciliation.api.PropertyUpdateRequest;
import com.property.reconciliation.api.ReconciliationOptions;
import com.property.reconciliation.api.ValidationException;
import com.property.reconciliation.core.model.PropertyState;
import com.property.reconciliation.crypto.FieldCodec;
import com.property.reconciliation.lifecycle.StatusTransitionRules;
import com.property.reconciliation.logging.LogContext;
import com.property.reconciliation.metrics.MetricsService;
import com.property.reconciliation.metrics.NoOpMetricsService;
import com.property.reconciliation.store.DuplicateListingException;
import com.property.reconciliation.store.PropertyStore;
import com.property.reconciliation.store.UpdateResult;
import com.property.reconciliation.tracing.NoOpTracingService;
import com.property.reconciliation.tracing.ReconcileSpan;
import com.property.reconciliation.tracing.TracingService;
import com.property.reconciliation.trust.SourceTrustPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Merges update requests into canonical property records.
 *
 * <p>Each call loads the record, merges field by field, and writes with the store's conditional
 * update. A lost race re-reads and re-merges, up to {@link ReconciliationOptions#getMaxRetries()}
 * times. A call that changes nothing writes nothing. The deadline is checked before every attempt;
 * because each write is all-or-nothing, an expired or exhausted call leaves no partial state.</p>
 */
public class ReconciliationEngine {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final PropertyStore store;
    private final PropertyMerger merger;
    private final ReconciliationOptions options;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final Clock clock;
    private final List<ConflictListener> conflictListeners = new CopyOnWriteArrayList<>();

    private ReconciliationEngine(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store is required");
        this.merger = new PropertyMerger(builder.trustPolicy, builder.transitionRules,
                Objects.requireNonNull(builder.codec, "codec is required"));
        this.options = builder.options;
        this.metrics = builder.metrics;
        this.tracing = builder.tracing;
        this.clock = builder.clock;
    }

    public ReconciliationResult reconcile(PropertyUpdateRequest request) {
        return reconcile(request, clock.instant().plus(options.getTimeout()));
    }

    /**
     * @param deadline no new attempt starts at or after this instant
     * @throws ValidationException        if the request cannot be resolved to a record
     * @throws ConcurrentUpdateException  if every attempt lost a concurrent write
     * @throws ReconcileTimeoutException  if the deadline passed
     */
    public ReconciliationResult reconcile(PropertyUpdateRequest request, Instant deadline) {
        Objects.requireNonNull(request, "request is required");
        Objects.requireNonNull(deadline, "deadline is required");
        long start = System.nanoTime();

        try (LogContext ctx = LogContext.forReconcile(LogContext.generateCorrelationId(),
                request.getSourceId(), request.getListingId());
             ReconcileSpan span = tracing.startReconcile(request.getSource())) {
            log.debug("reconcile.starting request={}", request);
            try {
                Attempt attempt = attempt(request, deadline);
                ReconciliationOutcome outcome = attempt.result().outcome();
                span.finished(outcome.propertyId(), resultLabel(outcome), outcome.retries());

                recordOutcome(attempt.result().state(), outcome, Duration.ofNanos(System.nanoTime() - start));
                if (!attempt.conflicts().isEmpty()) {
                    notifyConflictListeners(attempt.result().state(), attempt.conflicts());
                }
                return attempt.result();
            } catch (RuntimeException e) {
                span.failed(e);
                metrics.recordReconcileDuration("failed", Duration.ofNanos(System.nanoTime() - start));
                throw e;
            }
        }
    }

    public void addConflictListener(ConflictListener listener) {
        if (listener != null) {
            conflictListeners.add(listener);
        }
    }

    public ReconciliationOptions getOptions() {
        return options;
    }

    private record Attempt(ReconciliationResult result, List<FieldConflict> conflicts) {
    }

    private Attempt attempt(PropertyUpdateRequest request, Instant deadline) {
        int retries = 0;
        while (true) {
            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                log.warn("reconcile.deadline_expired retries={}", retries);
                throw new ReconcileTimeoutException(
                        "Reconcile deadline passed after " + retries + " retries", retries);
            }

            PropertyState current = resolveTarget(request);
            MergeResult merge = merger.merge(current, request, now.truncatedTo(ChronoUnit.MILLIS));

            if (!merge.changed()) {
                log.debug("reconcile.unchanged propertyId={} version={}",
                        current.getId(), current.getVersion());
                return finish(request, merge, false, false, retries);
            }

            if (current == null) {
                try {
                    store.create(merge.state(), merge.statusChanges());
                    metrics.incrementPropertyCreated(request.getSource());
                    log.info("reconcile.created propertyId={} status={} source={}",
                            merge.state().getId(), merge.state().getStatus().value(), request.getSource());
                    return finish(request, merge, true, true, retries);
                } catch (DuplicateListingException e) {
                    log.debug("reconcile.create_raced listingId={}", e.getListingId());
                }
            } else {
                try {
                    UpdateResult result = store.conditionalUpdate(current.getId(), current.getVersion(),
                            merge.state(), merge.statusChanges());
                    if (result == UpdateResult.UPDATED) {
                        log.info("reconcile.committed propertyId={} version={} applied={} rejected={}",
                                current.getId(), merge.state().getVersion(), merge.applied(),
                                merge.rejected().size());
                        return finish(request, merge, false, true, retries);
                    }
                } catch (DuplicateListingException e) {
                    log.debug("reconcile.listing_claimed listingId={}", e.getListingId());
                }
            }

            retries++;
            if (retries > options.getMaxRetries()) {
                metrics.incrementConcurrentUpdateFailure();
                log.warn("reconcile.retries_exhausted propertyId={} attempts={}",
                        current != null ? current.getId() : null, retries);
                throw new ConcurrentUpdateException("Concurrent updates won all " + retries
                        + " attempts for listingId=" + request.getListingId()
                        + " propertyId=" + request.getPropertyId(), retries);
            }
            backoff(retries);
        }
    }

    /**
     * Finds the record a request refers to: listing id first, then property id.
     *
     * @return the record, or {@code null} when a new one should be created
     */
    private PropertyState resolveTarget(PropertyUpdateRequest request) {
        String listingId = request.getListingId();
        String propertyId = request.getPropertyId();

        if (listingId != null) {
            Optional<PropertyState> byListing = store.findByListingId(listingId);
            if (byListing.isPresent()) {
                PropertyState found = byListing.get();
                if (propertyId != null && !propertyId.equals(found.getId())) {
                    throw new ValidationException("listingId " + listingId
                            + " belongs to a different property than " + propertyId);
                }
                return found;
            }
        }

        if (propertyId != null) {
            PropertyState found = store.findById(propertyId)
                    .orElseThrow(() -> new ValidationException("Unknown propertyId: " + propertyId));
            if (listingId != null && found.getListingId() != null && !listingId.equals(found.getListingId())) {
                throw new ValidationException("propertyId " + propertyId + " carries listingId "
                        + found.getListingId() + ", not " + listingId);
            }
            return found;
        }

        if (request.getAddress().isEmpty()) {
            throw new ValidationException("Cannot create property for listingId " + listingId
                    + " without an address");
        }
        return null;
    }

    private Attempt finish(PropertyUpdateRequest request, MergeResult merge, boolean created,
                           boolean persisted, int retries) {
        PropertyState state = merge.state();
        ReconciliationOutcome outcome = new ReconciliationOutcome(
                state.getId(),
                created,
                merge.applied(),
                merge.rejected(),
                merge.unchanged(),
                merge.statusDecision(),
                request.getStatus(),
                retries,
                persisted,
                state.getVersion());
        return new Attempt(new ReconciliationResult(state, outcome), merge.conflicts());
    }

    private void recordOutcome(PropertyState state, ReconciliationOutcome outcome, Duration elapsed) {
        metrics.recordReconcileDuration(resultLabel(outcome), elapsed);
        metrics.recordRetries(outcome.retries());
        for (FieldRejection rejection : outcome.rejected()) {
            metrics.incrementFieldRejected(rejection.field());
        }
        if (outcome.statusDecision() == StatusDecision.ILLEGAL_TRANSITION) {
            metrics.incrementIllegalTransition(state.getStatus(), outcome.requestedStatus());
        }
    }

    private static String resultLabel(ReconciliationOutcome outcome) {
        return outcome.created() ? "created" : outcome.persisted() ? "updated" : "unchanged";
    }

    private void notifyConflictListeners(PropertyState state, List<FieldConflict> conflicts) {
        for (ConflictListener listener : conflictListeners) {
            try {
                listener.onConflicts(state, conflicts);
            } catch (Exception e) {
                log.warn("Conflict listener notification failed: {}", e.getMessage());
            }
        }
    }

    private void backoff(int attempt) {
        long pause = options.getRetryBackoffMs() * attempt;
        if (pause <= 0) {
            return;
        }
        try {
            Thread.sleep(pause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrentUpdateException("Interrupted while retrying reconcile", attempt, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PropertyStore store;
        private FieldCodec codec;
        private SourceTrustPolicy trustPolicy;
        private StatusTransitionRules transitionRules = StatusTransitionRules.defaults();
        private ReconciliationOptions options = ReconciliationOptions.defaults();
        private MetricsService metrics = new NoOpMetricsService();
        private TracingService tracing = new NoOpTracingService();
        private Clock clock = Clock.systemUTC();

        public Builder store(PropertyStore store) {
            this.store = store;
            return this;
        }

        public Builder codec(FieldCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder trustPolicy(SourceTrustPolicy trustPolicy) {
            this.trustPolicy = trustPolicy;
            return this;
        }

        public Builder transitionRules(StatusTransitionRules transitionRules) {
            this.transitionRules = transitionRules;
            return this;
        }

        public Builder options(ReconciliationOptions options) {
            this.options = options;
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

        public ReconciliationEngine build() {
            if (trustPolicy == null) {
                trustPolicy = SourceTrustPolicy.defaults();
            }
            return new ReconciliationEngine(this);
        }
    }
}

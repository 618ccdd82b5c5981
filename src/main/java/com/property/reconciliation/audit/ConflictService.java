package com.property.reconciliation.audit;

import com.property.reconciliation.api.PropertyUpdateRequest;
import com.property.reconciliation.api.ValidationException;
import com.property.reconciliation.core.model.PropertyField;
import com.property.reconciliation.core.model.PropertyState;
import com.property.reconciliation.crypto.DecryptionException;
import com.property.reconciliation.crypto.FieldCodec;
import com.property.reconciliation.logging.LogContext;
import com.property.reconciliation.reconcile.ConflictListener;
import com.property.reconciliation.reconcile.FieldConflict;
import com.property.reconciliation.reconcile.ReconciliationEngine;
import com.property.reconciliation.reconcile.ReconciliationResult;
import com.property.reconciliation.reconcile.StatusDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Keeps the conflict ledger: records trust-rejected writes reported by the engine and
 * applies administrators' rulings on them.
 *
 * <p>A refusal that repeats an open conflict (same property, field, source and value)
 * is not recorded twice.</p>
 */
public class ConflictService implements ConflictListener {
    private static final Logger log = LoggerFactory.getLogger(ConflictService.class);

    /**
     * Source identifier used when an accepted conflict is re-applied.
     */
    public static final String RESOLUTION_SOURCE = "admin";

    private final ConflictRepository repository;
    private final ReconciliationEngine engine;
    private final FieldCodec codec;
    private final Clock clock;

    public ConflictService(ConflictRepository repository, ReconciliationEngine engine, FieldCodec codec, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository is required");
        this.engine = Objects.requireNonNull(engine, "engine is required");
        this.codec = Objects.requireNonNull(codec, "codec is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public void onConflicts(PropertyState state, List<FieldConflict> conflicts) {
        List<PropertyConflict> open = repository.findByPropertyId(state.getId());
        for (FieldConflict conflict : conflicts) {
            boolean duplicate = open.stream()
                    .filter(existing -> !existing.isResolved())
                    .anyMatch(existing -> sameClaim(existing, conflict));
            if (duplicate) {
                continue;
            }
            PropertyConflict saved = repository.save(PropertyConflict.open(state.getId(), conflict.field(),
                    conflict.incomingValue(), conflict.incomingSource(), conflict.incomingSourceId(),
                    conflict.currentSource(), conflict.observedAt(), clock.instant()));
            log.info("conflict.recorded conflictId={} propertyId={} field={} incomingSource={} currentSource={}",
                    saved.id(), saved.propertyId(), saved.field(), saved.incomingSource(), saved.currentSource());
        }
    }

    public List<PropertyConflict> unresolved() {
        return repository.findUnresolved();
    }

    public List<PropertyConflict> unresolvedFor(String propertyId) {
        return repository.findByPropertyId(propertyId).stream()
                .filter(c -> !c.isResolved())
                .toList();
    }

    public List<PropertyConflict> historyFor(String propertyId) {
        return repository.findByPropertyId(propertyId);
    }

    /**
     * Applies a ruling. Accepting re-submits the refused value through the engine as an admin
     * override; the state machine still applies to a status value.
     *
     * @throws ValidationException if the conflict is unknown, already resolved, or its status
     *                             value is no longer a legal move
     */
    public PropertyConflict resolve(String conflictId, ConflictResolution resolution, String actor) {
        Objects.requireNonNull(resolution, "resolution is required");
        if (actor == null || actor.isBlank()) {
            throw new ValidationException("actor is required");
        }
        PropertyConflict conflict = repository.findById(conflictId)
                .orElseThrow(() -> new ValidationException("Unknown conflict: " + conflictId));
        if (conflict.isResolved()) {
            throw new ValidationException("Conflict " + conflictId + " is already resolved");
        }

        try (LogContext ctx = LogContext.forConflictResolution(conflictId, actor)) {
            if (resolution == ConflictResolution.ACCEPT_INCOMING) {
                reapply(conflict);
            }
            PropertyConflict resolved = conflict.resolve(resolution, actor, clock.instant());
            if (!repository.replace(conflict, resolved)) {
                throw new ValidationException("Conflict " + conflictId + " is already resolved");
            }
            log.info("conflict.resolved conflictId={} propertyId={} field={} resolution={}",
                    conflictId, conflict.propertyId(), conflict.field(), resolution);
            return resolved;
        }
    }

    private void reapply(PropertyConflict conflict) {
        Object value = conflict.incomingValue();
        if (conflict.field() == PropertyField.ADDRESS) {
            try {
                value = codec.decrypt((String) value);
            } catch (DecryptionException e) {
                throw new ValidationException("Conflict " + conflict.id() + " holds an address no configured key opens");
            }
        }
        PropertyUpdateRequest request = PropertyUpdateRequest.builder(RESOLUTION_SOURCE)
                .propertyId(conflict.propertyId())
                .value(conflict.field(), value)
                .overrideTrust(true)
                .build();
        ReconciliationResult result = engine.reconcile(request);
        if (conflict.field() == PropertyField.STATUS
                && result.outcome().statusDecision() == StatusDecision.ILLEGAL_TRANSITION) {
            throw new ValidationException("Status " + value + " is no longer reachable from "
                    + result.state().getStatus().value());
        }
    }

    private boolean sameClaim(PropertyConflict existing, FieldConflict incoming) {
        if (existing.field() != incoming.field()
                || !Objects.equals(existing.incomingSourceId(), incoming.incomingSourceId())) {
            return false;
        }
        Object a = existing.incomingValue();
        Object b = incoming.incomingValue();
        if (a instanceof BigDecimal && b instanceof BigDecimal) {
            return ((BigDecimal) a).compareTo((BigDecimal) b) == 0;
        }
        if (incoming.field() == PropertyField.ADDRESS) {
            try {
                return codec.decrypt((String) a).equals(codec.decrypt((String) b));
            } catch (DecryptionException e) {
                return false;
            }
        }
        return Objects.equals(a, b);
    }
}

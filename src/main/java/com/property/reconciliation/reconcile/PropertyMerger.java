package com.property.reconciliation.reconcile;

import com.property.reconciliation.api.PropertyUpdateRequest;
import com.property.reconciliation.core.model.FieldGroup;
import com.property.reconciliation.core.model.FieldProvenance;
import com.property.reconciliation.core.model.PropertyField;
import com.property.reconciliation.core.model.PropertySource;
import com.property.reconciliation.core.model.PropertyState;
import com.property.reconciliation.core.model.PropertyStatus;
import com.property.reconciliation.core.model.StatusChange;
import com.property.reconciliation.crypto.DecryptionException;
import com.property.reconciliation.crypto.FieldCodec;
import com.property.reconciliation.lifecycle.StatusTransitionRules;
import com.property.reconciliation.trust.MergeMode;
import com.property.reconciliation.trust.SourceTrustPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Folds one update request into one snapshot. Touches no storage: the engine owns
 * loading, writing and retrying.
 *
 * <p>Per field: a value equal to the stored one is unchanged; otherwise it is applied when the
 * field is unset, when the request outranks the field's provenance, or when the admin override
 * is set; otherwise it is refused. The status claim is checked against the state machine first
 * and the trust policy second.</p>
 */
class PropertyMerger {
    private static final Logger log = LoggerFactory.getLogger(PropertyMerger.class);

    private final SourceTrustPolicy trustPolicy;
    private final StatusTransitionRules transitionRules;
    private final FieldCodec codec;

    PropertyMerger(SourceTrustPolicy trustPolicy, StatusTransitionRules transitionRules, FieldCodec codec) {
        this.trustPolicy = Objects.requireNonNull(trustPolicy, "trustPolicy is required");
        this.transitionRules = Objects.requireNonNull(transitionRules, "transitionRules is required");
        this.codec = Objects.requireNonNull(codec, "codec is required");
    }

    /**
     * @param current the stored snapshot, or {@code null} to build a new record
     * @param now     commit timestamp, millisecond precision
     */
    MergeResult merge(PropertyState current, PropertyUpdateRequest request, Instant now) {
        Merge merge = new Merge(current, request, now);
        for (Map.Entry<PropertyField, Object> entry : request.getValues().entrySet()) {
            merge.field(entry.getKey(), entry.getValue());
        }
        StatusDecision decision = merge.status();
        return merge.result(decision);
    }

    static Instant effectiveObservedAt(Instant observedAt, Instant now) {
        if (observedAt == null || observedAt.isAfter(now)) {
            return now;
        }
        return observedAt.truncatedTo(ChronoUnit.MILLIS);
    }

    /**
     * Working state of a single merge.
     */
    private final class Merge {
        private final PropertyState base;
        private final boolean creating;
        private final PropertyUpdateRequest request;
        private final PropertySource source;
        private final Instant now;
        private final Instant observedAt;
        private final PropertyState.Builder next;

        private final List<PropertyField> applied = new ArrayList<>();
        private final List<FieldRejection> rejected = new ArrayList<>();
        private final List<PropertyField> unchanged = new ArrayList<>();
        private final List<StatusChange> statusChanges = new ArrayList<>();
        private final List<FieldConflict> conflicts = new ArrayList<>();
        private boolean changed;

        private Merge(PropertyState current, PropertyUpdateRequest request, Instant now) {
            this.creating = current == null;
            this.request = request;
            this.source = request.getSource();
            this.now = now;
            this.observedAt = effectiveObservedAt(request.getObservedAt(), now);
            this.base = creating
                    ? PropertyState.builder()
                        .listingId(request.getListingId())
                        .status(PropertyStatus.PENDING_IMAGES)
                        .createdAt(now)
                        .updatedAt(now)
                        .build()
                    : current;
            this.next = PropertyState.builder(base);

            if (creating) {
                statusChanges.add(StatusChange.creation(source, request.getSourceId(), now));
                changed = true;
            } else if (base.getListingId() == null && request.getListingId() != null) {
                next.listingId(request.getListingId());
                changed = true;
            }
        }

        void field(PropertyField field, Object incoming) {
            if (field.group() == FieldGroup.ADMIN_ONLY) {
                adminOnlyField(field, incoming);
                return;
            }
            if (field == PropertyField.IMAGES && trustPolicy.mergeMode(field) == MergeMode.UNION
                    && !request.isReplaceImages()) {
                unionImages(incoming);
                return;
            }

            if (sameValue(field, incoming)) {
                unchanged.add(field);
                return;
            }
            // Unset means never written: a trusted clear keeps its provenance.
            FieldProvenance provenance = base.provenanceOf(field).orElse(null);
            boolean unset = provenance == null;
            if (unset || request.isOverrideTrust()
                    || trustPolicy.outranks(field, source, observedAt, provenance)) {
                Object stored = field == PropertyField.ADDRESS ? codec.encrypt((String) incoming) : incoming;
                apply(field, stored);
            } else {
                reject(field, incoming, provenance);
            }
        }

        private void adminOnlyField(PropertyField field, Object incoming) {
            if (trustPolicy.rank(field, source) == 0) {
                rejected.add(new FieldRejection(field, FieldRejection.Reason.SOURCE_NOT_PERMITTED, null));
                return;
            }
            if (Objects.equals(base.get(field), incoming)) {
                unchanged.add(field);
                return;
            }
            next.set(field, incoming);
            applied.add(field);
            changed = true;
        }

        @SuppressWarnings("unchecked")
        private void unionImages(Object incoming) {
            List<String> currentImages = base.getImages();
            Set<String> union = new LinkedHashSet<>(currentImages);
            union.addAll((List<String>) incoming);
            if (union.size() == currentImages.size()) {
                unchanged.add(PropertyField.IMAGES);
                return;
            }
            // Appending never removes anything, but an unranked source may only seed media no one has written.
            boolean unset = base.provenanceOf(PropertyField.IMAGES).isEmpty();
            if (unset || request.isOverrideTrust()
                    || trustPolicy.rank(PropertyField.IMAGES, source) > 0) {
                apply(PropertyField.IMAGES, List.copyOf(union));
            } else {
                reject(PropertyField.IMAGES, incoming, base.provenanceOf(PropertyField.IMAGES).orElse(null));
            }
        }

        StatusDecision status() {
            PropertyStatus requested = request.getStatus();
            if (requested == null) {
                return StatusDecision.NOT_REQUESTED;
            }
            PropertyStatus from = base.getStatus();
            if (requested == from) {
                unchanged.add(PropertyField.STATUS);
                return StatusDecision.UNCHANGED;
            }
            if (!transitionRules.isLegalFor(source, from, requested)) {
                log.debug("merge.illegal_transition propertyId={} from={} to={} source={}",
                        base.getId(), from.value(), requested.value(), source);
                return StatusDecision.ILLEGAL_TRANSITION;
            }
            FieldProvenance provenance = base.provenanceOf(PropertyField.STATUS).orElse(null);
            if (provenance != null && !request.isOverrideTrust()
                    && !trustPolicy.outranks(PropertyField.STATUS, source, observedAt, provenance)) {
                reject(PropertyField.STATUS, requested, provenance);
                return StatusDecision.TRUST_REJECTED;
            }
            next.status(requested);
            next.provenance(PropertyField.STATUS, new FieldProvenance(source, request.getSourceId(), observedAt));
            statusChanges.add(new StatusChange(from, requested, source, request.getSourceId(), now));
            applied.add(PropertyField.STATUS);
            changed = true;
            return StatusDecision.ACCEPTED;
        }

        MergeResult result(StatusDecision decision) {
            if (!changed) {
                return new MergeResult(base, false, applied, rejected, unchanged, decision, List.of(), conflicts);
            }
            PropertyState merged = next
                    .version(base.getVersion() + 1)
                    .updatedAt(now)
                    .build();
            return new MergeResult(merged, true, applied, rejected, unchanged, decision, statusChanges, conflicts);
        }

        private void apply(PropertyField field, Object stored) {
            next.set(field, stored);
            next.provenance(field, new FieldProvenance(source, request.getSourceId(), observedAt));
            applied.add(field);
            changed = true;
        }

        private void reject(PropertyField field, Object incoming, FieldProvenance provenance) {
            PropertySource winner = provenance != null ? provenance.source() : null;
            rejected.add(new FieldRejection(field, FieldRejection.Reason.TRUST_REJECTED, winner));
            Object kept = field == PropertyField.ADDRESS ? codec.encrypt((String) incoming) : incoming;
            conflicts.add(new FieldConflict(field, kept, source, request.getSourceId(), winner, observedAt));
        }

        private boolean sameValue(PropertyField field, Object incoming) {
            return switch (field) {
                case ADDRESS -> sameAddress((String) incoming);
                case PRICE -> base.getPrice() != null && base.getPrice().compareTo((BigDecimal) incoming) == 0;
                case IMAGES -> base.getImages().equals(incoming);
                default -> Objects.equals(base.get(field), incoming);
            };
        }

        private boolean sameAddress(String incoming) {
            String envelope = base.getAddressCiphertext();
            if (envelope == null) {
                return false;
            }
            try {
                return codec.decrypt(envelope).equals(incoming);
            } catch (DecryptionException e) {
                log.warn("merge.address_unreadable propertyId={} reason={}", base.getId(), e.getMessage());
                return false;
            }
        }
    }
}

package com.property.reconciliation.lifecycle;

import com.property.reconciliation.core.model.PropertySource;
import com.property.reconciliation.core.model.PropertyStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.property.reconciliation.core.model.PropertyStatus.*;

/**
 * Legal status transitions, independent of storage.
 *
 * <pre>
 * pending_images -> active | available
 * active &lt;-> available, active | available &lt;-> pending
 * pending -> sold
 * any non-terminal -> withdrawn | deleted
 * </pre>
 *
 * Terminal states have no outgoing transitions: re-listing creates a new identity.
 * A status equal to the current one is not a transition and is never legal here.
 */
public final class StatusTransitionRules {

    private final Map<PropertyStatus, Set<PropertyStatus>> legal;
    private final Map<PropertyStatus, Set<PropertyStatus>> bookingForward;

    public StatusTransitionRules(Map<PropertyStatus, Set<PropertyStatus>> legal,
                                 Map<PropertyStatus, Set<PropertyStatus>> bookingForward) {
        this.legal = freeze(legal);
        this.bookingForward = freeze(bookingForward);
    }

    public static StatusTransitionRules defaults() {
        Map<PropertyStatus, Set<PropertyStatus>> legal = new EnumMap<>(PropertyStatus.class);
        legal.put(PENDING_IMAGES, EnumSet.of(ACTIVE, AVAILABLE, WITHDRAWN, DELETED));
        legal.put(ACTIVE, EnumSet.of(AVAILABLE, PENDING, WITHDRAWN, DELETED));
        legal.put(AVAILABLE, EnumSet.of(ACTIVE, PENDING, WITHDRAWN, DELETED));
        legal.put(PENDING, EnumSet.of(ACTIVE, AVAILABLE, SOLD, WITHDRAWN, DELETED));

        // The booking pipeline only walks the happy path forward.
        Map<PropertyStatus, Set<PropertyStatus>> forward = new EnumMap<>(PropertyStatus.class);
        forward.put(PENDING_IMAGES, EnumSet.of(ACTIVE, AVAILABLE));
        forward.put(ACTIVE, EnumSet.of(PENDING));
        forward.put(AVAILABLE, EnumSet.of(PENDING));
        forward.put(PENDING, EnumSet.of(SOLD));
        return new StatusTransitionRules(legal, forward);
    }

    public boolean isLegal(PropertyStatus current, PropertyStatus proposed) {
        Objects.requireNonNull(current, "current status is required");
        Objects.requireNonNull(proposed, "proposed status is required");
        return legal.getOrDefault(current, Set.of()).contains(proposed);
    }

    /**
     * Legality for a specific writer. The booking pipeline is limited to forward steps.
     */
    public boolean isLegalFor(PropertySource source, PropertyStatus current, PropertyStatus proposed) {
        if (!isLegal(current, proposed)) {
            return false;
        }
        if (source == PropertySource.BOOKING) {
            return bookingForward.getOrDefault(current, Set.of()).contains(proposed);
        }
        return true;
    }

    public Set<PropertyStatus> allowedFrom(PropertyStatus current) {
        return legal.getOrDefault(current, Set.of());
    }

    public boolean isTerminal(PropertyStatus status) {
        return allowedFrom(status).isEmpty();
    }

    private static Map<PropertyStatus, Set<PropertyStatus>> freeze(Map<PropertyStatus, Set<PropertyStatus>> source) {
        EnumMap<PropertyStatus, Set<PropertyStatus>> copy = new EnumMap<>(PropertyStatus.class);
        source.forEach((from, targets) -> copy.put(from, targets.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(targets))));
        return Collections.unmodifiableMap(copy);
    }
}

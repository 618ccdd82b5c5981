package com.property.reconciliation.store;

import com.property.reconciliation.core.model.PropertyState;
import com.property.reconciliation.core.model.PropertyStatus;

import java.util.EnumSet;
import java.util.Set;

/**
 * Predicate for aggregate queries. An empty status set matches every status;
 * a {@code null} city matches every city.
 */
public record PropertyCriteria(Set<PropertyStatus> statuses, String city) {

    public PropertyCriteria {
        statuses = statuses == null || statuses.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(statuses));
    }

    public static PropertyCriteria all() {
        return new PropertyCriteria(Set.of(), null);
    }

    public static PropertyCriteria withStatus(PropertyStatus first, PropertyStatus... rest) {
        return new PropertyCriteria(EnumSet.of(first, rest), null);
    }

    /**
     * Active and available records: the ones a buyer can book a showing for.
     */
    public static PropertyCriteria listed() {
        return withStatus(PropertyStatus.ACTIVE, PropertyStatus.AVAILABLE);
    }

    public PropertyCriteria inCity(String city) {
        return new PropertyCriteria(statuses, city);
    }

    public boolean matches(PropertyState state) {
        if (!statuses.isEmpty() && !statuses.contains(state.getStatus())) {
            return false;
        }
        return city == null || city.equalsIgnoreCase(state.getCity());
    }
}

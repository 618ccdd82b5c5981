package com.property.reconciliation.audit;

import java.util.List;
import java.util.Optional;

/**
 * Append-only storage for {@link PropertyConflict}s. Entries are never removed; resolving one
 * replaces it with its resolved form.
 */
public interface ConflictRepository {

    PropertyConflict save(PropertyConflict conflict);

    Optional<PropertyConflict> findById(String id);

    /**
     * Swaps {@code expected} for {@code updated} only if the stored entry still equals {@code expected}.
     */
    boolean replace(PropertyConflict expected, PropertyConflict updated);

    List<PropertyConflict> findByPropertyId(String propertyId);

    /**
     * Open conflicts, oldest first.
     */
    List<PropertyConflict> findUnresolved();

    int count();
}

package com.property.reconciliation.store;

import com.property.reconciliation.api.Page;
import com.property.reconciliation.api.PageRequest;
import com.property.reconciliation.core.model.PropertyState;
import com.property.reconciliation.core.model.PropertyStatus;
import com.property.reconciliation.core.model.StatusChange;
import com.property.reconciliation.core.model.StatusTransition;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence boundary for canonical property records and their transition log.
 *
 * <p>{@link #conditionalUpdate} is the only way to change an existing record and is atomic:
 * either the new state and all of its transition entries are stored, or nothing is.
 * Listing ids are unique across records.</p>
 *
 * <p>Implementations throw {@link StoreUnavailableException} when the backend fails.</p>
 */
public interface PropertyStore {

    Optional<PropertyState> findById(String id);

    Optional<PropertyState> findByListingId(String listingId);

    /**
     * Every record with the status, oldest first.
     */
    List<PropertyState> listByStatus(PropertyStatus status);

    Page<PropertyState> listByStatus(PropertyStatus status, PageRequest page);

    /**
     * Stores a new record together with its first transition entries.
     *
     * @return the record's id
     * @throws DuplicateListingException if the listing id is already taken
     */
    String create(PropertyState state, List<StatusChange> changes);

    /**
     * Replaces the record if its stored version still equals {@code expectedVersion}.
     * {@code newState} must carry version {@code expectedVersion + 1}. Transition entries
     * are numbered by the store, continuing the record's log.
     *
     * @throws DuplicateListingException if the update assigns a listing id owned by another record
     */
    UpdateResult conditionalUpdate(String id, long expectedVersion, PropertyState newState,
                                   List<StatusChange> changes);

    long countBy(PropertyCriteria criteria);

    /**
     * Count per status; every status is present, possibly with zero.
     */
    Map<PropertyStatus, Long> countByStatus();

    /**
     * Mean price over matching records with a known price, rounded to cents.
     */
    Optional<BigDecimal> averagePrice(PropertyCriteria criteria);

    /**
     * The record's transition log in sequence order; empty for unknown ids.
     */
    List<StatusTransition> transitionsFor(String id);

    /**
     * Cheap connectivity check.
     *
     * @throws StoreUnavailableException if the backend cannot be reached
     */
    void ping();
}

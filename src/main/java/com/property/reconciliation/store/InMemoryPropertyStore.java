package com.property.reconciliation.store;

import com.property.reconciliation.api.Page;
import com.property.reconciliation.api.PageRequest;
import com.property.reconciliation.core.model.PropertyState;
import com.property.reconciliation.core.model.PropertyStatus;
import com.property.reconciliation.core.model.StatusChange;
import com.property.reconciliation.core.model.StatusTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory store. Each record and its transition log live in one map entry,
 * so a conditional update swaps both atomically under the map's per-key lock.
 * Listing-id uniqueness is kept by a second concurrent index claimed with {@code putIfAbsent}.
 */
public class InMemoryPropertyStore implements PropertyStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryPropertyStore.class);

    private static final Comparator<PropertyState> CREATION_ORDER =
            Comparator.comparing(PropertyState::getCreatedAt).thenComparing(PropertyState::getId);

    private final Map<String, Entry> records = new ConcurrentHashMap<>();
    private final Map<String, String> listingIndex = new ConcurrentHashMap<>();

    private record Entry(PropertyState state, List<StatusTransition> transitions) {
    }

    @Override
    public Optional<PropertyState> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        Entry entry = records.get(id);
        return entry == null ? Optional.empty() : Optional.of(entry.state());
    }

    @Override
    public Optional<PropertyState> findByListingId(String listingId) {
        if (listingId == null) {
            return Optional.empty();
        }
        String id = listingIndex.get(listingId);
        return id == null ? Optional.empty() : findById(id);
    }

    @Override
    public List<PropertyState> listByStatus(PropertyStatus status) {
        return records.values().stream()
                .map(Entry::state)
                .filter(s -> s.getStatus() == status)
                .sorted(CREATION_ORDER)
                .toList();
    }

    @Override
    public Page<PropertyState> listByStatus(PropertyStatus status, PageRequest page) {
        List<PropertyState> all = listByStatus(status);
        List<PropertyState> content = all.stream()
                .skip(page.offset())
                .limit(page.limit())
                .toList();
        return new Page<>(content, all.size(), page.pageNumber(), page.limit());
    }

    @Override
    public String create(PropertyState state, List<StatusChange> changes) {
        Objects.requireNonNull(state, "state is required");
        String id = state.getId();
        Entry entry = new Entry(state, number(id, 0, changes));
        if (records.putIfAbsent(id, entry) != null) {
            throw new IllegalStateException("Property id already exists: " + id);
        }
        String listingId = state.getListingId();
        if (listingId != null && listingIndex.putIfAbsent(listingId, id) != null) {
            records.remove(id);
            throw new DuplicateListingException(listingId);
        }
        log.debug("store.created propertyId={} listingId={}", id, listingId);
        return id;
    }

    @Override
    public UpdateResult conditionalUpdate(String id, long expectedVersion, PropertyState newState,
                                          List<StatusChange> changes) {
        Objects.requireNonNull(newState, "newState is required");
        if (newState.getVersion() != expectedVersion + 1) {
            throw new IllegalArgumentException("newState must carry version " + (expectedVersion + 1)
                    + ", got " + newState.getVersion());
        }
        if (!id.equals(newState.getId())) {
            throw new IllegalArgumentException("newState id does not match " + id);
        }

        boolean[] swapped = {false};
        records.computeIfPresent(id, (key, current) -> {
            if (current.state().getVersion() != expectedVersion) {
                return current;
            }
            claimListingId(key, current.state().getListingId(), newState.getListingId());
            List<StatusTransition> transitions = new ArrayList<>(current.transitions());
            transitions.addAll(number(key, current.transitions().size(), changes));
            swapped[0] = true;
            return new Entry(newState, List.copyOf(transitions));
        });

        if (!swapped[0]) {
            log.debug("store.version_conflict propertyId={} expectedVersion={}", id, expectedVersion);
            return UpdateResult.CONFLICT;
        }
        return UpdateResult.UPDATED;
    }

    @Override
    public long countBy(PropertyCriteria criteria) {
        return records.values().stream()
                .filter(e -> criteria.matches(e.state()))
                .count();
    }

    @Override
    public Map<PropertyStatus, Long> countByStatus() {
        Map<PropertyStatus, Long> counts = new EnumMap<>(PropertyStatus.class);
        for (PropertyStatus status : PropertyStatus.values()) {
            counts.put(status, 0L);
        }
        for (Entry entry : records.values()) {
            counts.merge(entry.state().getStatus(), 1L, Long::sum);
        }
        return counts;
    }

    @Override
    public Optional<BigDecimal> averagePrice(PropertyCriteria criteria) {
        BigDecimal sum = BigDecimal.ZERO;
        long n = 0;
        for (Entry entry : records.values()) {
            PropertyState state = entry.state();
            if (state.getPrice() != null && criteria.matches(state)) {
                sum = sum.add(state.getPrice());
                n++;
            }
        }
        if (n == 0) {
            return Optional.empty();
        }
        return Optional.of(sum.divide(BigDecimal.valueOf(n), 2, RoundingMode.HALF_UP));
    }

    @Override
    public List<StatusTransition> transitionsFor(String id) {
        Entry entry = records.get(id);
        return entry == null ? List.of() : entry.transitions();
    }

    @Override
    public void ping() {
        // always reachable
    }

    /**
     * Number of stored records.
     */
    public int size() {
        return records.size();
    }

    private void claimListingId(String id, String oldListingId, String newListingId) {
        if (newListingId == null || newListingId.equals(oldListingId)) {
            return;
        }
        String owner = listingIndex.putIfAbsent(newListingId, id);
        if (owner != null && !owner.equals(id)) {
            throw new DuplicateListingException(newListingId);
        }
        if (oldListingId != null) {
            listingIndex.remove(oldListingId, id);
        }
    }

    private static List<StatusTransition> number(String id, int existing, List<StatusChange> changes) {
        if (changes == null || changes.isEmpty()) {
            return List.of();
        }
        List<StatusTransition> numbered = new ArrayList<>(changes.size());
        int sequence = existing;
        for (StatusChange change : changes) {
            numbered.add(change.toTransition(id, ++sequence));
        }
        return List.copyOf(numbered);
    }
}

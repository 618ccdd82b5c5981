package com.property.reconciliation.audit;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link ConflictRepository}. Insertion order is kept in a
 * {@link CopyOnWriteArrayList}; entries are swapped atomically in a concurrent map.
 */
public class InMemoryConflictRepository implements ConflictRepository {

    private final Map<String, PropertyConflict> byId = new ConcurrentHashMap<>();
    private final List<String> order = new CopyOnWriteArrayList<>();

    @Override
    public PropertyConflict save(PropertyConflict conflict) {
        Objects.requireNonNull(conflict, "conflict is required");
        if (byId.putIfAbsent(conflict.id(), conflict) != null) {
            throw new IllegalStateException("Conflict already recorded: " + conflict.id());
        }
        order.add(conflict.id());
        return conflict;
    }

    @Override
    public Optional<PropertyConflict> findById(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    @Override
    public boolean replace(PropertyConflict expected, PropertyConflict updated) {
        if (!expected.id().equals(updated.id())) {
            throw new IllegalArgumentException("Cannot replace a conflict with a different id");
        }
        return byId.replace(expected.id(), expected, updated);
    }

    @Override
    public List<PropertyConflict> findByPropertyId(String propertyId) {
        return order.stream()
                .map(byId::get)
                .filter(c -> c.propertyId().equals(propertyId))
                .toList();
    }

    @Override
    public List<PropertyConflict> findUnresolved() {
        return order.stream()
                .map(byId::get)
                .filter(c -> !c.isResolved())
                .toList();
    }

    @Override
    public int count() {
        return order.size();
    }
}

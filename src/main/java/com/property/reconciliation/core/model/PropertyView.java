package com.property.reconciliation.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Read-side projection of a property: the canonical state plus its decrypted address.
 * When the stored envelope cannot be opened with any configured key the view is still
 * returned, with {@code addressAvailable == false}.
 */
public record PropertyView(PropertyState state, String address, boolean addressAvailable) {

    public PropertyView {
        Objects.requireNonNull(state, "state is required");
        if (!addressAvailable) {
            address = null;
        }
    }

    public static PropertyView of(PropertyState state, String address) {
        return new PropertyView(state, address, true);
    }

    public static PropertyView addressUnavailable(PropertyState state) {
        return new PropertyView(state, null, false);
    }

    public Optional<String> addressIfAvailable() {
        return Optional.ofNullable(address);
    }

    public String id() {
        return state.getId();
    }

    /**
     * Status as readers see it ({@code available} folded into {@code active}).
     */
    public PropertyStatus readStatus() {
        return state.getStatus().readStatus();
    }

    @Override
    public String toString() {
        return "PropertyView{state=" + state + ", addressAvailable=" + addressAvailable + '}';
    }
}

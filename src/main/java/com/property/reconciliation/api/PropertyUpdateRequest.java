package com.property.reconciliation.api;

import com.property.reconciliation.core.model.PropertyField;
import com.property.reconciliation.core.model.PropertySource;
import com.property.reconciliation.core.model.PropertyStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One source's sparse claim about a property.
 * Absent attributes are left untouched; there is no way to clear a field except
 * replacing the image list with {@link Builder#replaceImages(boolean)}.
 * The address is carried in plaintext and is redacted from {@link #toString()}.
 */
public final class PropertyUpdateRequest {

    /**
     * Prices are kept in cents; finer values are rounded half-up on entry.
     */
    public static final int PRICE_SCALE = 2;

    private final String sourceId;
    private final PropertySource source;
    private final String listingId;
    private final String propertyId;
    private final Map<PropertyField, Object> values;
    private final PropertyStatus status;
    private final Instant observedAt;
    private final boolean replaceImages;
    private final boolean overrideTrust;

    private PropertyUpdateRequest(Builder builder) {
        this.sourceId = builder.sourceId.trim();
        this.source = PropertySource.fromIdentifier(builder.sourceId);
        this.listingId = builder.listingId;
        this.propertyId = builder.propertyId;
        this.values = Collections.unmodifiableMap(new EnumMap<>(builder.values));
        this.status = builder.status;
        this.observedAt = builder.observedAt;
        this.replaceImages = builder.replaceImages;
        this.overrideTrust = builder.overrideTrust;
    }

    /**
     * Raw identifier the caller supplied, e.g. {@code "har"}.
     */
    public String getSourceId() {
        return sourceId;
    }

    public PropertySource getSource() {
        return source;
    }

    public String getListingId() {
        return listingId;
    }

    public String getPropertyId() {
        return propertyId;
    }

    /**
     * Present attribute values, keyed by field. {@link PropertyField#STATUS} is never a key;
     * see {@link #getStatus()}.
     */
    public Map<PropertyField, Object> getValues() {
        return values;
    }

    public boolean has(PropertyField field) {
        return field == PropertyField.STATUS ? status != null : values.containsKey(field);
    }

    public Optional<String> getAddress() {
        return Optional.ofNullable((String) values.get(PropertyField.ADDRESS));
    }

    public PropertyStatus getStatus() {
        return status;
    }

    public Instant getObservedAt() {
        return observedAt;
    }

    public boolean isReplaceImages() {
        return replaceImages;
    }

    public boolean isOverrideTrust() {
        return overrideTrust;
    }

    @Override
    public String toString() {
        return "PropertyUpdateRequest{" +
                "source=" + sourceId +
                ", listingId='" + listingId + '\'' +
                ", propertyId='" + propertyId + '\'' +
                ", fields=" + values.keySet() +
                ", status=" + status +
                ", overrideTrust=" + overrideTrust +
                '}';
    }

    public static Builder builder(String sourceId) {
        return new Builder(sourceId);
    }

    public static class Builder {
        private final String sourceId;
        private String listingId;
        private String propertyId;
        private final Map<PropertyField, Object> values = new EnumMap<>(PropertyField.class);
        private PropertyStatus status;
        private Instant observedAt;
        private boolean replaceImages;
        private boolean overrideTrust;

        private Builder(String sourceId) {
            this.sourceId = sourceId;
        }

        public Builder listingId(String listingId) {
            this.listingId = listingId;
            return this;
        }

        public Builder propertyId(String propertyId) {
            this.propertyId = propertyId;
            return this;
        }

        public Builder address(String address) {
            return value(PropertyField.ADDRESS, address);
        }

        public Builder city(String city) {
            return value(PropertyField.CITY, city);
        }

        public Builder state(String state) {
            return value(PropertyField.STATE, state);
        }

        public Builder postalCode(String postalCode) {
            return value(PropertyField.POSTAL_CODE, postalCode);
        }

        public Builder bedrooms(Integer bedrooms) {
            return value(PropertyField.BEDROOMS, bedrooms);
        }

        public Builder bathrooms(Double bathrooms) {
            return value(PropertyField.BATHROOMS, bathrooms);
        }

        public Builder squareFeet(Integer squareFeet) {
            return value(PropertyField.SQUARE_FEET, squareFeet);
        }

        public Builder propertyType(String propertyType) {
            return value(PropertyField.PROPERTY_TYPE, propertyType);
        }

        public Builder price(BigDecimal price) {
            return value(PropertyField.PRICE, price);
        }

        public Builder description(String description) {
            return value(PropertyField.DESCRIPTION, description);
        }

        public Builder images(List<String> images) {
            return value(PropertyField.IMAGES, images);
        }

        public Builder agent(String agent) {
            return value(PropertyField.AGENT, agent);
        }

        public Builder office(String office) {
            return value(PropertyField.OFFICE, office);
        }

        public Builder sourceUrl(String sourceUrl) {
            return value(PropertyField.SOURCE_URL, sourceUrl);
        }

        public Builder available(Boolean available) {
            return value(PropertyField.AVAILABLE, available);
        }

        public Builder internalNotes(String internalNotes) {
            return value(PropertyField.INTERNAL_NOTES, internalNotes);
        }

        /**
         * Parses a boundary status string through the alias map.
         *
         * @throws ValidationException if the value is not a known status
         */
        public Builder status(String status) {
            if (status == null) {
                this.status = null;
                return this;
            }
            this.status = PropertyStatus.fromValue(status)
                    .orElseThrow(() -> new ValidationException("Unknown status: " + status));
            return this;
        }

        public Builder status(PropertyStatus status) {
            this.status = status;
            return this;
        }

        /**
         * Sets any field by key. {@code null} leaves the field absent.
         *
         * @throws ValidationException if the value has the wrong type for the field
         */
        public Builder value(PropertyField field, Object value) {
            if (field == PropertyField.STATUS) {
                if (value instanceof String) {
                    return status((String) value);
                }
                if (value != null && !(value instanceof PropertyStatus)) {
                    throw new ValidationException("status must be a status value");
                }
                return status((PropertyStatus) value);
            }
            if (value == null) {
                values.remove(field);
                return this;
            }
            if (!field.valueType().isInstance(value)) {
                throw new ValidationException("Field " + field + " expects " + field.valueType().getSimpleName()
                        + " but got " + value.getClass().getSimpleName());
            }
            if (field == PropertyField.IMAGES) {
                List<?> raw = (List<?>) value;
                for (Object element : raw) {
                    if (!(element instanceof String) || ((String) element).isBlank()) {
                        throw new ValidationException("images must be non-blank strings");
                    }
                }
                values.put(field, List.copyOf(raw));
                return this;
            }
            if (field == PropertyField.PRICE) {
                values.put(field, toCents((BigDecimal) value));
                return this;
            }
            values.put(field, value);
            return this;
        }

        /**
         * Observation time used to break ties between equally trusted sources.
         * Defaults to the engine's clock.
         */
        public Builder observedAt(Instant observedAt) {
            this.observedAt = observedAt;
            return this;
        }

        public Builder replaceImages(boolean replaceImages) {
            this.replaceImages = replaceImages;
            return this;
        }

        /**
         * Skips rank comparison for every field. Admin only; the state machine still applies.
         */
        public Builder overrideTrust(boolean overrideTrust) {
            this.overrideTrust = overrideTrust;
            return this;
        }

        private static BigDecimal toCents(BigDecimal price) {
            return price.scale() > PRICE_SCALE ? price.setScale(PRICE_SCALE, RoundingMode.HALF_UP) : price;
        }

        public PropertyUpdateRequest build() {
            if (sourceId == null || sourceId.isBlank()) {
                throw new ValidationException("source is required");
            }
            listingId = blankToNull(listingId);
            propertyId = blankToNull(propertyId);
            if (listingId == null && propertyId == null) {
                throw new ValidationException("listingId or propertyId is required");
            }
            if (overrideTrust && PropertySource.fromIdentifier(sourceId) != PropertySource.ADMIN) {
                throw new ValidationException("overrideTrust is reserved for admin sources");
            }
            requireNonNegative(PropertyField.BEDROOMS);
            requireNonNegative(PropertyField.SQUARE_FEET);
            requireNonNegative(PropertyField.BATHROOMS);
            requireNonNegative(PropertyField.PRICE);
            Object address = values.get(PropertyField.ADDRESS);
            if (address != null && ((String) address).isBlank()) {
                throw new ValidationException("address must not be blank");
            }
            return new PropertyUpdateRequest(this);
        }

        private void requireNonNegative(PropertyField field) {
            Object value = values.get(field);
            if (value == null) {
                return;
            }
            boolean negative = value instanceof BigDecimal
                    ? ((BigDecimal) value).signum() < 0
                    : ((Number) value).doubleValue() < 0;
            if (negative) {
                throw new ValidationException(field + " must not be negative");
            }
        }

        private static String blankToNull(String value) {
            return value == null || value.isBlank() ? null : value.trim();
        }
    }
}

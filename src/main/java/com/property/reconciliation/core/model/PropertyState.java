package com.property.reconciliation.core.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Canonical property record: one immutable snapshot per committed version.
 * The street address is only ever held as an encrypted envelope.
 * Every attribute is nullable; {@code null} means unknown, never zero.
 */
public final class PropertyState {
    private final String id;
    private final String listingId;
    private final String addressCiphertext;
    private final String city;
    private final String state;
    private final String postalCode;
    private final Integer bedrooms;
    private final Double bathrooms;
    private final Integer squareFeet;
    private final String propertyType;
    private final BigDecimal price;
    private final String description;
    private final List<String> images;
    private final String agent;
    private final String office;
    private final String sourceUrl;
    private final Boolean available;
    private final String internalNotes;
    private final PropertyStatus status;
    private final Map<PropertyField, FieldProvenance> provenance;
    private final long version;
    private final Instant createdAt;
    private final Instant updatedAt;

    private PropertyState(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.listingId = builder.listingId;
        this.addressCiphertext = builder.addressCiphertext;
        this.city = builder.city;
        this.state = builder.state;
        this.postalCode = builder.postalCode;
        this.bedrooms = builder.bedrooms;
        this.bathrooms = builder.bathrooms;
        this.squareFeet = builder.squareFeet;
        this.propertyType = builder.propertyType;
        this.price = builder.price;
        this.description = builder.description;
        this.images = builder.images != null ? List.copyOf(builder.images) : List.of();
        this.agent = builder.agent;
        this.office = builder.office;
        this.sourceUrl = builder.sourceUrl;
        this.available = builder.available;
        this.internalNotes = builder.internalNotes;
        this.status = builder.status != null ? builder.status : PropertyStatus.PENDING_IMAGES;
        EnumMap<PropertyField, FieldProvenance> copy = new EnumMap<>(PropertyField.class);
        copy.putAll(builder.provenance);
        this.provenance = Collections.unmodifiableMap(copy);
        this.version = builder.version;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public String getListingId() {
        return listingId;
    }

    public String getAddressCiphertext() {
        return addressCiphertext;
    }

    public String getCity() {
        return city;
    }

    public String getState() {
        return state;
    }

    public String getPostalCode() {
        return postalCode;
    }

    public Integer getBedrooms() {
        return bedrooms;
    }

    public Double getBathrooms() {
        return bathrooms;
    }

    public Integer getSquareFeet() {
        return squareFeet;
    }

    public String getPropertyType() {
        return propertyType;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getImages() {
        return images;
    }

    public String getAgent() {
        return agent;
    }

    public String getOffice() {
        return office;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public Boolean getAvailable() {
        return available;
    }

    public String getInternalNotes() {
        return internalNotes;
    }

    public PropertyStatus getStatus() {
        return status;
    }

    public Map<PropertyField, FieldProvenance> getProvenance() {
        return provenance;
    }

    public Optional<FieldProvenance> provenanceOf(PropertyField field) {
        return Optional.ofNullable(provenance.get(field));
    }

    public long getVersion() {
        return version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Reads a field generically. {@link PropertyField#ADDRESS} yields the ciphertext envelope
     * and {@link PropertyField#IMAGES} yields {@code null} when no media is known.
     */
    public Object get(PropertyField field) {
        return switch (field) {
            case ADDRESS -> addressCiphertext;
            case CITY -> city;
            case STATE -> state;
            case POSTAL_CODE -> postalCode;
            case BEDROOMS -> bedrooms;
            case BATHROOMS -> bathrooms;
            case SQUARE_FEET -> squareFeet;
            case PROPERTY_TYPE -> propertyType;
            case DESCRIPTION -> description;
            case PRICE -> price;
            case AVAILABLE -> available;
            case STATUS -> status;
            case AGENT -> agent;
            case OFFICE -> office;
            case SOURCE_URL -> sourceUrl;
            case IMAGES -> images.isEmpty() ? null : images;
            case INTERNAL_NOTES -> internalNotes;
        };
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PropertyState that = (PropertyState) o;
        return version == that.version
                && id.equals(that.id)
                && Objects.equals(listingId, that.listingId)
                && Objects.equals(addressCiphertext, that.addressCiphertext)
                && Objects.equals(city, that.city)
                && Objects.equals(state, that.state)
                && Objects.equals(postalCode, that.postalCode)
                && Objects.equals(bedrooms, that.bedrooms)
                && Objects.equals(bathrooms, that.bathrooms)
                && Objects.equals(squareFeet, that.squareFeet)
                && Objects.equals(propertyType, that.propertyType)
                && Objects.equals(price, that.price)
                && Objects.equals(description, that.description)
                && images.equals(that.images)
                && Objects.equals(agent, that.agent)
                && Objects.equals(office, that.office)
                && Objects.equals(sourceUrl, that.sourceUrl)
                && Objects.equals(available, that.available)
                && Objects.equals(internalNotes, that.internalNotes)
                && status == that.status
                && provenance.equals(that.provenance)
                && createdAt.equals(that.createdAt)
                && updatedAt.equals(that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version);
    }

    // The address envelope is deliberately left out.
    @Override
    public String toString() {
        return "PropertyState{" +
                "id='" + id + '\'' +
                ", listingId='" + listingId + '\'' +
                ", status=" + status +
                ", price=" + price +
                ", version=" + version +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(PropertyState source) {
        Builder builder = new Builder()
                .id(source.id)
                .listingId(source.listingId)
                .addressCiphertext(source.addressCiphertext)
                .city(source.city)
                .state(source.state)
                .postalCode(source.postalCode)
                .bedrooms(source.bedrooms)
                .bathrooms(source.bathrooms)
                .squareFeet(source.squareFeet)
                .propertyType(source.propertyType)
                .price(source.price)
                .description(source.description)
                .images(source.images)
                .agent(source.agent)
                .office(source.office)
                .sourceUrl(source.sourceUrl)
                .available(source.available)
                .internalNotes(source.internalNotes)
                .status(source.status)
                .version(source.version)
                .createdAt(source.createdAt)
                .updatedAt(source.updatedAt);
        builder.provenance.putAll(source.provenance);
        return builder;
    }

    public static class Builder {
        private String id;
        private String listingId;
        private String addressCiphertext;
        private String city;
        private String state;
        private String postalCode;
        private Integer bedrooms;
        private Double bathrooms;
        private Integer squareFeet;
        private String propertyType;
        private BigDecimal price;
        private String description;
        private List<String> images;
        private String agent;
        private String office;
        private String sourceUrl;
        private Boolean available;
        private String internalNotes;
        private PropertyStatus status;
        private final Map<PropertyField, FieldProvenance> provenance = new EnumMap<>(PropertyField.class);
        private long version;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder listingId(String listingId) {
            this.listingId = listingId;
            return this;
        }

        public Builder addressCiphertext(String addressCiphertext) {
            this.addressCiphertext = addressCiphertext;
            return this;
        }

        public Builder city(String city) {
            this.city = city;
            return this;
        }

        public Builder state(String state) {
            this.state = state;
            return this;
        }

        public Builder postalCode(String postalCode) {
            this.postalCode = postalCode;
            return this;
        }

        public Builder bedrooms(Integer bedrooms) {
            this.bedrooms = bedrooms;
            return this;
        }

        public Builder bathrooms(Double bathrooms) {
            this.bathrooms = bathrooms;
            return this;
        }

        public Builder squareFeet(Integer squareFeet) {
            this.squareFeet = squareFeet;
            return this;
        }

        public Builder propertyType(String propertyType) {
            this.propertyType = propertyType;
            return this;
        }

        public Builder price(BigDecimal price) {
            this.price = price;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder images(List<String> images) {
            this.images = images;
            return this;
        }

        public Builder agent(String agent) {
            this.agent = agent;
            return this;
        }

        public Builder office(String office) {
            this.office = office;
            return this;
        }

        public Builder sourceUrl(String sourceUrl) {
            this.sourceUrl = sourceUrl;
            return this;
        }

        public Builder available(Boolean available) {
            this.available = available;
            return this;
        }

        public Builder internalNotes(String internalNotes) {
            this.internalNotes = internalNotes;
            return this;
        }

        public Builder status(PropertyStatus status) {
            this.status = status;
            return this;
        }

        public Builder provenance(PropertyField field, FieldProvenance fieldProvenance) {
            if (fieldProvenance == null) {
                this.provenance.remove(field);
            } else {
                this.provenance.put(field, fieldProvenance);
            }
            return this;
        }

        public Builder provenance(Map<PropertyField, FieldProvenance> provenance) {
            this.provenance.clear();
            this.provenance.putAll(provenance);
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        /**
         * Writes a field generically. {@link PropertyField#ADDRESS} expects the ciphertext envelope.
         */
        @SuppressWarnings("unchecked")
        public Builder set(PropertyField field, Object value) {
            switch (field) {
                case ADDRESS -> addressCiphertext = (String) value;
                case CITY -> city = (String) value;
                case STATE -> state = (String) value;
                case POSTAL_CODE -> postalCode = (String) value;
                case BEDROOMS -> bedrooms = (Integer) value;
                case BATHROOMS -> bathrooms = (Double) value;
                case SQUARE_FEET -> squareFeet = (Integer) value;
                case PROPERTY_TYPE -> propertyType = (String) value;
                case DESCRIPTION -> description = (String) value;
                case PRICE -> price = (BigDecimal) value;
                case AVAILABLE -> available = (Boolean) value;
                case STATUS -> status = (PropertyStatus) value;
                case AGENT -> agent = (String) value;
                case OFFICE -> office = (String) value;
                case SOURCE_URL -> sourceUrl = (String) value;
                case IMAGES -> images = (List<String>) value;
                case INTERNAL_NOTES -> internalNotes = (String) value;
            }
            return this;
        }

        public PropertyState build() {
            if (version < 0) {
                throw new IllegalArgumentException("version must be >= 0");
            }
            return new PropertyState(this);
        }
    }
}

package com.property.reconciliation.core.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Reconcilable attributes of a {@link PropertyState}, with the trust group each belongs to
 * and the Java type its values carry.
 */
public enum PropertyField {
    ADDRESS(FieldGroup.DESCRIPTIVE, String.class),
    CITY(FieldGroup.DESCRIPTIVE, String.class),
    STATE(FieldGroup.DESCRIPTIVE, String.class),
    POSTAL_CODE(FieldGroup.DESCRIPTIVE, String.class),
    BEDROOMS(FieldGroup.DESCRIPTIVE, Integer.class),
    BATHROOMS(FieldGroup.DESCRIPTIVE, Double.class),
    SQUARE_FEET(FieldGroup.DESCRIPTIVE, Integer.class),
    PROPERTY_TYPE(FieldGroup.DESCRIPTIVE, String.class),
    DESCRIPTION(FieldGroup.DESCRIPTIVE, String.class),
    PRICE(FieldGroup.PRICING_STATUS, BigDecimal.class),
    AVAILABLE(FieldGroup.PRICING_STATUS, Boolean.class),
    STATUS(FieldGroup.PRICING_STATUS, PropertyStatus.class),
    AGENT(FieldGroup.CONTACT, String.class),
    OFFICE(FieldGroup.CONTACT, String.class),
    SOURCE_URL(FieldGroup.CONTACT, String.class),
    IMAGES(FieldGroup.MEDIA, List.class),
    INTERNAL_NOTES(FieldGroup.ADMIN_ONLY, String.class);

    private final FieldGroup group;
    private final Class<?> valueType;

    PropertyField(FieldGroup group, Class<?> valueType) {
        this.group = group;
        this.valueType = valueType;
    }

    public FieldGroup group() {
        return group;
    }

    public Class<?> valueType() {
        return valueType;
    }

    /**
     * Admin-only fields carry no per-field provenance.
     */
    public boolean isProvenanceTracked() {
        return group != FieldGroup.ADMIN_ONLY;
    }
}

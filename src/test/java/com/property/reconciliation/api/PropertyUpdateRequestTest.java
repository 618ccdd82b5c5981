package com.property.reconciliation.api;

import com.property.reconciliation.core.model.PropertyField;
import com.property.reconciliation.core.model.PropertySource;
import com.property.reconciliation.core.model.PropertyStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Property Update Request Tests")
class PropertyUpdateRequestTest {

    @Nested
    @DisplayName("Identity")
    class Identity {

        @Test
        @DisplayName("Source identifier resolves to a trust tier")
        void sourceResolution() {
            PropertyUpdateRequest request = PropertyUpdateRequest.builder(" har ").listingId("MLS1").build();
            assertEquals("har", request.getSourceId());
            assertEquals(PropertySource.LISTING_SYNDICATION, request.getSource());
        }

        @Test
        @DisplayName("Source is required")
        void sourceRequired() {
            assertThrows(ValidationException.class, () -> PropertyUpdateRequest.builder(" ").listingId("MLS1").build());
            assertThrows(ValidationException.class, () -> PropertyUpdateRequest.builder(null).listingId("MLS1").build());
        }

        @Test
        @DisplayName("A listing id or property id is required, blanks count as missing")
        void identifierRequired() {
            assertThrows(ValidationException.class, () -> PropertyUpdateRequest.builder("har").build());
            assertThrows(ValidationException.class,
                    () -> PropertyUpdateRequest.builder("har").listingId("  ").propertyId("").build());
            assertEquals("p-1", PropertyUpdateRequest.builder("har").propertyId("p-1").build().getPropertyId());
        }
    }

    @Nested
    @DisplayName("Field values")
    class Values {

        @Test
        @DisplayName("Typed setters populate the value map")
        void typedSetters() {
            PropertyUpdateRequest request = PropertyUpdateRequest.builder("har")
                    .listingId("MLS1")
                    .address("1 Main St")
                    .price(new BigDecimal("250000"))
                    .bedrooms(3)
                    .images(List.of("a.jpg"))
                    .build();
            assertTrue(request.has(PropertyField.PRICE));
            assertTrue(request.has(PropertyField.IMAGES));
            assertFalse(request.has(PropertyField.CITY));
            assertEquals("1 Main St", request.getAddress().orElseThrow());
            assertEquals(4, request.getValues().size());
        }

        @Test
        @DisplayName("Null values leave the field absent")
        void nullsAbsent() {
            PropertyUpdateRequest request = PropertyUpdateRequest.builder("har")
                    .listingId("MLS1")
                    .city("Austin")
                    .city(null)
                    .build();
            assertFalse(request.has(PropertyField.CITY));
            assertTrue(request.getAddress().isEmpty());
        }

        @Test
        @DisplayName("Generic value checks the field type")
        void typeChecked() {
            PropertyUpdateRequest.Builder builder = PropertyUpdateRequest.builder("har").listingId("MLS1");
            assertThrows(ValidationException.class, () -> builder.value(PropertyField.BEDROOMS, "three"));
            assertThrows(ValidationException.class, () -> builder.value(PropertyField.PRICE, 100));
            assertThrows(ValidationException.class, () -> builder.value(PropertyField.STATUS, 7));
        }

        @Test
        @DisplayName("Images must be non-blank strings and are copied")
        void images() {
            assertThrows(ValidationException.class,
                    () -> PropertyUpdateRequest.builder("har").listingId("MLS1").images(List.of("a.jpg", " ")));
            assertThrows(ValidationException.class,
                    () -> PropertyUpdateRequest.builder("har").listingId("MLS1").images(Arrays.asList("a.jpg", null)));

            List<String> images = new ArrayList<>(List.of("a.jpg"));
            PropertyUpdateRequest request = PropertyUpdateRequest.builder("har").listingId("MLS1").images(images).build();
            images.add("b.jpg");
            assertEquals(List.of("a.jpg"), request.getValues().get(PropertyField.IMAGES));
        }

        @Test
        @DisplayName("Negative numbers and blank addresses are rejected")
        void ranges() {
            assertThrows(ValidationException.class,
                    () -> PropertyUpdateRequest.builder("har").listingId("MLS1").price(new BigDecimal("-1")).build());
            assertThrows(ValidationException.class,
                    () -> PropertyUpdateRequest.builder("har").listingId("MLS1").bedrooms(-2).build());
            assertThrows(ValidationException.class,
                    () -> PropertyUpdateRequest.builder("har").listingId("MLS1").bathrooms(-0.5).build());
            assertThrows(ValidationException.class,
                    () -> PropertyUpdateRequest.builder("har").listingId("MLS1").address("   ").build());
        }

        @Test
        @DisplayName("Sub-cent prices are rounded half-up, coarser ones kept as given")
        void priceCents() {
            PropertyUpdateRequest fine = PropertyUpdateRequest.builder("har").listingId("MLS1")
                    .price(new BigDecimal("300000.125")).build();
            assertEquals(new BigDecimal("300000.13"), fine.getValues().get(PropertyField.PRICE));

            PropertyUpdateRequest whole = PropertyUpdateRequest.builder("har").listingId("MLS1")
                    .price(new BigDecimal("300000")).build();
            assertEquals(new BigDecimal("300000"), whole.getValues().get(PropertyField.PRICE));
        }

        @Test
        @DisplayName("Value map is read-only")
        void readOnly() {
            PropertyUpdateRequest request = PropertyUpdateRequest.builder("har").listingId("MLS1").city("Austin").build();
            assertThrows(UnsupportedOperationException.class,
                    () -> request.getValues().put(PropertyField.CITY, "Dallas"));
        }
    }

    @Nested
    @DisplayName("Status")
    class Status {

        @Test
        @DisplayName("Status strings go through the alias map")
        void aliasParsing() {
            assertEquals(PropertyStatus.WITHDRAWN,
                    PropertyUpdateRequest.builder("har").listingId("MLS1").status("off_market").build().getStatus());
            assertEquals(PropertyStatus.ACTIVE,
                    PropertyUpdateRequest.builder("har").listingId("MLS1")
                            .value(PropertyField.STATUS, "Active").build().getStatus());
        }

        @Test
        @DisplayName("Unknown status strings are rejected")
        void unknownStatus() {
            assertThrows(ValidationException.class,
                    () -> PropertyUpdateRequest.builder("har").listingId("MLS1").status("reserved"));
        }

        @Test
        @DisplayName("Status is not part of the field map")
        void statusSeparate() {
            PropertyUpdateRequest request = PropertyUpdateRequest.builder("har").listingId("MLS1").status("sold").build();
            assertFalse(request.getValues().containsKey(PropertyField.STATUS));
        }
    }

    @Test
    @DisplayName("Override is reserved for admin sources")
    void overrideAdminOnly() {
        assertThrows(ValidationException.class,
                () -> PropertyUpdateRequest.builder("har").listingId("MLS1").overrideTrust(true).build());
        assertTrue(PropertyUpdateRequest.builder("admin").listingId("MLS1").overrideTrust(true).build()
                .isOverrideTrust());
    }

    @Test
    @DisplayName("toString never prints field values")
    void toStringRedacted() {
        PropertyUpdateRequest request = PropertyUpdateRequest.builder("har")
                .listingId("MLS1")
                .address("221B Baker Street")
                .build();
        assertFalse(request.toString().contains("Baker"));
        assertTrue(request.toString().contains("ADDRESS"));
    }
}

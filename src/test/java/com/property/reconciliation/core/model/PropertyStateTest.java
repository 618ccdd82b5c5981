package com.property.reconciliation.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Property State Tests")
class PropertyStateTest {

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Defaults to a fresh id, pending images and version 0")
        void defaults() {
            PropertyState state = PropertyState.builder().build();
            assertNotNull(state.getId());
            assertEquals(PropertyStatus.PENDING_IMAGES, state.getStatus());
            assertEquals(0, state.getVersion());
            assertEquals(state.getCreatedAt(), state.getUpdatedAt());
            assertTrue(state.getImages().isEmpty());
            assertTrue(state.getProvenance().isEmpty());
        }

        @Test
        @DisplayName("Negative versions are rejected")
        void negativeVersion() {
            assertThrows(IllegalArgumentException.class, () -> PropertyState.builder().version(-1).build());
        }

        @Test
        @DisplayName("Copy builder keeps every field and provenance")
        void copy() {
            Instant at = Instant.parse("2024-01-01T00:00:00Z");
            PropertyState original = PropertyState.builder()
                    .listingId("MLS1")
                    .addressCiphertext("{\"kid\":\"k\"}")
                    .price(new BigDecimal("100"))
                    .images(List.of("a.jpg"))
                    .status(PropertyStatus.ACTIVE)
                    .provenance(PropertyField.PRICE, new FieldProvenance(PropertySource.CRM, "fub", at))
                    .version(4)
                    .createdAt(at)
                    .build();

            PropertyState copy = PropertyState.builder(original).build();
            assertEquals(original, copy);
            assertEquals(PropertySource.CRM, copy.provenanceOf(PropertyField.PRICE).orElseThrow().source());
        }

        @Test
        @DisplayName("Generic set and get agree for every field")
        void genericAccess() {
            PropertyState state = PropertyState.builder()
                    .set(PropertyField.CITY, "Houston")
                    .set(PropertyField.BEDROOMS, 3)
                    .set(PropertyField.BATHROOMS, 2.5)
                    .set(PropertyField.IMAGES, List.of("x.jpg"))
                    .set(PropertyField.INTERNAL_NOTES, "call first")
                    .build();
            assertEquals("Houston", state.get(PropertyField.CITY));
            assertEquals(3, state.get(PropertyField.BEDROOMS));
            assertEquals(2.5, state.get(PropertyField.BATHROOMS));
            assertEquals(List.of("x.jpg"), state.get(PropertyField.IMAGES));
            assertEquals("call first", state.getInternalNotes());
            assertNull(state.get(PropertyField.PRICE));
        }

        @Test
        @DisplayName("Empty media reads as unset")
        void emptyImagesUnset() {
            assertNull(PropertyState.builder().images(List.of()).build().get(PropertyField.IMAGES));
        }
    }

    @Test
    @DisplayName("toString leaves out the address envelope")
    void toStringRedacted() {
        PropertyState state = PropertyState.builder()
                .addressCiphertext("{\"kid\":\"secret-envelope\"}")
                .build();
        assertFalse(state.toString().contains("secret-envelope"));
    }

    @Test
    @DisplayName("View drops the address when unavailable")
    void viewUnavailable() {
        PropertyState state = PropertyState.builder().status(PropertyStatus.AVAILABLE).build();
        PropertyView view = PropertyView.addressUnavailable(state);
        assertFalse(view.addressAvailable());
        assertTrue(view.addressIfAvailable().isEmpty());
        assertEquals(PropertyStatus.ACTIVE, view.readStatus());

        PropertyView readable = PropertyView.of(state, "1 Main St");
        assertEquals("1 Main St", readable.address());
        assertFalse(readable.toString().contains("Main"));
    }
}

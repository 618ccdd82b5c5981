package com.property.reconciliation.audit;

import com.property.reconciliation.TestClock;
import com.property.reconciliation.TestKeys;
import com.property.reconciliation.api.PropertyUpdateRequest;
import com.property.reconciliation.api.ReconciliationOptions;
import com.property.reconciliation.api.ValidationException;
import com.property.reconciliation.core.model.PropertyField;
import com.property.reconciliation.core.model.PropertySource;
import com.property.reconciliation.core.model.PropertyState;
import com.property.reconciliation.core.model.PropertyStatus;
import com.property.reconciliation.crypto.AesGcmFieldCodec;
import com.property.reconciliation.reconcile.ReconciliationEngine;
import com.property.reconciliation.store.InMemoryPropertyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Conflict Service Tests")
class ConflictServiceTest {

    private static final Instant T0 = Instant.parse("2024-06-01T09:00:00Z");

    private InMemoryPropertyStore store;
    private AesGcmFieldCodec codec;
    private TestClock clock;
    private ReconciliationEngine engine;
    private InMemoryConflictRepository repository;
    private ConflictService service;
    private String propertyId;

    @BeforeEach
    void setUp() {
        store = new InMemoryPropertyStore();
        codec = TestKeys.codec();
        clock = new TestClock(T0);
        engine = ReconciliationEngine.builder()
                .store(store)
                .codec(codec)
                .options(ReconciliationOptions.builder().retryBackoffMs(0).build())
                .clock(clock)
                .build();
        repository = new InMemoryConflictRepository();
        service = new ConflictService(repository, engine, codec, clock);
        engine.addConflictListener(service);

        propertyId = engine.reconcile(PropertyUpdateRequest.builder("har")
                .listingId("MLS-1")
                .address("1 Harbor Way")
                .price(new BigDecimal("500000"))
                .build()).outcome().propertyId();
    }

    private void crmPrice(String price) {
        engine.reconcile(PropertyUpdateRequest.builder("fub").listingId("MLS-1").price(new BigDecimal(price)).build());
    }

    private PropertyState current() {
        return store.findById(propertyId).orElseThrow();
    }

    @Nested
    @DisplayName("Recording")
    class Recording {

        @Test
        @DisplayName("A trust-rejected write is recorded with both sources")
        void recordsConflict() {
            clock.advance(Duration.ofSeconds(3));
            crmPrice("480000");

            List<PropertyConflict> open = service.unresolved();
            assertEquals(1, open.size());
            PropertyConflict conflict = open.get(0);
            assertEquals(propertyId, conflict.propertyId());
            assertEquals(PropertyField.PRICE, conflict.field());
            assertEquals(0, new BigDecimal("480000").compareTo((BigDecimal) conflict.incomingValue()));
            assertEquals(PropertySource.CRM, conflict.incomingSource());
            assertEquals("fub", conflict.incomingSourceId());
            assertEquals(PropertySource.LISTING_SYNDICATION, conflict.currentSource());
            assertEquals(T0.plusSeconds(3), conflict.detectedAt());
            assertFalse(conflict.isResolved());
        }

        @Test
        @DisplayName("Repeating the same refused value does not add a second entry")
        void dedupesOpenConflicts() {
            crmPrice("480000");
            crmPrice("480000.00");
            crmPrice("470000");

            assertEquals(2, service.unresolvedFor(propertyId).size());
        }

        @Test
        @DisplayName("Accepted writes record nothing")
        void acceptedWritesIgnored() {
            engine.reconcile(PropertyUpdateRequest.builder("har").listingId("MLS-1").price(BigDecimal.ONE).build());
            assertEquals(0, repository.count());
        }

        @Test
        @DisplayName("Refused addresses are kept encrypted and deduped by plaintext")
        void addressConflicts() {
            engine.reconcile(PropertyUpdateRequest.builder("fub").listingId("MLS-1").address("2 Side St").build());
            engine.reconcile(PropertyUpdateRequest.builder("crm").listingId("MLS-1").address("2 Side St").build());

            List<PropertyConflict> open = service.unresolvedFor(propertyId);
            assertEquals(2, open.size(), "distinct source ids are distinct claims");
            String envelope = (String) open.get(0).incomingValue();
            assertFalse(envelope.contains("Side"));
            assertEquals("2 Side St", codec.decrypt(envelope));
            assertFalse(open.get(0).toString().contains("Side"));

            engine.reconcile(PropertyUpdateRequest.builder("fub").listingId("MLS-1").address("2 Side St").build());
            assertEquals(2, service.unresolvedFor(propertyId).size());
        }
    }

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        @Test
        @DisplayName("Keeping the current value closes the conflict without a write")
        void keepCurrent() {
            crmPrice("480000");
            PropertyConflict conflict = service.unresolved().get(0);
            long versionBefore = current().getVersion();
            clock.advance(Duration.ofMinutes(2));

            PropertyConflict resolved = service.resolve(conflict.id(), ConflictResolution.KEEP_CURRENT, "ops@example.com");

            assertEquals(ConflictResolution.KEEP_CURRENT, resolved.resolution());
            assertEquals("ops@example.com", resolved.resolvedBy());
            assertEquals(T0.plus(Duration.ofMinutes(2)), resolved.resolvedAt());
            assertTrue(service.unresolved().isEmpty());
            assertEquals(1, service.historyFor(propertyId).size());
            assertEquals(versionBefore, current().getVersion());
            assertEquals(0, new BigDecimal("500000").compareTo(current().getPrice()));
        }

        @Test
        @DisplayName("Accepting the incoming value applies it as an admin override")
        void acceptIncoming() {
            crmPrice("480000");
            PropertyConflict conflict = service.unresolved().get(0);

            service.resolve(conflict.id(), ConflictResolution.ACCEPT_INCOMING, "ops@example.com");

            PropertyState after = current();
            assertEquals(0, new BigDecimal("480000").compareTo(after.getPrice()));
            assertEquals(PropertySource.ADMIN, after.provenanceOf(PropertyField.PRICE).orElseThrow().source());
            assertTrue(service.unresolved().isEmpty());
        }

        @Test
        @DisplayName("Accepting an address conflict decrypts and re-applies it")
        void acceptAddress() {
            engine.reconcile(PropertyUpdateRequest.builder("fub").listingId("MLS-1").address("2 Side St").build());
            PropertyConflict conflict = service.unresolved().get(0);

            service.resolve(conflict.id(), ConflictResolution.ACCEPT_INCOMING, "ops");

            assertEquals("2 Side St", codec.decrypt(current().getAddressCiphertext()));
        }

        @Test
        @DisplayName("Accepting a status conflict still obeys the state machine")
        void acceptStatus() {
            engine.reconcile(PropertyUpdateRequest.builder("har").listingId("MLS-1").status("active").build());
            engine.reconcile(PropertyUpdateRequest.builder("har").listingId("MLS-1").status("pending").build());
            engine.reconcile(PropertyUpdateRequest.builder("booking").listingId("MLS-1").status("sold").build());
            PropertyConflict conflict = service.unresolved().get(0);
            assertEquals(PropertyStatus.SOLD, conflict.incomingValue());

            service.resolve(conflict.id(), ConflictResolution.ACCEPT_INCOMING, "ops");

            assertEquals(PropertyStatus.SOLD, current().getStatus());
        }

        @Test
        @DisplayName("A status that became unreachable cannot be accepted")
        void acceptUnreachableStatus() {
            engine.reconcile(PropertyUpdateRequest.builder("har").listingId("MLS-1").status("active").build());
            engine.reconcile(PropertyUpdateRequest.builder("har").listingId("MLS-1").status("pending").build());
            engine.reconcile(PropertyUpdateRequest.builder("booking").listingId("MLS-1").status("sold").build());
            engine.reconcile(PropertyUpdateRequest.builder("har").listingId("MLS-1").status("withdrawn").build());
            PropertyConflict conflict = service.unresolved().get(0);

            assertThrows(ValidationException.class,
                    () -> service.resolve(conflict.id(), ConflictResolution.ACCEPT_INCOMING, "ops"));
            assertEquals(PropertyStatus.WITHDRAWN, current().getStatus());
            assertFalse(repository.findById(conflict.id()).orElseThrow().isResolved());
        }

        @Test
        @DisplayName("Unknown, resolved and anonymous rulings are refused")
        void invalidRulings() {
            crmPrice("480000");
            String id = service.unresolved().get(0).id();

            assertThrows(ValidationException.class, () -> service.resolve("missing", ConflictResolution.KEEP_CURRENT, "ops"));
            assertThrows(ValidationException.class, () -> service.resolve(id, ConflictResolution.KEEP_CURRENT, " "));
            assertThrows(NullPointerException.class, () -> service.resolve(id, null, "ops"));

            service.resolve(id, ConflictResolution.KEEP_CURRENT, "ops");
            assertThrows(ValidationException.class, () -> service.resolve(id, ConflictResolution.ACCEPT_INCOMING, "ops"));
        }

        @Test
        @DisplayName("A resolved conflict no longer blocks a new one for the same value")
        void resolvedDoesNotDedupe() {
            crmPrice("480000");
            service.resolve(service.unresolved().get(0).id(), ConflictResolution.KEEP_CURRENT, "ops");

            crmPrice("480000");

            assertEquals(1, service.unresolved().size());
            assertEquals(2, service.historyFor(propertyId).size());
        }
    }
}

package com.property.reconciliation.api;

import com.property.reconciliation.TestClock;
import com.property.reconciliation.TestKeys;
import com.property.reconciliation.audit.ConflictResolution;
import com.property.reconciliation.audit.PropertyConflict;
import com.property.reconciliation.config.ReconciliationConfig;
import com.property.reconciliation.core.model.PropertyField;
import com.property.reconciliation.core.model.PropertyState;
import com.property.reconciliation.core.model.PropertyStatus;
import com.property.reconciliation.core.model.PropertyView;
import com.property.reconciliation.crypto.AesGcmFieldCodec;
import com.property.reconciliation.crypto.KeyRing;
import com.property.reconciliation.health.HealthStatus;
import com.property.reconciliation.metrics.MetricsService;
import com.property.reconciliation.reconcile.ReconciliationResult;
import com.property.reconciliation.stats.PropertyStats;
import com.property.reconciliation.store.InMemoryPropertyStore;
import com.property.reconciliation.store.PropertyStore;
import com.property.reconciliation.store.StoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Property State Manager Tests")
class PropertyStateManagerTest {

    private static final Instant T0 = Instant.parse("2024-07-01T15:00:00Z");

    private InMemoryPropertyStore store;
    private MetricsService metrics;
    private TestClock clock;
    private PropertyStateManager manager;

    @BeforeEach
    void setUp() {
        store = new InMemoryPropertyStore();
        metrics = mock(MetricsService.class);
        clock = new TestClock(T0);
        manager = PropertyStateManager.builder()
                .store(store)
                .config(ReconciliationConfig.of(TestKeys.ring()))
                .metrics(metrics)
                .clock(clock)
                .build();
    }

    private ReconciliationResult list(String listingId, String address, String status) {
        return manager.reconcile(PropertyUpdateRequest.builder("har")
                .listingId(listingId)
                .address(address)
                .price(new BigDecimal("250000"))
                .status(status)
                .build());
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("Views carry the decrypted address")
        void decryptedView() {
            String id = list("MLS-1", "10 Elm St", null).outcome().propertyId();

            PropertyView byId = manager.getByIdentity(id).orElseThrow();
            PropertyView byListing = manager.getByListingId("MLS-1").orElseThrow();

            assertEquals("10 Elm St", byId.address());
            assertTrue(byId.addressAvailable());
            assertEquals(byId, byListing);
            assertFalse(byId.toString().contains("Elm"));
        }

        @Test
        @DisplayName("Unknown ids read as empty")
        void unknownIds() {
            assertTrue(manager.getByIdentity("missing").isEmpty());
            assertTrue(manager.getByListingId("missing").isEmpty());
        }

        @Test
        @DisplayName("An address no key opens is reported unavailable, the rest is still served")
        void undecryptableAddress() {
            AesGcmFieldCodec foreign = new AesGcmFieldCodec(KeyRing.of(TestKeys.key(9)));
            PropertyState sealedElsewhere = PropertyState.builder()
                    .listingId("MLS-X")
                    .addressCiphertext(foreign.encrypt("99 Hidden Rd"))
                    .price(new BigDecimal("1.00"))
                    .version(1)
                    .createdAt(T0)
                    .build();
            store.create(sealedElsewhere, List.of());

            PropertyView view = manager.getByListingId("MLS-X").orElseThrow();

            assertFalse(view.addressAvailable());
            assertNull(view.address());
            assertTrue(view.addressIfAvailable().isEmpty());
            assertEquals(0, BigDecimal.ONE.compareTo(view.state().getPrice()));
            verify(metrics).incrementDecryptionFailure();
        }

        @Test
        @DisplayName("Records without an address read as an available empty address")
        void noAddress() {
            store.create(PropertyState.builder().listingId("MLS-N").version(1).createdAt(T0).build(), List.of());

            PropertyView view = manager.getByListingId("MLS-N").orElseThrow();

            assertTrue(view.addressAvailable());
            assertNull(view.address());
        }

        @Test
        @DisplayName("Status listings are ordered and pageable")
        void listByStatus() {
            list("MLS-1", "1 A St", "active");
            clock.advance(Duration.ofSeconds(1));
            list("MLS-2", "2 B St", "active");
            clock.advance(Duration.ofSeconds(1));
            list("MLS-3", "3 C St", null);

            List<PropertyView> active = manager.listByStatus(PropertyStatus.ACTIVE);
            assertEquals(List.of("1 A St", "2 B St"), active.stream().map(PropertyView::address).toList());

            Page<PropertyView> page = manager.listByStatus(PropertyStatus.ACTIVE, PageRequest.of(1, 1));
            assertEquals(2, page.totalElements());
            assertEquals("2 B St", page.content().get(0).address());
        }

        @Test
        @DisplayName("Public listing shows active, available and pending only")
        void listPublic() {
            list("MLS-1", "1 A St", "active");
            clock.advance(Duration.ofSeconds(1));
            list("MLS-2", "2 B St", "available");
            clock.advance(Duration.ofSeconds(1));
            list("MLS-3", "3 C St", null);
            clock.advance(Duration.ofSeconds(1));
            list("MLS-4", "4 D St", "active");
            manager.reconcile(PropertyUpdateRequest.builder("har").listingId("MLS-4").status("pending").build());
            clock.advance(Duration.ofSeconds(1));
            list("MLS-5", "5 E St", "withdrawn");

            List<String> visible = manager.listPublic().stream()
                    .map(v -> v.state().getListingId())
                    .toList();

            assertEquals(List.of("MLS-1", "MLS-2", "MLS-4"), visible);
        }

        @Test
        @DisplayName("Transition history is exposed per record")
        void transitions() {
            String id = list("MLS-1", "1 A St", "active").outcome().propertyId();
            assertEquals(2, manager.transitionsFor(id).size());
            assertTrue(manager.transitionsFor("missing").isEmpty());
        }
    }

    @Nested
    @DisplayName("Stats")
    class Stats {

        @Test
        @DisplayName("Stats reflect the catalog and are cached until refreshed")
        void cachedStats() {
            list("MLS-1", "1 A St", "active");
            list("MLS-2", "2 B St", null);

            PropertyStats first = manager.getStats();
            assertEquals(2, first.total());
            assertEquals(1, first.listedCount());
            assertEquals(1, first.pendingImagesCount());
            assertEquals(0, new BigDecimal("250000").compareTo(first.averageListedPrice()));

            list("MLS-3", "3 C St", "available");
            assertSame(first, manager.getStats());

            PropertyStats refreshed = manager.refreshStats();
            assertEquals(3, refreshed.total());
            assertEquals(2, refreshed.listedCount());
        }
    }

    @Nested
    @DisplayName("Conflicts")
    class Conflicts {

        @Test
        @DisplayName("Refused writes show up for review and can be accepted")
        void reviewAndAccept() {
            String id = list("MLS-1", "1 A St", null).outcome().propertyId();
            manager.reconcile(PropertyUpdateRequest.builder("fub").listingId("MLS-1")
                    .price(new BigDecimal("240000")).build());

            List<PropertyConflict> open = manager.unresolvedConflicts(id);
            assertEquals(1, open.size());
            assertEquals(open, manager.unresolvedConflicts());
            assertEquals(PropertyField.PRICE, open.get(0).field());

            PropertyConflict resolved = manager.resolveConflict(open.get(0).id(),
                    ConflictResolution.ACCEPT_INCOMING, "ops@example.com");

            assertTrue(resolved.isResolved());
            assertTrue(manager.unresolvedConflicts().isEmpty());
            assertEquals(0, new BigDecimal("240000")
                    .compareTo(manager.getByIdentity(id).orElseThrow().state().getPrice()));
        }
    }

    @Nested
    @DisplayName("Health")
    class Health {

        @Test
        @DisplayName("Healthy store and key report up")
        void up() {
            HealthStatus status = manager.checkHealth();

            assertTrue(status.isUp());
            assertTrue(status.details().containsKey("propertyStore"));
            assertTrue(status.details().containsKey("addressCodec"));
        }

        @Test
        @DisplayName("An unreachable store reports down")
        void storeDown() {
            PropertyStore broken = mock(PropertyStore.class);
            doThrow(new StoreUnavailableException("connection refused")).when(broken).ping();
            PropertyStateManager degraded = PropertyStateManager.builder()
                    .store(broken)
                    .config(ReconciliationConfig.of(TestKeys.ring()))
                    .build();

            HealthStatus status = degraded.checkHealth();

            assertTrue(status.isDown());
            assertTrue(status.message().startsWith("propertyStore"));
        }
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Store and config are required")
        void required() {
            assertThrows(NullPointerException.class, () -> PropertyStateManager.builder()
                    .config(ReconciliationConfig.of(TestKeys.ring())).build());
            assertThrows(NullPointerException.class, () -> PropertyStateManager.builder()
                    .store(store).build());
        }

        @Test
        @DisplayName("A deadline in the past fails fast")
        void pastDeadline() {
            PropertyUpdateRequest request = PropertyUpdateRequest.builder("har")
                    .listingId("MLS-1").address("1 A St").build();
            assertThrows(RuntimeException.class, () -> manager.reconcile(request, T0.minusSeconds(1)));
            assertEquals(0, store.size());
        }
    }
}

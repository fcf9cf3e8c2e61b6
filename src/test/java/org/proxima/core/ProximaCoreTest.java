package org.proxima.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.proxima.config.ProximaConfig;
import org.proxima.core.error.AuthorizationException;
import org.proxima.core.error.LocationPersistenceException;
import org.proxima.core.error.ValidationException;
import org.proxima.messaging.MessageEvent;
import org.proxima.proximity.NearbyUser;
import org.proxima.realtime.ConnectionOutbox;
import org.proxima.realtime.LocationEvent;
import org.proxima.realtime.RoomEvent;
import org.proxima.realtime.Rooms;
import org.proxima.spatial.LocationPoint;
import org.proxima.store.InMemoryLocationStore;
import org.proxima.store.InMemoryMessageStore;
import org.proxima.store.InMemoryUserDirectory;
import org.proxima.testutil.CoreFixtures;
import org.proxima.testutil.CoreFixtures.Fixture;
import org.proxima.testutil.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.proxima.testutil.CoreFixtures.SF_LAT;
import static org.proxima.testutil.CoreFixtures.SF_LON;
import static org.proxima.testutil.CoreFixtures.SF_NEAR_LAT;
import static org.proxima.testutil.CoreFixtures.SF_NEAR_LON;

@DisplayName("Proxima Core Facade Tests")
class ProximaCoreTest {

    @Test
    @DisplayName("Location update, discovery and messaging work end to end")
    void testEndToEnd() {
        Fixture f = CoreFixtures.create("alice", "bob");
        ProximaCore core = f.core();
        ConnectionOutbox bobStream = core.onConnect("conn-bob", "bob");

        assertTrue(core.updateLocation("alice", SF_LAT, SF_LON));
        assertTrue(core.updateLocation("bob", SF_NEAR_LAT, SF_NEAR_LON));

        List<NearbyUser> nearby = core.findNearby("alice", SF_LAT, SF_LON, 2.0);
        assertEquals(1, nearby.size());
        assertEquals("bob", nearby.get(0).getUserId());
        assertEquals(0.88, nearby.get(0).getDistanceMiles(), 0.01);

        String id = core.sendMessage("alice", List.of("bob"), "hi bob", null);
        assertTrue(f.messages().find(id).isPresent());
        RoomEvent event = bobStream.poll();
        assertNotNull(event);
        assertEquals(MessageEvent.EVENT_NAME, event.eventName());
        assertSame(bobStream, core.eventStream("conn-bob"));

        assertTrue(core.onDisconnect("conn-bob"));
        assertTrue(bobStream.isClosed());
    }

    @Test
    @DisplayName("Location updates reach the owner's location room")
    void testLocationEventPublished() {
        Fixture f = CoreFixtures.create("alice", "bob");
        ProximaCore core = f.core();
        ConnectionOutbox aliceStream = core.onConnect("conn-alice", "alice");
        ConnectionOutbox bobStream = core.onConnect("conn-bob", "bob");
        String room = Rooms.locationRoom("alice");

        assertTrue(core.joinRoom("conn-alice", room));
        assertThrows(AuthorizationException.class, () -> core.joinRoom("conn-bob", room));
        assertTrue(core.grantLocationAccess("alice", "bob"));
        assertTrue(core.joinRoom("conn-bob", room));

        core.updateLocation("alice", SF_LAT, SF_LON);

        for (ConnectionOutbox stream : List.of(aliceStream, bobStream)) {
            RoomEvent event = stream.poll();
            assertNotNull(event);
            assertEquals(room, event.getRoomId());
            assertEquals(LocationEvent.EVENT_NAME, event.eventName());
            LocationEvent payload = (LocationEvent) event.getPayload();
            assertEquals("alice", payload.getUserId());
            assertEquals(SF_LAT, payload.getLatitude());
            assertEquals(f.clock().instant(), payload.getUpdatedAt());
        }

        assertTrue(core.revokeLocationAccess("alice", "bob"));
        assertFalse(core.roomRouter().roomsOf("conn-bob").contains(room));
        core.updateLocation("alice", SF_NEAR_LAT, SF_NEAR_LON);
        assertEquals(1, aliceStream.size());
        assertEquals(0, bobStream.size());
    }

    @Test
    @DisplayName("Out-of-order location updates are dropped")
    void testStaleUpdateDropped() {
        Fixture f = CoreFixtures.create("alice");
        ProximaCore core = f.core();
        Instant t0 = f.clock().instant();

        assertTrue(core.updateLocation("alice", SF_LAT, SF_LON, t0.plusSeconds(10)));
        assertFalse(core.updateLocation("alice", 40.0, -74.0, t0));
        assertTrue(core.updateLocation("alice", 40.0, -74.0, t0.plusSeconds(10)), "equal timestamps apply");

        LocationPoint stored = core.spatialIndex().get("alice").orElseThrow();
        assertEquals(40.0, stored.latitude());
        assertEquals(40.0, f.locations().find("alice").orElseThrow().latitude());
    }

    @Test
    @Timeout(10)
    @DisplayName("Concurrent out-of-order updates never leave the older point in the store")
    void testConcurrentStaleUpdateNotPersisted() throws Exception {
        MutableClock clock = MutableClock.at("2024-05-01T12:00:00Z");
        Instant t1 = clock.instant();
        Instant t2 = t1.plusSeconds(10);
        InMemoryLocationStore durable = new InMemoryLocationStore();
        List<Instant> writes = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch newerInStore = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        ProximaCore core = ProximaCore.builder()
                .clock(clock)
                .userDirectory(new InMemoryUserDirectory(List.of("alice")))
                .messageStore(new InMemoryMessageStore())
                .locationStore((userId, lat, lon, at) -> {
                    writes.add(at);
                    if (at.equals(t2)) {
                        newerInStore.countDown();
                        try {
                            release.await(5, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    }
                    durable.persist(userId, lat, lon, at);
                })
                .build();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<Boolean> newer = executor.submit(() -> core.updateLocation("alice", 40.0, -74.0, t2));
            assertTrue(newerInStore.await(5, TimeUnit.SECONDS));
            Future<Boolean> older = executor.submit(() -> core.updateLocation("alice", SF_LAT, SF_LON, t1));
            Thread.sleep(50);
            release.countDown();

            assertTrue(newer.get(5, TimeUnit.SECONDS));
            assertFalse(older.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertEquals(List.of(t2), writes, "older update must not reach the store");
        assertEquals(t2, durable.find("alice").orElseThrow().updatedAt());
        assertEquals(t2, core.spatialIndex().get("alice").orElseThrow().updatedAt());
    }

    @Test
    @DisplayName("Location persistence failure leaves no in-memory state")
    void testLocationPersistFailure() {
        MutableClock clock = MutableClock.at("2024-05-01T12:00:00Z");
        ProximaCore core = ProximaCore.builder()
                .clock(clock)
                .userDirectory(new InMemoryUserDirectory(List.of("alice")))
                .messageStore(new InMemoryMessageStore())
                .locationStore((userId, lat, lon, at) -> {
                    throw new IllegalStateException("db down");
                })
                .build();
        ConnectionOutbox stream = core.onConnect("c1", "alice");
        core.joinRoom("c1", Rooms.locationRoom("alice"));

        LocationPersistenceException ex = assertThrows(LocationPersistenceException.class,
                () -> core.updateLocation("alice", SF_LAT, SF_LON));
        assertEquals(ProximaCore.REASON_LOCATION_PERSIST_FAILED, ex.getReasonCode());
        assertTrue(core.spatialIndex().get("alice").isEmpty());
        assertTrue(core.presenceRegistry().lastActive("alice").isEmpty());
        assertEquals(0, stream.size());
    }

    @Test
    @DisplayName("Invalid input is rejected before any side effect")
    void testUpdateValidation() {
        Fixture f = CoreFixtures.create("alice");
        ProximaCore core = f.core();

        assertThrows(ValidationException.class, () -> core.updateLocation("alice", 91.0, 0.0));
        assertThrows(ValidationException.class, () -> core.updateLocation("alice", 0.0, 200.0));
        ValidationException blank = assertThrows(ValidationException.class, () -> core.updateLocation(" ", 0.0, 0.0));
        assertEquals(ProximaCore.REASON_USER_ID_REQUIRED, blank.getReasonCode());
        assertThrows(ValidationException.class, () -> core.onConnect("c1", null));
        assertEquals(0, f.locations().size());
    }

    @Test
    @DisplayName("Configured presence window drives discovery")
    void testCustomPresenceWindow() {
        ProximaConfig config = ProximaConfig.builder().presenceWindow(Duration.ofMinutes(5)).build();
        Fixture f = CoreFixtures.create(config, "alice", "bob");
        ProximaCore core = f.core();
        core.updateLocation("bob", SF_NEAR_LAT, SF_NEAR_LON);

        f.clock().advance(Duration.ofMinutes(4));
        assertEquals(1, core.findNearby("alice", SF_LAT, SF_LON, 2.0).size());
        f.clock().advance(Duration.ofMinutes(1));
        assertTrue(core.findNearby("alice", SF_LAT, SF_LON, 2.0).isEmpty());
    }

    @Test
    @DisplayName("Sending a message counts as activity")
    void testMessageTouchesPresence() {
        Fixture f = CoreFixtures.create("alice", "bob");
        ProximaCore core = f.core();
        core.updateLocation("alice", SF_NEAR_LAT, SF_NEAR_LON);
        f.clock().advance(Duration.ofMinutes(40));
        assertTrue(core.findNearby("bob", SF_LAT, SF_LON, 2.0).isEmpty());

        core.sendMessage("alice", List.of("bob"), "still here", null);
        assertEquals(1, core.findNearby("bob", SF_LAT, SF_LON, 2.0).size());
    }
}

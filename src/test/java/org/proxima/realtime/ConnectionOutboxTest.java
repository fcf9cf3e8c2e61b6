package org.proxima.realtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Connection Outbox Tests")
class ConnectionOutboxTest {
    private static final EventPayload PING = () -> "ping";

    private static RoomEvent event(int n) {
        return new RoomEvent(Rooms.MESSAGES, PING, Instant.EPOCH.plusSeconds(n));
    }

    @Test
    @DisplayName("Offers beyond capacity are rejected without blocking")
    void testCapacity() {
        ConnectionOutbox outbox = new ConnectionOutbox("c1", 2);
        assertEquals(ConnectionOutbox.OfferResult.ACCEPTED, outbox.offer(event(1)));
        assertEquals(ConnectionOutbox.OfferResult.ACCEPTED, outbox.offer(event(2)));
        assertEquals(ConnectionOutbox.OfferResult.FULL, outbox.offer(event(3)));
        assertEquals(2, outbox.size());

        List<RoomEvent> drained = outbox.drain(10);
        assertEquals(List.of(event(1), event(2)), drained);
        assertEquals(ConnectionOutbox.OfferResult.ACCEPTED, outbox.offer(event(4)));
    }

    @Test
    @DisplayName("Close discards pending events and rejects new ones")
    void testClose() throws InterruptedException {
        ConnectionOutbox outbox = new ConnectionOutbox("c1", 4);
        outbox.offer(event(1));
        outbox.offer(event(2));

        assertEquals(2, outbox.close());
        assertTrue(outbox.isClosed());
        assertEquals(0, outbox.size());
        assertEquals(ConnectionOutbox.OfferResult.CLOSED, outbox.offer(event(3)));
        assertNull(outbox.poll());
        assertNull(outbox.poll(1, TimeUnit.SECONDS));
    }

    @Test
    @Timeout(10)
    @DisplayName("Close wakes a reader blocked in a timed poll")
    void testCloseWakesBlockedReader() throws Exception {
        ConnectionOutbox outbox = new ConnectionOutbox("c1", 4);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        CountDownLatch polling = new CountDownLatch(1);
        try {
            Future<RoomEvent> reader = executor.submit(() -> {
                polling.countDown();
                return outbox.poll(60, TimeUnit.SECONDS);
            });
            assertTrue(polling.await(5, TimeUnit.SECONDS));
            Thread.sleep(50);

            long started = System.nanoTime();
            outbox.close();
            assertNull(reader.get(5, TimeUnit.SECONDS));
            assertTrue(System.nanoTime() - started < TimeUnit.SECONDS.toNanos(5));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @Timeout(10)
    @DisplayName("Timed poll returns an event offered while waiting")
    void testTimedPollReceivesLateEvent() throws Exception {
        ConnectionOutbox outbox = new ConnectionOutbox("c1", 4);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<RoomEvent> reader = executor.submit(() -> outbox.poll(5, TimeUnit.SECONDS));
            Thread.sleep(50);
            assertEquals(ConnectionOutbox.OfferResult.ACCEPTED, outbox.offer(event(7)));
            assertEquals(event(7), reader.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
        assertNull(outbox.poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    @DisplayName("Drain respects the requested maximum")
    void testDrainLimit() {
        ConnectionOutbox outbox = new ConnectionOutbox("c1", 8);
        for (int i = 0; i < 5; i++) {
            outbox.offer(event(i));
        }
        assertEquals(3, outbox.drain(3).size());
        assertEquals(2, outbox.size());
        assertTrue(outbox.drain(0).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> outbox.drain(-1));
        assertThrows(IllegalArgumentException.class, () -> new ConnectionOutbox("c2", 0));
    }
}

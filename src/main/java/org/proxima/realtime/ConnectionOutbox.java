package org.proxima.realtime;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded outbound event queue of one connection.
 * <p>
 * The router only ever offers; it never waits for space. The transport layer drains the
 * queue at its own pace through {@link #poll(long, TimeUnit)} or {@link #drain(int)}.
 * </p>
 * <p>
 * Once {@link #close()} returns no further event is accepted, the queue is empty and
 * readers blocked in {@link #poll(long, TimeUnit)} have been woken. All state is
 * guarded by one lock.
 * </p>
 */
public final class ConnectionOutbox {

    /**
     * Outcome of a single {@link #offer(RoomEvent)}.
     */
    public enum OfferResult {
        /** Event queued. */
        ACCEPTED,
        /** Queue at capacity; event dropped. */
        FULL,
        /** Outbox closed; event dropped. */
        CLOSED
    }

    @Getter
    @Accessors(fluent = true)
    private final String connectionId;
    @Getter
    @Accessors(fluent = true)
    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final ArrayDeque<RoomEvent> queue;
    private boolean closed;

    public ConnectionOutbox(String connectionId, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(Math.min(capacity, 64));
    }

    /**
     * Queues an event without blocking.
     */
    OfferResult offer(RoomEvent event) {
        Objects.requireNonNull(event, "event");
        lock.lock();
        try {
            if (closed) {
                return OfferResult.CLOSED;
            }
            if (queue.size() >= capacity) {
                return OfferResult.FULL;
            }
            queue.addLast(event);
            notEmpty.signal();
            return OfferResult.ACCEPTED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the outbox, discards undelivered events and wakes every blocked reader.
     *
     * @return number of discarded events.
     */
    int close() {
        lock.lock();
        try {
            closed = true;
            int discarded = queue.size();
            queue.clear();
            notEmpty.signalAll();
            return discarded;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Retrieves the next event, or null if none is queued.
     */
    public RoomEvent poll() {
        lock.lock();
        try {
            return queue.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to the given time for the next event.
     *
     * @return next event, or null on timeout or once the outbox is closed.
     */
    public RoomEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty()) {
                if (closed || nanos <= 0L) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return queue.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes up to {@code maxEvents} queued events in publish order.
     */
    public List<RoomEvent> drain(int maxEvents) {
        if (maxEvents < 0) {
            throw new IllegalArgumentException("maxEvents must be >= 0");
        }
        lock.lock();
        try {
            List<RoomEvent> events = new ArrayList<>(Math.min(maxEvents, queue.size()));
            while (events.size() < maxEvents && !queue.isEmpty()) {
                events.add(queue.pollFirst());
            }
            return events;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }
}

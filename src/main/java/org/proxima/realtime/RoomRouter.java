package org.proxima.realtime;

import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import it.unimi.dsi.fastutil.objects.ReferenceOpenHashSet;
import lombok.extern.slf4j.Slf4j;
import org.proxima.core.error.AuthorizationException;
import org.proxima.core.error.NotFoundException;
import org.proxima.core.error.ValidationException;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Room based publish/subscribe for connected clients.
 * <p>
 * Connection lifecycle: {@code connect} (auto-joined to {@link Rooms#MESSAGES}),
 * any number of {@code join}/{@code leave}, then {@code disconnect}. Subscriptions never
 * outlive their connection.
 * </p>
 * <p>
 * Concurrency model:
 * </p>
 * <ul>
 * <li>Room membership changes run inside the room's {@link ConcurrentHashMap#compute}
 * and under the room's write lock; publishers take a member snapshot under the read lock
 * and release it before delivering.</li>
 * <li>Each connection serializes its own joins, leaves and teardown on its monitor.
 * Lock order is always connection, then room.</li>
 * <li>Delivery only offers to the subscriber's bounded {@link ConnectionOutbox}; a full or
 * closed outbox drops the event for that subscriber alone, without retry.</li>
 * </ul>
 */
@Slf4j
public final class RoomRouter {
    public static final String REASON_CONNECTION_ID_REQUIRED = "ROOM_CONNECTION_ID_REQUIRED";
    public static final String REASON_DUPLICATE_CONNECTION = "ROOM_DUPLICATE_CONNECTION";
    public static final String REASON_UNKNOWN_CONNECTION = "ROOM_UNKNOWN_CONNECTION";
    public static final String REASON_ANONYMOUS_LOCATION_JOIN = "ROOM_ANONYMOUS_LOCATION_JOIN";
    public static final String REASON_LOCATION_ACCESS_DENIED = "ROOM_LOCATION_ACCESS_DENIED";

    private final ConcurrentHashMap<String, Connection> connections = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Room> rooms = new ConcurrentHashMap<>();
    private final LocationSharingPolicy sharingPolicy;
    private final Clock clock;
    private final int outboxCapacity;

    private final LongAdder published = new LongAdder();
    private final LongAdder delivered = new LongAdder();
    private final LongAdder dropped = new LongAdder();

    /**
     * @param sharingPolicy grants consulted when joining location rooms.
     * @param clock time source stamped on published events.
     * @param outboxCapacity per-connection queue bound; must be {@code > 0}.
     */
    public RoomRouter(LocationSharingPolicy sharingPolicy, Clock clock, int outboxCapacity) {
        if (outboxCapacity <= 0) {
            throw new IllegalArgumentException("outboxCapacity must be > 0");
        }
        this.sharingPolicy = Objects.requireNonNull(sharingPolicy, "sharingPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.outboxCapacity = outboxCapacity;
    }

    /**
     * Registers an anonymous connection. It can only use {@link Rooms#MESSAGES}.
     */
    public ConnectionOutbox connect(String connectionId) {
        return connect(connectionId, null);
    }

    /**
     * Registers a connection and joins it to {@link Rooms#MESSAGES}.
     *
     * @param connectionId transport session id.
     * @param userId authenticated identity behind the session, or null when anonymous.
     * @return the connection's outbound event stream.
     * @throws ValidationException if the id is blank or already connected.
     */
    public ConnectionOutbox connect(String connectionId, String userId) {
        requireConnectionId(connectionId);
        Connection connection = new Connection(connectionId, userId, new ConnectionOutbox(connectionId, outboxCapacity));
        if (connections.putIfAbsent(connectionId, connection) != null) {
            throw new ValidationException(REASON_DUPLICATE_CONNECTION, "Connection already registered: " + connectionId);
        }
        synchronized (connection) {
            if (!connection.closed) {
                addMembershipLocked(connection, Rooms.MESSAGES);
            }
        }
        log.info("Connection {} connected (user={})", connectionId, userId == null ? "<anonymous>" : userId);
        return connection.outbox;
    }

    /**
     * Subscribes a connection to a room. Joining a room twice is a no-op.
     *
     * @return true if the connection was not in the room before.
     * @throws ValidationException for room names outside the naming scheme.
     * @throws NotFoundException for unknown connections.
     * @throws AuthorizationException when a location room is not owned by, or shared with,
     * the connection's identity.
     */
    public boolean join(String connectionId, String roomId) {
        Rooms.requireKnown(roomId);
        Connection connection = requireConnection(connectionId);
        authorize(connection, roomId);
        synchronized (connection) {
            if (connection.closed) {
                throw unknownConnection(connectionId);
            }
            return addMembershipLocked(connection, roomId);
        }
    }

    /**
     * Unsubscribes a connection from a room. Leaving a room not joined is a no-op.
     *
     * @return true if a subscription was removed.
     * @throws NotFoundException for unknown connections.
     */
    public boolean leave(String connectionId, String roomId) {
        Objects.requireNonNull(roomId, "roomId");
        return leave(requireConnection(connectionId), roomId);
    }

    /**
     * Tears a connection down: closes its outbox, then drops every subscription.
     * The id stays registered until teardown completes, so it cannot be reused mid-way.
     * Unknown or already disconnected ids are a no-op.
     *
     * @return true if this call performed the teardown.
     */
    public boolean disconnect(String connectionId) {
        requireConnectionId(connectionId);
        Connection connection = connections.get(connectionId);
        if (connection == null) {
            return false;
        }
        int discarded;
        int subscriptions;
        synchronized (connection) {
            if (connection.closed) {
                return false;
            }
            connection.closed = true;
            discarded = connection.outbox.close();
            subscriptions = connection.rooms.size();
            for (String roomId : connection.rooms) {
                removeMember(roomId, connection);
            }
            connection.rooms.clear();
        }
        connections.remove(connectionId, connection);
        log.info("Connection {} disconnected (rooms={}, discardedEvents={})", connectionId, subscriptions, discarded);
        return true;
    }

    /**
     * Removes every connection of {@code viewerId} from the location room of {@code ownerId}.
     * Used when a sharing grant is withdrawn. Owner connections are never evicted.
     *
     * @return number of evicted subscriptions.
     */
    public int evictLocationViewer(String ownerId, String viewerId) {
        Objects.requireNonNull(viewerId, "viewerId");
        if (viewerId.equals(ownerId)) {
            return 0;
        }
        String roomId = Rooms.locationRoom(ownerId);
        Room room = rooms.get(roomId);
        if (room == null) {
            return 0;
        }
        int evicted = 0;
        for (Connection connection : room.snapshot()) {
            if (viewerId.equals(connection.userId) && leave(connection, roomId)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} subscription(s) of {} from {}", evicted, viewerId, roomId);
        }
        return evicted;
    }

    /**
     * Fans an event out to every connection subscribed to {@code roomId} at this instant.
     * <p>
     * Best effort: a subscriber whose outbox is full or closing loses this event, the
     * failure is logged and counted, and every other subscriber is still served.
     * Publishing to a room nobody joined is not an error.
     * </p>
     *
     * @return delivery counters for this publish.
     */
    public PublishResult publish(String roomId, EventPayload payload) {
        Objects.requireNonNull(roomId, "roomId");
        Objects.requireNonNull(payload, "payload");
        published.increment();
        Room room = rooms.get(roomId);
        if (room == null) {
            return PublishResult.EMPTY;
        }

        List<Connection> members = room.snapshot();
        RoomEvent event = new RoomEvent(roomId, payload, clock.instant());
        int accepted = 0;
        int full = 0;
        int skipped = 0;
        for (Connection connection : members) {
            String memberId = connection.id;
            switch (connection.outbox.offer(event)) {
                case ACCEPTED -> accepted++;
                case FULL -> {
                    full++;
                    log.warn("Delivery failure: dropped {} for connection {} in room {} (outbox full, capacity={})",
                            event.eventName(), memberId, roomId, connection.outbox.capacity());
                }
                case CLOSED -> {
                    skipped++;
                    log.debug("Skipped {} for closing connection {} in room {}", event.eventName(), memberId, roomId);
                }
            }
        }
        delivered.add(accepted);
        dropped.add(full);
        return new PublishResult(members.size(), accepted, full, skipped);
    }

    /**
     * Outbound event stream of a live connection.
     *
     * @throws NotFoundException for unknown connections.
     */
    public ConnectionOutbox outbox(String connectionId) {
        return requireConnection(connectionId).outbox;
    }

    /**
     * Rooms a live connection is subscribed to.
     *
     * @throws NotFoundException for unknown connections.
     */
    public Set<String> roomsOf(String connectionId) {
        Connection connection = requireConnection(connectionId);
        synchronized (connection) {
            return Set.copyOf(connection.rooms);
        }
    }

    /**
     * Connections currently subscribed to a room.
     */
    public List<String> subscribersOf(String roomId) {
        Objects.requireNonNull(roomId, "roomId");
        Room room = rooms.get(roomId);
        if (room == null) {
            return List.of();
        }
        List<Connection> members = room.snapshot();
        List<String> ids = new ArrayList<>(members.size());
        for (Connection connection : members) {
            ids.add(connection.id);
        }
        return ids;
    }

    public boolean isConnected(String connectionId) {
        return connectionId != null && connections.containsKey(connectionId);
    }

    /**
     * Identity bound to a live connection; empty for anonymous connections.
     */
    public Optional<String> userOf(String connectionId) {
        return Optional.ofNullable(requireConnection(connectionId).userId);
    }

    public RouterTelemetry telemetry() {
        return RouterTelemetry.builder()
                .connections(connections.size())
                .rooms(rooms.size())
                .published(published.sum())
                .delivered(delivered.sum())
                .dropped(dropped.sum())
                .build();
    }

    private boolean leave(Connection connection, String roomId) {
        synchronized (connection) {
            if (!connection.rooms.remove(roomId)) {
                return false;
            }
            removeMember(roomId, connection);
            return true;
        }
    }

    private boolean addMembershipLocked(Connection connection, String roomId) {
        if (!connection.rooms.add(roomId)) {
            return false;
        }
        rooms.compute(roomId, (id, room) -> {
            Room target = room == null ? new Room() : room;
            target.add(connection);
            return target;
        });
        return true;
    }

    private void removeMember(String roomId, Connection connection) {
        rooms.computeIfPresent(roomId, (id, room) -> room.remove(connection) ? null : room);
    }

    private void authorize(Connection connection, String roomId) {
        Optional<String> owner = Rooms.locationRoomOwner(roomId);
        if (owner.isEmpty()) {
            return;
        }
        if (connection.userId == null) {
            throw new AuthorizationException(
                    REASON_ANONYMOUS_LOCATION_JOIN,
                    "Anonymous connection " + connection.id + " cannot join " + roomId);
        }
        if (!sharingPolicy.canView(owner.get(), connection.userId)) {
            throw new AuthorizationException(
                    REASON_LOCATION_ACCESS_DENIED,
                    "User " + connection.userId + " has no access to " + roomId);
        }
    }

    private Connection requireConnection(String connectionId) {
        requireConnectionId(connectionId);
        Connection connection = connections.get(connectionId);
        if (connection == null) {
            throw unknownConnection(connectionId);
        }
        return connection;
    }

    private static NotFoundException unknownConnection(String connectionId) {
        return new NotFoundException(REASON_UNKNOWN_CONNECTION, "Unknown connection: " + connectionId);
    }

    private static void requireConnectionId(String connectionId) {
        if (connectionId == null || connectionId.isBlank()) {
            throw new ValidationException(REASON_CONNECTION_ID_REQUIRED, "connectionId is required");
        }
    }

    /**
     * Per-connection state. Mutable fields are guarded by the instance monitor.
     */
    private static final class Connection {
        private final String id;
        private final String userId;
        private final ConnectionOutbox outbox;
        private final ObjectOpenHashSet<String> rooms = new ObjectOpenHashSet<>();
        private boolean closed;

        private Connection(String id, String userId, ConnectionOutbox outbox) {
            this.id = id;
            this.userId = userId;
            this.outbox = outbox;
        }
    }

    /**
     * Member set of one room. Members are connection instances, never ids, so a
     * connection registered later under a reused id is not a member.
     */
    private static final class Room {
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        private final ReferenceOpenHashSet<Connection> members = new ReferenceOpenHashSet<>();

        void add(Connection connection) {
            lock.writeLock().lock();
            try {
                members.add(connection);
            } finally {
                lock.writeLock().unlock();
            }
        }

        /**
         * @return true if the room became empty.
         */
        boolean remove(Connection connection) {
            lock.writeLock().lock();
            try {
                members.remove(connection);
                return members.isEmpty();
            } finally {
                lock.writeLock().unlock();
            }
        }

        List<Connection> snapshot() {
            lock.readLock().lock();
            try {
                return List.copyOf(members);
            } finally {
                lock.readLock().unlock();
            }
        }
    }
}

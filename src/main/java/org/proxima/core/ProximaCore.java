package org.proxima.core;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.proxima.config.ProximaConfig;
import org.proxima.core.error.LocationPersistenceException;
import org.proxima.core.error.ValidationException;
import org.proxima.core.geo.Coordinates;
import org.proxima.messaging.MessageDispatcher;
import org.proxima.presence.PresenceRegistry;
import org.proxima.proximity.NearbyUser;
import org.proxima.proximity.ProximityQueryEngine;
import org.proxima.realtime.ConnectionOutbox;
import org.proxima.realtime.LocationEvent;
import org.proxima.realtime.LocationSharingPolicy;
import org.proxima.realtime.RoomRouter;
import org.proxima.realtime.Rooms;
import org.proxima.spatial.GeoCellIndex;
import org.proxima.spatial.LocationPoint;
import org.proxima.spatial.SpatialIndex;
import org.proxima.spatial.UpsertOutcome;
import org.proxima.store.LocationStore;
import org.proxima.store.MessageStore;
import org.proxima.store.UserDirectory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Main orchestration entry point.
 *
 * <p>The facade owns one instance of every core component and wires them to the external
 * collaborators it is given. Nothing is held in static state, so several independent
 * cores can live in one process. Execution flow of a location update:</p>
 * <ul>
 * <li>Validate coordinates, then take the user's location lock for the remaining steps.</li>
 * <li>Drop the update when the stored point is newer.</li>
 * <li>Persist through the {@link LocationStore}; a failure leaves memory untouched.</li>
 * <li>Upsert the {@link SpatialIndex} and touch the {@link PresenceRegistry}.</li>
 * <li>Publish a {@link LocationEvent} into the user's location room.</li>
 * </ul>
 */
@Slf4j
public final class ProximaCore implements ProximaService {
    public static final String REASON_USER_ID_REQUIRED = "CORE_USER_ID_REQUIRED";
    public static final String REASON_LOCATION_PERSIST_FAILED = "CORE_LOCATION_PERSIST_FAILED";

    @Getter
    @Accessors(fluent = true)
    private final ProximaConfig config;
    private final Clock clock;
    private final LocationStore locationStore;
    // Per-user guard around check, persist and upsert. Never evicted, like presence entries.
    private final ConcurrentHashMap<String, ReentrantLock> locationLocks = new ConcurrentHashMap<>();

    @Getter
    @Accessors(fluent = true)
    private final SpatialIndex spatialIndex;
    @Getter
    @Accessors(fluent = true)
    private final PresenceRegistry presenceRegistry;
    @Getter
    @Accessors(fluent = true)
    private final RoomRouter roomRouter;
    private final LocationSharingPolicy sharingPolicy;
    private final ProximityQueryEngine proximityQueryEngine;
    private final MessageDispatcher messageDispatcher;

    /**
     * Assembles a core.
     *
     * @param config runtime configuration; defaults when null.
     * @param clock time source; system UTC when null.
     * @param userDirectory external user lookup.
     * @param messageStore external message persistence.
     * @param locationStore external location persistence.
     * @param spatialIndex optional index override; a {@link GeoCellIndex} sized from config otherwise.
     */
    @Builder
    public ProximaCore(
            ProximaConfig config,
            Clock clock,
            UserDirectory userDirectory,
            MessageStore messageStore,
            LocationStore locationStore,
            SpatialIndex spatialIndex
    ) {
        this.config = (config == null ? ProximaConfig.defaults() : config).validate();
        this.clock = clock == null ? Clock.systemUTC() : clock;
        Objects.requireNonNull(userDirectory, "userDirectory");
        Objects.requireNonNull(messageStore, "messageStore");
        this.locationStore = Objects.requireNonNull(locationStore, "locationStore");

        this.spatialIndex = spatialIndex == null
                ? new GeoCellIndex(this.config.getCellSizeDegrees())
                : spatialIndex;
        this.presenceRegistry = new PresenceRegistry(this.clock, this.config.getPresenceWindow());
        this.sharingPolicy = new LocationSharingPolicy();
        this.roomRouter = new RoomRouter(sharingPolicy, this.clock, this.config.getOutboxCapacity());
        this.proximityQueryEngine = new ProximityQueryEngine(
                this.spatialIndex, presenceRegistry, userDirectory, this.clock, this.config);
        this.messageDispatcher = new MessageDispatcher(
                userDirectory, messageStore, roomRouter, presenceRegistry, this.clock, this.config);
    }

    @Override
    public boolean updateLocation(String userId, double latitude, double longitude) {
        return updateLocation(userId, latitude, longitude, clock.instant());
    }

    @Override
    public boolean updateLocation(String userId, double latitude, double longitude, Instant at) {
        requireUserId(userId);
        Objects.requireNonNull(at, "at");
        Coordinates.requireValid(latitude, longitude);

        ReentrantLock lock = locationLocks.computeIfAbsent(userId, id -> new ReentrantLock());
        lock.lock();
        try {
            Optional<LocationPoint> stored = spatialIndex.get(userId);
            if (stored.isPresent() && at.isBefore(stored.get().updatedAt())) {
                log.debug("Dropped stale location for {}: {} is older than {}", userId, at, stored.get().updatedAt());
                return false;
            }

            try {
                locationStore.persist(userId, latitude, longitude, at);
            } catch (RuntimeException ex) {
                throw new LocationPersistenceException(
                        REASON_LOCATION_PERSIST_FAILED,
                        "Location of " + userId + " could not be persisted: " + ex.getMessage(),
                        ex);
            }

            UpsertOutcome outcome = spatialIndex.upsert(userId, latitude, longitude, at);
            if (outcome == UpsertOutcome.STALE) {
                // Only reachable when the index is also written outside this facade.
                log.warn("Location of {} at {} persisted but superseded in the index", userId, at);
                return false;
            }
            presenceRegistry.touch(userId, at);
            roomRouter.publish(Rooms.locationRoom(userId),
                    LocationEvent.of(LocationPoint.of(userId, latitude, longitude, at)));
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<NearbyUser> findNearby(String requesterId, double latitude, double longitude, double radiusMiles) {
        return proximityQueryEngine.nearby(requesterId, latitude, longitude, radiusMiles);
    }

    @Override
    public String sendMessage(String senderId, Collection<String> recipientIds, String content, String imageData) {
        return messageDispatcher.send(senderId, recipientIds, content, imageData);
    }

    @Override
    public ConnectionOutbox onConnect(String connectionId) {
        return roomRouter.connect(connectionId);
    }

    @Override
    public ConnectionOutbox onConnect(String connectionId, String userId) {
        requireUserId(userId);
        return roomRouter.connect(connectionId, userId);
    }

    @Override
    public boolean onDisconnect(String connectionId) {
        return roomRouter.disconnect(connectionId);
    }

    @Override
    public boolean joinRoom(String connectionId, String roomId) {
        return roomRouter.join(connectionId, roomId);
    }

    @Override
    public boolean leaveRoom(String connectionId, String roomId) {
        return roomRouter.leave(connectionId, roomId);
    }

    @Override
    public ConnectionOutbox eventStream(String connectionId) {
        return roomRouter.outbox(connectionId);
    }

    @Override
    public boolean grantLocationAccess(String ownerId, String viewerId) {
        requireUserId(ownerId);
        requireUserId(viewerId);
        return sharingPolicy.grant(ownerId, viewerId);
    }

    @Override
    public boolean revokeLocationAccess(String ownerId, String viewerId) {
        requireUserId(ownerId);
        requireUserId(viewerId);
        boolean revoked = sharingPolicy.revoke(ownerId, viewerId);
        roomRouter.evictLocationViewer(ownerId, viewerId);
        return revoked;
    }

    private static void requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException(REASON_USER_ID_REQUIRED, "userId is required");
        }
    }
}

package org.proxima.store;

import org.proxima.spatial.LocationPoint;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link LocationStore} keeping one row per user, like an upsert by user id guarded by the row timestamp.
 */
public final class InMemoryLocationStore implements LocationStore {
    private final ConcurrentHashMap<String, LocationPoint> rows = new ConcurrentHashMap<>();

    /**
     * Keeps the row with the newest timestamp; an older write is ignored.
     */
    @Override
    public void persist(String userId, double latitude, double longitude, Instant at) {
        LocationPoint incoming = LocationPoint.of(userId, latitude, longitude, at);
        rows.merge(userId, incoming, (current, next) -> next.updatedAt().isBefore(current.updatedAt()) ? current : next);
    }

    public Optional<LocationPoint> find(String userId) {
        return Optional.ofNullable(rows.get(userId));
    }

    public int size() {
        return rows.size();
    }
}

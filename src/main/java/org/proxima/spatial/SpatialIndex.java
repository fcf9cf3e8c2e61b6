package org.proxima.spatial;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Latest-point-per-user store answering radius-bounded lookups.
 */
public interface SpatialIndex {

    /**
     * Replaces any prior point for the user.
     *
     * @param userId user identifier.
     * @param latitude latitude in {@code [-90, 90]}.
     * @param longitude longitude in {@code [-180, 180]}.
     * @param updatedAt point timestamp; a value strictly older than the stored point is dropped.
     * @return what happened to the stored point.
     * @throws org.proxima.core.error.ValidationException on out-of-range coordinates.
     */
    UpsertOutcome upsert(String userId, double latitude, double longitude, Instant updatedAt);

    /**
     * Removes a user's point.
     *
     * @return true if a point was removed.
     */
    boolean remove(String userId);

    /**
     * Returns the latest point of a user, if any.
     */
    Optional<LocationPoint> get(String userId);

    /**
     * Finds every point within {@code radiusMiles} (inclusive) of the query position.
     *
     * @return matches in no particular order; at most one per user.
     */
    List<SpatialMatch> query(double latitude, double longitude, double radiusMiles);

    /**
     * Number of users with a live point.
     */
    int size();
}

package org.proxima.spatial;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.proxima.core.geo.Coordinates;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable latest-known position of one user.
 */
@Getter
@ToString
@EqualsAndHashCode
@Accessors(fluent = true)
public final class LocationPoint {
    private final String userId;
    private final double latitude;
    private final double longitude;
    private final Instant updatedAt;

    private LocationPoint(String userId, double latitude, double longitude, Instant updatedAt) {
        this.userId = Objects.requireNonNull(userId, "userId");
        Coordinates.requireValid(latitude, longitude);
        this.latitude = latitude;
        this.longitude = longitude;
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
    }

    /**
     * Creates a validated point.
     *
     * @throws org.proxima.core.error.ValidationException on out-of-range coordinates.
     */
    public static LocationPoint of(String userId, double latitude, double longitude, Instant updatedAt) {
        return new LocationPoint(userId, latitude, longitude, updatedAt);
    }
}

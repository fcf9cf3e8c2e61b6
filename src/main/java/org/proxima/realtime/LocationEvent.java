package org.proxima.realtime;

import lombok.Value;
import org.proxima.spatial.LocationPoint;

import java.time.Instant;

/**
 * Location change pushed into {@code location_updates_{userId}}.
 */
@Value
public class LocationEvent implements EventPayload {
    public static final String EVENT_NAME = "location_update";

    String userId;
    double latitude;
    double longitude;
    Instant updatedAt;

    public static LocationEvent of(LocationPoint point) {
        return new LocationEvent(point.userId(), point.latitude(), point.longitude(), point.updatedAt());
    }

    @Override
    public String eventName() {
        return EVENT_NAME;
    }
}

package org.proxima.realtime;

import lombok.Value;

import java.time.Instant;

/**
 * Immutable event as queued for one subscriber.
 */
@Value
public class RoomEvent {
    /** Room the event was published to. */
    String roomId;
    /** Event body. */
    EventPayload payload;
    /** Publish instant. */
    Instant publishedAt;

    public String eventName() {
        return payload.eventName();
    }
}

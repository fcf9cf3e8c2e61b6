package org.proxima.realtime;

/**
 * Body of a {@link RoomEvent}.
 */
public interface EventPayload {

    /**
     * Wire event name, for example {@code new_message}.
     */
    String eventName();
}

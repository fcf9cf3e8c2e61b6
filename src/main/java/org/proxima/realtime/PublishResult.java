package org.proxima.realtime;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Summary counters for one {@link RoomRouter#publish(String, EventPayload)} call.
 */
@Getter
@ToString
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class PublishResult {
    static final PublishResult EMPTY = new PublishResult(0, 0, 0, 0);

    /** Connections subscribed at the instant of publish. */
    private final int subscribers;
    /** Events accepted into subscriber outboxes. */
    private final int delivered;
    /** Events dropped because a subscriber outbox was full. */
    private final int dropped;
    /** Subscribers skipped because they were tearing down. */
    private final int skipped;
}

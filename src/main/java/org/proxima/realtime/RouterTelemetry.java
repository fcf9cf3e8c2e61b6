package org.proxima.realtime;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable room-router telemetry snapshot.
 */
@Value
@Builder
public class RouterTelemetry {
    int connections;
    int rooms;
    long published;
    long delivered;
    long dropped;
}

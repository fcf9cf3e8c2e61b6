package org.proxima.proximity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One entry of a nearby-users answer.
 */
@Value
@Builder
public class NearbyUser {
    /** Discovered user id. */
    String userId;
    /** Great-circle distance from the query point, rounded to two decimals. */
    double distanceMiles;
    /** Latest known latitude. */
    double latitude;
    /** Latest known longitude. */
    double longitude;
    /** Last recorded activity of the user. */
    Instant lastActive;
}

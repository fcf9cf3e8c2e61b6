package org.proxima.proximity;

import lombok.extern.slf4j.Slf4j;
import org.proxima.config.ProximaConfig;
import org.proxima.core.error.NotFoundException;
import org.proxima.core.error.ValidationException;
import org.proxima.core.geo.Coordinates;
import org.proxima.presence.PresenceRegistry;
import org.proxima.spatial.SpatialIndex;
import org.proxima.spatial.SpatialMatch;
import org.proxima.store.UserDirectory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Answers "which active users lie within radius R of point P".
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Validate requester, coordinates and radius before touching any index.</li>
 * <li>Read the clock once; that instant is the activity cut-off for the whole query.</li>
 * <li>Collect radius candidates from the {@link SpatialIndex}.</li>
 * <li>Drop the requester and every user outside the presence window.</li>
 * <li>Sort by full-precision distance, ties by user id, then round distances for output.</li>
 * </ul>
 */
@Slf4j
public final class ProximityQueryEngine {
    public static final String REASON_REQUESTER_REQUIRED = "NEARBY_REQUESTER_REQUIRED";
    public static final String REASON_UNKNOWN_REQUESTER = "NEARBY_UNKNOWN_REQUESTER";
    public static final String REASON_RADIUS_OUT_OF_RANGE = "NEARBY_RADIUS_OUT_OF_RANGE";

    private static final Comparator<Candidate> BY_DISTANCE_THEN_ID = Comparator
            .comparingDouble(Candidate::distanceMiles)
            .thenComparing(candidate -> candidate.match().point().userId());

    private final SpatialIndex spatialIndex;
    private final PresenceRegistry presenceRegistry;
    private final UserDirectory userDirectory;
    private final Clock clock;
    private final double minRadiusMiles;
    private final double maxRadiusMiles;
    private final Duration presenceWindow;

    public ProximityQueryEngine(
            SpatialIndex spatialIndex,
            PresenceRegistry presenceRegistry,
            UserDirectory userDirectory,
            Clock clock,
            ProximaConfig config
    ) {
        this.spatialIndex = Objects.requireNonNull(spatialIndex, "spatialIndex");
        this.presenceRegistry = Objects.requireNonNull(presenceRegistry, "presenceRegistry");
        this.userDirectory = Objects.requireNonNull(userDirectory, "userDirectory");
        this.clock = Objects.requireNonNull(clock, "clock");
        ProximaConfig validated = Objects.requireNonNull(config, "config").validate();
        this.minRadiusMiles = validated.getMinRadiusMiles();
        this.maxRadiusMiles = validated.getMaxRadiusMiles();
        this.presenceWindow = validated.getPresenceWindow();
    }

    /**
     * Finds active users near a point.
     *
     * @param requesterId caller identity; excluded from the answer.
     * @param latitude query latitude.
     * @param longitude query longitude.
     * @param radiusMiles search radius, inclusive bounds from configuration.
     * @return users sorted ascending by distance, ties broken by user id.
     * @throws ValidationException on malformed coordinates or an out-of-range radius.
     * @throws NotFoundException when the requester is not a known user.
     */
    public List<NearbyUser> nearby(String requesterId, double latitude, double longitude, double radiusMiles) {
        if (requesterId == null || requesterId.isBlank()) {
            throw new ValidationException(REASON_REQUESTER_REQUIRED, "requesterId is required");
        }
        Coordinates.requireValid(latitude, longitude);
        validateRadius(radiusMiles);
        if (!userDirectory.exists(requesterId)) {
            throw new NotFoundException(REASON_UNKNOWN_REQUESTER, "Unknown requester: " + requesterId);
        }

        Instant now = clock.instant();
        List<SpatialMatch> matches = spatialIndex.query(latitude, longitude, radiusMiles);
        List<Candidate> candidates = new ArrayList<>(matches.size());
        for (SpatialMatch match : matches) {
            String userId = match.point().userId();
            if (userId.equals(requesterId)) {
                continue;
            }
            Optional<Instant> lastActive = presenceRegistry.lastActive(userId);
            if (lastActive.isEmpty() || !PresenceRegistry.isWithinWindow(lastActive.get(), now, presenceWindow)) {
                continue;
            }
            candidates.add(new Candidate(match, lastActive.get()));
        }
        candidates.sort(BY_DISTANCE_THEN_ID);

        List<NearbyUser> result = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            result.add(NearbyUser.builder()
                    .userId(candidate.match().point().userId())
                    .distanceMiles(roundMiles(candidate.distanceMiles()))
                    .latitude(candidate.match().point().latitude())
                    .longitude(candidate.match().point().longitude())
                    .lastActive(candidate.lastActive())
                    .build());
        }
        log.debug("nearby requester={} radius={} candidates={} active={}",
                requesterId, radiusMiles, matches.size(), result.size());
        return result;
    }

    /**
     * Rounds a distance half-up to two decimal places.
     */
    static double roundMiles(double miles) {
        return BigDecimal.valueOf(miles).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private void validateRadius(double radiusMiles) {
        if (!Double.isFinite(radiusMiles) || radiusMiles < minRadiusMiles || radiusMiles > maxRadiusMiles) {
            throw new ValidationException(
                    REASON_RADIUS_OUT_OF_RANGE,
                    "radiusMiles must be within [" + minRadiusMiles + ", " + maxRadiusMiles + "], got " + radiusMiles);
        }
    }

    private record Candidate(SpatialMatch match, Instant lastActive) {
        double distanceMiles() {
            return match.distanceMiles();
        }
    }
}

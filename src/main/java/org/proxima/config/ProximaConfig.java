package org.proxima.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Runtime configuration bound once when the core is assembled.
 */
@Value
@Builder(toBuilder = true)
public class ProximaConfig {
    public static final double MAX_CELL_SIZE_DEGREES = 10.0d;

    /**
     * Trailing interval within which a user counts as active for discovery.
     */
    @Builder.Default
    Duration presenceWindow = Duration.ofMinutes(30);

    /**
     * Smallest accepted search radius, inclusive.
     */
    @Builder.Default
    double minRadiusMiles = 0.5d;

    /**
     * Largest accepted search radius, inclusive.
     */
    @Builder.Default
    double maxRadiusMiles = 5.0d;

    /**
     * Edge length of one spatial cell in degrees. Must divide 180 evenly.
     */
    @Builder.Default
    double cellSizeDegrees = 0.1d;

    /**
     * Number of undelivered events buffered per connection before new events are dropped.
     */
    @Builder.Default
    int outboxCapacity = 256;

    /**
     * Maximum message content length in characters.
     */
    @Builder.Default
    int maxMessageLength = 4_000;

    /**
     * Returns the configuration used when nothing is overridden.
     */
    public static ProximaConfig defaults() {
        return ProximaConfig.builder().build();
    }

    /**
     * Validates cross-field constraints.
     *
     * @return this instance, for chaining.
     * @throws IllegalArgumentException if any value is out of its domain.
     */
    public ProximaConfig validate() {
        if (presenceWindow == null || presenceWindow.isNegative() || presenceWindow.isZero()) {
            throw new IllegalArgumentException("presenceWindow must be > 0");
        }
        if (!Double.isFinite(minRadiusMiles) || minRadiusMiles <= 0.0d) {
            throw new IllegalArgumentException("minRadiusMiles must be finite and > 0");
        }
        if (!Double.isFinite(maxRadiusMiles) || maxRadiusMiles < minRadiusMiles) {
            throw new IllegalArgumentException("maxRadiusMiles must be finite and >= minRadiusMiles");
        }
        if (!Double.isFinite(cellSizeDegrees) || cellSizeDegrees <= 0.0d || cellSizeDegrees > MAX_CELL_SIZE_DEGREES) {
            throw new IllegalArgumentException("cellSizeDegrees must be within (0, " + MAX_CELL_SIZE_DEGREES + "]");
        }
        long rows = Math.round(180.0d / cellSizeDegrees);
        if (Math.abs(rows * cellSizeDegrees - 180.0d) > 1e-9d) {
            throw new IllegalArgumentException("cellSizeDegrees must divide 180 evenly, got " + cellSizeDegrees);
        }
        if (outboxCapacity <= 0) {
            throw new IllegalArgumentException("outboxCapacity must be > 0");
        }
        if (maxMessageLength <= 0) {
            throw new IllegalArgumentException("maxMessageLength must be > 0");
        }
        return this;
    }
}

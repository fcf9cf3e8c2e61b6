package org.proxima.spatial;

/**
 * Result of {@link SpatialIndex#upsert(String, double, double, java.time.Instant)}.
 */
public enum UpsertOutcome {
    /** No previous point existed for the user. */
    INSERTED,
    /** A previous point existed and was superseded. */
    UPDATED,
    /** The incoming point was older than the stored one and was dropped. */
    STALE
}

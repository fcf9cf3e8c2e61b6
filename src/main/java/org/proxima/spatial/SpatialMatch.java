package org.proxima.spatial;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Immutable radius-query hit with its full-precision great-circle distance.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class SpatialMatch {
    private final LocationPoint point;
    private final double distanceMiles;
}

package org.proxima.core.geo;

import lombok.experimental.UtilityClass;
import org.proxima.core.error.ValidationException;

/**
 * WGS84 coordinate domain checks.
 */
@UtilityClass
public class Coordinates {
    public static final String REASON_INVALID_LATITUDE = "GEO_INVALID_LATITUDE";
    public static final String REASON_INVALID_LONGITUDE = "GEO_INVALID_LONGITUDE";

    /**
     * Rejects non-finite or out-of-range coordinates.
     *
     * @throws ValidationException when latitude is outside {@code [-90, 90]} or
     * longitude is outside {@code [-180, 180]}.
     */
    public static void requireValid(double latitude, double longitude) {
        if (!Double.isFinite(latitude) || latitude < -90.0d || latitude > 90.0d) {
            throw new ValidationException(
                    REASON_INVALID_LATITUDE,
                    "latitude must be within [-90, 90], got " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180.0d || longitude > 180.0d) {
            throw new ValidationException(
                    REASON_INVALID_LONGITUDE,
                    "longitude must be within [-180, 180], got " + longitude);
        }
    }
}

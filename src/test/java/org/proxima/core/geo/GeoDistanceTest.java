package org.proxima.core.geo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.proxima.core.error.ValidationException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Geo Distance Tests")
class GeoDistanceTest {

    @Test
    @DisplayName("Zero distance for identical points")
    void testIdenticalPoints() {
        assertEquals(0.0, GeoDistance.greatCircleDistanceMiles(37.7749, -122.4194, 37.7749, -122.4194), 1e-12);
    }

    @Test
    @DisplayName("One degree of latitude matches the mean-sphere constant")
    void testOneDegreeLatitude() {
        double miles = GeoDistance.greatCircleDistanceMiles(10.0, 20.0, 11.0, 20.0);
        assertEquals(GeoDistance.MILES_PER_DEGREE_LATITUDE, miles, 1e-9);
        assertEquals(69.09, miles, 0.01);
    }

    @Test
    @DisplayName("San Francisco pair resolves to 0.88 miles")
    void testSanFranciscoPair() {
        double miles = GeoDistance.greatCircleDistanceMiles(37.7749, -122.4194, 37.7849, -122.4094);
        assertEquals(0.8807, miles, 0.001);
    }

    @Test
    @DisplayName("Antimeridian neighbours take the short way around")
    void testAntimeridian() {
        double miles = GeoDistance.greatCircleDistanceMiles(0.0, 179.95, 0.0, -179.95);
        assertEquals(6.91, miles, 0.01);
        assertEquals(miles, GeoDistance.greatCircleDistanceMiles(0.0, -179.95, 0.0, 179.95), 1e-9);
    }

    @Test
    @DisplayName("Near-pole points across the pole stay close")
    void testNearPole() {
        // 0.005 degrees from the pole on opposite meridians: 0.01 degrees of arc apart.
        double miles = GeoDistance.greatCircleDistanceMiles(89.995, 10.0, 89.995, -170.0);
        assertEquals(0.691, miles, 0.001);
    }

    @Test
    @DisplayName("Delta longitude normalizes into (-180, 180]")
    void testNormalizeDeltaLongitude() {
        assertEquals(0.1, GeoDistance.normalizeDeltaLongitudeDegrees(-359.9), 1e-9);
        assertEquals(-0.1, GeoDistance.normalizeDeltaLongitudeDegrees(359.9), 1e-9);
        assertEquals(180.0, GeoDistance.normalizeDeltaLongitudeDegrees(-180.0), 1e-12);
        assertEquals(180.0, GeoDistance.normalizeDeltaLongitudeDegrees(180.0), 1e-12);
        assertEquals(45.0, GeoDistance.normalizeDeltaLongitudeDegrees(45.0), 1e-12);
    }

    @Test
    @DisplayName("Longitude half-width grows with latitude and saturates at the pole")
    void testLongitudeHalfWidth() {
        double equator = GeoDistance.longitudeHalfWidthDegrees(0.0, 5.0);
        double sixty = GeoDistance.longitudeHalfWidthDegrees(60.0, 5.0);
        assertEquals(5.0 / GeoDistance.MILES_PER_DEGREE_LATITUDE, equator, 1e-6);
        assertEquals(2.0 * equator, sixty, 1e-4);
        assertEquals(180.0, GeoDistance.longitudeHalfWidthDegrees(90.0, 1.0));
        assertEquals(180.0, GeoDistance.longitudeHalfWidthDegrees(89.99, 5.0));
    }

    @Test
    @DisplayName("Coordinate validation rejects out-of-range and non-finite values")
    void testCoordinateValidation() {
        assertDoesNotThrow(() -> Coordinates.requireValid(90.0, 180.0));
        assertDoesNotThrow(() -> Coordinates.requireValid(-90.0, -180.0));

        ValidationException lat = assertThrows(ValidationException.class, () -> Coordinates.requireValid(90.0001, 0.0));
        assertEquals(Coordinates.REASON_INVALID_LATITUDE, lat.getReasonCode());
        ValidationException lon = assertThrows(ValidationException.class, () -> Coordinates.requireValid(0.0, -180.5));
        assertEquals(Coordinates.REASON_INVALID_LONGITUDE, lon.getReasonCode());
        assertThrows(ValidationException.class, () -> Coordinates.requireValid(Double.NaN, 0.0));
        assertThrows(ValidationException.class, () -> Coordinates.requireValid(0.0, Double.POSITIVE_INFINITY));
    }
}

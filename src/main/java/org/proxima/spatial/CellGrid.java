package org.proxima.spatial;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.proxima.core.geo.GeoDistance;

/**
 * Fixed latitude/longitude partition of the globe into square-degree cells.
 * <p>
 * Rows cover {@code [-90, 90]} and columns cover {@code [-180, 180)}. Column indexes wrap
 * modulo {@link #columns()}, so a longitude of {@code 180} lands in the same column as
 * {@code -180}. Cell keys are dense longs {@code row * columns + column}.
 * </p>
 */
@Getter
@Accessors(fluent = true)
public final class CellGrid {
    // Absorbs rounding in the bounding-box trigonometry.
    private static final double BOX_PADDING_DEGREES = 1e-7d;

    private final double cellSizeDegrees;
    private final int rows;
    private final int columns;

    /**
     * @param cellSizeDegrees cell edge in degrees; must divide 180 evenly.
     */
    public CellGrid(double cellSizeDegrees) {
        if (!Double.isFinite(cellSizeDegrees) || cellSizeDegrees <= 0.0d) {
            throw new IllegalArgumentException("cellSizeDegrees must be finite and > 0");
        }
        long rowCount = Math.round(180.0d / cellSizeDegrees);
        if (rowCount <= 0 || Math.abs(rowCount * cellSizeDegrees - 180.0d) > 1e-9d) {
            throw new IllegalArgumentException("cellSizeDegrees must divide 180 evenly, got " + cellSizeDegrees);
        }
        if (rowCount * 2L * rowCount > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("cellSizeDegrees too small: " + cellSizeDegrees);
        }
        this.cellSizeDegrees = cellSizeDegrees;
        this.rows = (int) rowCount;
        this.columns = (int) (rowCount * 2L);
    }

    /**
     * Row index for a latitude, clamped into {@code [0, rows - 1]}.
     */
    public int row(double latitude) {
        int row = (int) Math.floor((latitude + 90.0d) / cellSizeDegrees);
        if (row < 0) {
            return 0;
        }
        return Math.min(row, rows - 1);
    }

    /**
     * Column index for a longitude, wrapped into {@code [0, columns - 1]}.
     */
    public int column(double longitude) {
        return Math.floorMod((long) Math.floor((longitude + 180.0d) / cellSizeDegrees), columns);
    }

    /**
     * Dense cell key.
     */
    public long key(int row, int column) {
        return (long) row * columns + column;
    }

    /**
     * Cell key of a point.
     */
    public long keyOf(double latitude, double longitude) {
        return key(row(latitude), column(longitude));
    }

    /**
     * Enumerates cell keys intersecting the bounding box of a circle.
     * <p>
     * The box is computed on the sphere. When it crosses the antimeridian the column range
     * wraps; when it touches a pole, or is wider than the globe, every column of the
     * covered rows is returned. Keys are distinct.
     * </p>
     *
     * @param latitude circle center latitude.
     * @param longitude circle center longitude.
     * @param radiusMiles circle radius in miles, {@code >= 0}.
     * @return distinct cell keys.
     */
    public LongArrayList cellsCovering(double latitude, double longitude, double radiusMiles) {
        double latDelta = radiusMiles / GeoDistance.MILES_PER_DEGREE_LATITUDE + BOX_PADDING_DEGREES;
        double minLat = latitude - latDelta;
        double maxLat = latitude + latDelta;
        int rowStart = row(Math.max(-90.0d, minLat));
        int rowEnd = row(Math.min(90.0d, maxLat));

        boolean allColumns = minLat <= -90.0d || maxLat >= 90.0d;
        long columnStart = 0;
        long columnEnd = columns - 1L;
        if (!allColumns) {
            double lonDelta = GeoDistance.longitudeHalfWidthDegrees(latitude, radiusMiles) + BOX_PADDING_DEGREES;
            columnStart = (long) Math.floor((longitude - lonDelta + 180.0d) / cellSizeDegrees);
            columnEnd = (long) Math.floor((longitude + lonDelta + 180.0d) / cellSizeDegrees);
            allColumns = columnEnd - columnStart + 1 >= columns;
        }

        int rowCount = rowEnd - rowStart + 1;
        LongArrayList keys;
        if (allColumns) {
            keys = new LongArrayList(rowCount * columns);
            for (int r = rowStart; r <= rowEnd; r++) {
                for (int c = 0; c < columns; c++) {
                    keys.add(key(r, c));
                }
            }
            return keys;
        }

        keys = new LongArrayList((int) (rowCount * (columnEnd - columnStart + 1)));
        for (int r = rowStart; r <= rowEnd; r++) {
            for (long c = columnStart; c <= columnEnd; c++) {
                keys.add(key(r, (int) Math.floorMod(c, (long) columns)));
            }
        }
        return keys;
    }
}

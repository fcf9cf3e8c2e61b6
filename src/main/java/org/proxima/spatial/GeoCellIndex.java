package org.proxima.spatial;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.proxima.core.geo.Coordinates;
import org.proxima.core.geo.GeoDistance;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Cell-partitioned spatial index over the latest point of each user.
 * <p>
 * Two maps back the index:
 * </p>
 * <ul>
 * <li>{@code latest}: user id to current point. Every write for a user runs inside that
 * user's {@link ConcurrentHashMap#compute} so moves between cells are serialized per user.</li>
 * <li>{@code cells}: cell key to the points it holds. Cells are created and retired
 * atomically with the membership change; each cell carries its own read/write lock so
 * queries scanning a cell never see a half-applied move.</li>
 * </ul>
 * <p>
 * Query cost is proportional to the points in cells intersecting the search box, not to
 * the total user count. Every candidate is confirmed by exact haversine distance.
 * </p>
 */
public final class GeoCellIndex implements SpatialIndex {

    @Getter
    @Accessors(fluent = true)
    private final CellGrid grid;
    private final ConcurrentHashMap<String, LocationPoint> latest = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, Cell> cells = new ConcurrentHashMap<>();

    /**
     * @param cellSizeDegrees cell edge in degrees; must divide 180 evenly.
     */
    public GeoCellIndex(double cellSizeDegrees) {
        this(new CellGrid(cellSizeDegrees));
    }

    public GeoCellIndex(CellGrid grid) {
        this.grid = Objects.requireNonNull(grid, "grid");
    }

    @Override
    public UpsertOutcome upsert(String userId, double latitude, double longitude, Instant updatedAt) {
        LocationPoint incoming = LocationPoint.of(userId, latitude, longitude, updatedAt);
        long newKey = grid.keyOf(latitude, longitude);
        UpsertOutcome[] outcome = new UpsertOutcome[1];

        latest.compute(userId, (id, current) -> {
            if (current == null) {
                addToCell(newKey, incoming);
                outcome[0] = UpsertOutcome.INSERTED;
                return incoming;
            }
            if (incoming.updatedAt().isBefore(current.updatedAt())) {
                outcome[0] = UpsertOutcome.STALE;
                return current;
            }
            long oldKey = grid.keyOf(current.latitude(), current.longitude());
            if (oldKey == newKey) {
                addToCell(newKey, incoming);
            } else {
                // Add before remove: a concurrent query sees the user in at least one cell.
                addToCell(newKey, incoming);
                removeFromCell(oldKey, id);
            }
            outcome[0] = UpsertOutcome.UPDATED;
            return incoming;
        });
        return outcome[0];
    }

    @Override
    public boolean remove(String userId) {
        Objects.requireNonNull(userId, "userId");
        boolean[] removed = new boolean[1];
        latest.computeIfPresent(userId, (id, current) -> {
            removeFromCell(grid.keyOf(current.latitude(), current.longitude()), id);
            removed[0] = true;
            return null;
        });
        return removed[0];
    }

    @Override
    public Optional<LocationPoint> get(String userId) {
        Objects.requireNonNull(userId, "userId");
        return Optional.ofNullable(latest.get(userId));
    }

    @Override
    public List<SpatialMatch> query(double latitude, double longitude, double radiusMiles) {
        Coordinates.requireValid(latitude, longitude);
        if (!Double.isFinite(radiusMiles) || radiusMiles < 0.0d) {
            throw new IllegalArgumentException("radiusMiles must be finite and >= 0");
        }

        LongArrayList keys = grid.cellsCovering(latitude, longitude, radiusMiles);
        List<LocationPoint> candidates = new ArrayList<>();
        for (int i = 0; i < keys.size(); i++) {
            Cell cell = cells.get(keys.getLong(i));
            if (cell != null) {
                cell.collect(candidates);
            }
        }

        Object2ObjectOpenHashMap<String, SpatialMatch> matches = new Object2ObjectOpenHashMap<>();
        for (LocationPoint point : candidates) {
            double distance = GeoDistance.greatCircleDistanceMiles(
                    latitude, longitude, point.latitude(), point.longitude());
            if (distance > radiusMiles) {
                continue;
            }
            // A user caught mid-move can sit in two scanned cells; keep the newest point.
            SpatialMatch previous = matches.get(point.userId());
            if (previous == null || point.updatedAt().isAfter(previous.point().updatedAt())) {
                matches.put(point.userId(), new SpatialMatch(point, distance));
            }
        }
        return new ArrayList<>(matches.values());
    }

    @Override
    public int size() {
        return latest.size();
    }

    /**
     * Number of non-empty cells currently allocated.
     */
    public int cellCount() {
        return cells.size();
    }

    private void addToCell(long key, LocationPoint point) {
        cells.compute(key, (k, cell) -> {
            Cell target = cell == null ? new Cell() : cell;
            target.put(point);
            return target;
        });
    }

    private void removeFromCell(long key, String userId) {
        cells.computeIfPresent(key, (k, cell) -> cell.remove(userId) ? null : cell);
    }

    /**
     * Points currently held by one grid cell.
     */
    private static final class Cell {
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        private final Object2ObjectOpenHashMap<String, LocationPoint> points = new Object2ObjectOpenHashMap<>();

        void put(LocationPoint point) {
            lock.writeLock().lock();
            try {
                points.put(point.userId(), point);
            } finally {
                lock.writeLock().unlock();
            }
        }

        /**
         * @return true if the cell became empty.
         */
        boolean remove(String userId) {
            lock.writeLock().lock();
            try {
                points.remove(userId);
                return points.isEmpty();
            } finally {
                lock.writeLock().unlock();
            }
        }

        void collect(List<LocationPoint> sink) {
            lock.readLock().lock();
            try {
                sink.addAll(points.values());
            } finally {
                lock.readLock().unlock();
            }
        }
    }
}

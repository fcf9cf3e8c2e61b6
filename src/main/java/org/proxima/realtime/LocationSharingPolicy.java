package org.proxima.realtime;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicit sharing grants for location rooms.
 * <p>
 * A viewer may follow {@code location_updates_{owner}} only when it is the owner itself
 * or the owner granted it access. Grants are directional and not transitive.
 * </p>
 */
public final class LocationSharingPolicy {
    private final ConcurrentHashMap<String, Set<String>> viewersByOwner = new ConcurrentHashMap<>();

    /**
     * Allows {@code viewerId} to follow the location of {@code ownerId}.
     *
     * @return true if the grant is new.
     */
    public boolean grant(String ownerId, String viewerId) {
        requireIds(ownerId, viewerId);
        if (ownerId.equals(viewerId)) {
            return false;
        }
        boolean[] added = new boolean[1];
        viewersByOwner.compute(ownerId, (id, viewers) -> {
            Set<String> target = viewers == null ? ConcurrentHashMap.newKeySet() : viewers;
            added[0] = target.add(viewerId);
            return target;
        });
        return added[0];
    }

    /**
     * Withdraws a grant. Existing subscriptions are not touched here.
     *
     * @return true if a grant was removed.
     */
    public boolean revoke(String ownerId, String viewerId) {
        requireIds(ownerId, viewerId);
        boolean[] removed = new boolean[1];
        viewersByOwner.computeIfPresent(ownerId, (id, viewers) -> {
            removed[0] = viewers.remove(viewerId);
            return viewers.isEmpty() ? null : viewers;
        });
        return removed[0];
    }

    /**
     * Checks whether a viewer may follow an owner's location.
     */
    public boolean canView(String ownerId, String viewerId) {
        if (ownerId == null || viewerId == null) {
            return false;
        }
        if (ownerId.equals(viewerId)) {
            return true;
        }
        Set<String> viewers = viewersByOwner.get(ownerId);
        return viewers != null && viewers.contains(viewerId);
    }

    private static void requireIds(String ownerId, String viewerId) {
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(viewerId, "viewerId");
    }
}

package org.proxima.presence;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last-known activity timestamp per user.
 * <p>
 * Entries are never deleted; they simply age out of the active window. Writers go
 * through a per-key atomic compare-and-update on a {@link ConcurrentHashMap}, so touches
 * for different users never contend and touches for one user cannot lose updates.
 * </p>
 * <p>
 * Ordering contract: the stored timestamp only moves forward. A touch carrying an older
 * timestamp than the stored one (for example a reordered network packet) is ignored.
 * </p>
 * <p>
 * Activity contract: a user is active at {@code now} when
 * {@code now - lastActive < window}. The window boundary is exclusive.
 * </p>
 */
public final class PresenceRegistry {

    private final ConcurrentHashMap<String, Instant> lastActive = new ConcurrentHashMap<>();
    private final Clock clock;
    @Getter
    @Accessors(fluent = true)
    private final Duration defaultWindow;

    /**
     * @param clock time source for {@link #touch(String)}.
     * @param defaultWindow window used by {@link #isActive(String, Instant)}; must be {@code > 0}.
     */
    public PresenceRegistry(Clock clock, Duration defaultWindow) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultWindow = requirePositive(defaultWindow);
    }

    /**
     * Records activity for a user at the current clock instant.
     *
     * @return true if the stored timestamp advanced.
     */
    public boolean touch(String userId) {
        return touch(userId, clock.instant());
    }

    /**
     * Records activity for a user at an explicit instant.
     *
     * @param userId user identifier.
     * @param at activity instant.
     * @return true if the stored timestamp advanced, false if {@code at} was not newer.
     */
    public boolean touch(String userId, Instant at) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(at, "at");
        boolean[] advanced = new boolean[1];
        lastActive.compute(userId, (id, current) -> {
            if (current == null || at.isAfter(current)) {
                advanced[0] = true;
                return at;
            }
            return current;
        });
        return advanced[0];
    }

    /**
     * Last recorded activity, if the user was ever seen.
     */
    public Optional<Instant> lastActive(String userId) {
        Objects.requireNonNull(userId, "userId");
        return Optional.ofNullable(lastActive.get(userId));
    }

    /**
     * Activity check using the registry's default window.
     */
    public boolean isActive(String userId, Instant now) {
        return isActive(userId, now, defaultWindow);
    }

    /**
     * Returns {@code now - lastActive < window}. Unknown users are inactive.
     */
    public boolean isActive(String userId, Instant now, Duration window) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(now, "now");
        requirePositive(window);
        Instant seen = lastActive.get(userId);
        return seen != null && isWithinWindow(seen, now, window);
    }

    /**
     * Pure recency predicate shared with callers that already hold a timestamp.
     */
    public static boolean isWithinWindow(Instant lastActive, Instant now, Duration window) {
        return Duration.between(lastActive, now).compareTo(window) < 0;
    }

    /**
     * Number of users ever seen.
     */
    public int size() {
        return lastActive.size();
    }

    private static Duration requirePositive(Duration window) {
        Objects.requireNonNull(window, "window");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be > 0");
        }
        return window;
    }
}

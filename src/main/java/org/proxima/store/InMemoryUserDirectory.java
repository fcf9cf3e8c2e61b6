package org.proxima.store;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link UserDirectory} for smoke runs and tests.
 */
public final class InMemoryUserDirectory implements UserDirectory {
    private final Set<String> users = ConcurrentHashMap.newKeySet();

    public InMemoryUserDirectory() {
    }

    public InMemoryUserDirectory(Collection<String> userIds) {
        userIds.forEach(this::register);
    }

    /**
     * Adds a user id.
     *
     * @return true if it was not registered before.
     */
    public boolean register(String userId) {
        return users.add(Objects.requireNonNull(userId, "userId"));
    }

    @Override
    public boolean exists(String userId) {
        return userId != null && users.contains(userId);
    }

    public int size() {
        return users.size();
    }
}

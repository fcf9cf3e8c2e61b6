package org.proxima.store;

import java.time.Instant;

/**
 * Durable location persistence owned by an external service.
 */
@FunctionalInterface
public interface LocationStore {

    /**
     * Durably records the latest location of a user. May block.
     * <p>
     * Implementations keep last-writer-wins by {@code at}: a write older than the stored
     * row must not replace it.
     * </p>
     *
     * @throws RuntimeException when the location could not be stored.
     */
    void persist(String userId, double latitude, double longitude, Instant at);
}

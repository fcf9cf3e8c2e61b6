package org.proxima.store;

/**
 * Read-only view of the external user store.
 */
@FunctionalInterface
public interface UserDirectory {

    /**
     * Checks whether a user id belongs to a known account. May block.
     *
     * @param userId user identifier.
     * @return true when the account exists.
     */
    boolean exists(String userId);
}

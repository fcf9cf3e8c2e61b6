package org.proxima.core.error;

/**
 * The external location store failed; in-memory location state was left untouched.
 */
public final class LocationPersistenceException extends ProximaException {

    public LocationPersistenceException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}

package org.proxima.core.error;

/**
 * Raised when a connection may not join the requested room.
 */
public final class AuthorizationException extends ProximaException {

    public AuthorizationException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}

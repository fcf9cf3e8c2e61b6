package org.proxima.core.error;

/**
 * Raised when a requester, recipient or connection id is unknown.
 */
public final class NotFoundException extends ProximaException {

    public NotFoundException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}

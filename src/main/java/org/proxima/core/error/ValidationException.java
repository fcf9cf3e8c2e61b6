package org.proxima.core.error;

/**
 * Malformed input rejected before any state is mutated.
 */
public final class ValidationException extends ProximaException {

    public ValidationException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}

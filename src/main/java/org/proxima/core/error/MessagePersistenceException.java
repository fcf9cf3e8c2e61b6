package org.proxima.core.error;

/**
 * The external message store failed; the message was not fanned out.
 */
public final class MessagePersistenceException extends ProximaException {

    public MessagePersistenceException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}

package org.proxima.store;

import org.proxima.messaging.OutboundMessage;

/**
 * Durable message persistence owned by an external service.
 */
@FunctionalInterface
public interface MessageStore {

    /**
     * Durably records a message. May block.
     *
     * @param message fully built message.
     * @return id under which the message was stored.
     * @throws RuntimeException when the message could not be stored.
     */
    String persist(OutboundMessage message);
}

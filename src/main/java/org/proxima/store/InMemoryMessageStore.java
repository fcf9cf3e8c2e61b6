package org.proxima.store;

import org.proxima.messaging.OutboundMessage;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link MessageStore} keyed by message id.
 */
public final class InMemoryMessageStore implements MessageStore {
    private final ConcurrentHashMap<String, OutboundMessage> messages = new ConcurrentHashMap<>();

    @Override
    public String persist(OutboundMessage message) {
        Objects.requireNonNull(message, "message");
        if (messages.putIfAbsent(message.getMessageId(), message) != null) {
            throw new IllegalStateException("Duplicate message id: " + message.getMessageId());
        }
        return message.getMessageId();
    }

    public Optional<OutboundMessage> find(String messageId) {
        return Optional.ofNullable(messages.get(messageId));
    }

    public int size() {
        return messages.size();
    }
}

package org.proxima.messaging;

import lombok.Value;
import org.proxima.realtime.EventPayload;

import java.time.Instant;
import java.util.List;

/**
 * {@code new_message} event published into {@link org.proxima.realtime.Rooms#MESSAGES}.
 */
@Value
public class MessageEvent implements EventPayload {
    public static final String EVENT_NAME = "new_message";

    String messageId;
    String senderId;
    List<String> recipientIds;
    String content;
    String imageData;
    Instant timestamp;

    /**
     * Builds the event for a persisted message.
     *
     * @param persistedId id the store reported for the message.
     */
    static MessageEvent of(String persistedId, OutboundMessage message) {
        return new MessageEvent(
                persistedId,
                message.getSenderId(),
                message.getRecipientIds(),
                message.getContent(),
                message.getImageData(),
                message.getCreatedAt());
    }

    @Override
    public String eventName() {
        return EVENT_NAME;
    }
}

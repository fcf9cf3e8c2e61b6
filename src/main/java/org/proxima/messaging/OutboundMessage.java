package org.proxima.messaging;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Immutable message as handed to the external store and fanned out afterwards.
 */
@Value
@Builder
public class OutboundMessage {
    /** Message id assigned at dispatch time. */
    String messageId;
    /** Sending user. */
    String senderId;
    /** Distinct recipients in request order. */
    @Singular
    List<String> recipientIds;
    /** Text body. */
    String content;
    /** Optional base64 image payload, null when absent. */
    String imageData;
    /** Dispatch instant. */
    Instant createdAt;

    public boolean hasImage() {
        return imageData != null && !imageData.isEmpty();
    }
}

package org.proxima.messaging;

import lombok.extern.slf4j.Slf4j;
import org.proxima.config.ProximaConfig;
import org.proxima.core.error.MessagePersistenceException;
import org.proxima.core.error.NotFoundException;
import org.proxima.core.error.ValidationException;
import org.proxima.presence.PresenceRegistry;
import org.proxima.realtime.PublishResult;
import org.proxima.realtime.RoomRouter;
import org.proxima.realtime.Rooms;
import org.proxima.store.MessageStore;
import org.proxima.store.UserDirectory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Validates, persists and then fans out outbound messages.
 * <p>
 * Ordering contract: a message reaches live subscribers only after the external store
 * accepted it. A store failure surfaces as {@link MessagePersistenceException} and nothing
 * is published.
 * </p>
 */
@Slf4j
public final class MessageDispatcher {
    public static final String REASON_SENDER_REQUIRED = "MSG_SENDER_REQUIRED";
    public static final String REASON_RECIPIENTS_REQUIRED = "MSG_RECIPIENTS_REQUIRED";
    public static final String REASON_RECIPIENT_ID_BLANK = "MSG_RECIPIENT_ID_BLANK";
    public static final String REASON_CONTENT_REQUIRED = "MSG_CONTENT_REQUIRED";
    public static final String REASON_CONTENT_TOO_LONG = "MSG_CONTENT_TOO_LONG";
    public static final String REASON_UNKNOWN_RECIPIENT = "MSG_UNKNOWN_RECIPIENT";
    public static final String REASON_PERSIST_FAILED = "MSG_PERSIST_FAILED";

    private final UserDirectory userDirectory;
    private final MessageStore messageStore;
    private final RoomRouter roomRouter;
    private final PresenceRegistry presenceRegistry;
    private final Clock clock;
    private final int maxMessageLength;
    private final Supplier<String> idGenerator;

    public MessageDispatcher(
            UserDirectory userDirectory,
            MessageStore messageStore,
            RoomRouter roomRouter,
            PresenceRegistry presenceRegistry,
            Clock clock,
            ProximaConfig config
    ) {
        this(userDirectory, messageStore, roomRouter, presenceRegistry, clock, config,
                () -> UUID.randomUUID().toString());
    }

    MessageDispatcher(
            UserDirectory userDirectory,
            MessageStore messageStore,
            RoomRouter roomRouter,
            PresenceRegistry presenceRegistry,
            Clock clock,
            ProximaConfig config,
            Supplier<String> idGenerator
    ) {
        this.userDirectory = Objects.requireNonNull(userDirectory, "userDirectory");
        this.messageStore = Objects.requireNonNull(messageStore, "messageStore");
        this.roomRouter = Objects.requireNonNull(roomRouter, "roomRouter");
        this.presenceRegistry = Objects.requireNonNull(presenceRegistry, "presenceRegistry");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxMessageLength = Objects.requireNonNull(config, "config").validate().getMaxMessageLength();
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    /**
     * Sends a message.
     *
     * @param senderId authenticated sender.
     * @param recipientIds non-empty recipients; duplicates collapse, order is kept.
     * @param content text body; may be blank only when an image is attached.
     * @param imageData optional base64 image, null when absent.
     * @return id of the persisted message.
     * @throws ValidationException for a missing sender, empty recipients or missing content.
     * @throws NotFoundException when a recipient is not a known user.
     * @throws MessagePersistenceException when the external store rejected the message.
     */
    public String send(String senderId, Collection<String> recipientIds, String content, String imageData) {
        OutboundMessage message = buildValidated(senderId, recipientIds, content, imageData);
        for (String recipientId : message.getRecipientIds()) {
            if (!userDirectory.exists(recipientId)) {
                throw new NotFoundException(REASON_UNKNOWN_RECIPIENT, "Unknown recipient: " + recipientId);
            }
        }

        String persistedId;
        try {
            persistedId = messageStore.persist(message);
        } catch (RuntimeException ex) {
            throw new MessagePersistenceException(
                    REASON_PERSIST_FAILED,
                    "Message " + message.getMessageId() + " could not be persisted: " + ex.getMessage(),
                    ex);
        }
        if (persistedId == null || persistedId.isBlank()) {
            throw new MessagePersistenceException(
                    REASON_PERSIST_FAILED,
                    "Message store returned no id for " + message.getMessageId(),
                    null);
        }

        presenceRegistry.touch(message.getSenderId(), message.getCreatedAt());
        PublishResult result = roomRouter.publish(Rooms.MESSAGES, MessageEvent.of(persistedId, message));
        log.info("Message {} from {} to {} recipient(s) fanned out: {}",
                persistedId, message.getSenderId(), message.getRecipientIds().size(), result);
        return persistedId;
    }

    private OutboundMessage buildValidated(
            String senderId,
            Collection<String> recipientIds,
            String content,
            String imageData
    ) {
        if (senderId == null || senderId.isBlank()) {
            throw new ValidationException(REASON_SENDER_REQUIRED, "senderId is required");
        }
        if (recipientIds == null || recipientIds.isEmpty()) {
            throw new ValidationException(REASON_RECIPIENTS_REQUIRED, "recipientIds must be non-empty");
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String recipientId : recipientIds) {
            if (recipientId == null || recipientId.isBlank()) {
                throw new ValidationException(REASON_RECIPIENT_ID_BLANK, "recipientIds must not contain blank ids");
            }
            distinct.add(recipientId);
        }
        boolean hasImage = imageData != null && !imageData.isEmpty();
        if (content == null || (content.isBlank() && !hasImage)) {
            throw new ValidationException(REASON_CONTENT_REQUIRED, "content is required unless an image is attached");
        }
        if (content.length() > maxMessageLength) {
            throw new ValidationException(
                    REASON_CONTENT_TOO_LONG,
                    "content exceeds " + maxMessageLength + " characters");
        }

        Instant now = clock.instant();
        return OutboundMessage.builder()
                .messageId(idGenerator.get())
                .senderId(senderId)
                .recipientIds(distinct)
                .content(content)
                .imageData(hasImage ? imageData : null)
                .createdAt(now)
                .build();
    }
}

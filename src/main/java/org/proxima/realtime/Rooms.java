package org.proxima.realtime;

import lombok.experimental.UtilityClass;
import org.proxima.core.error.ValidationException;

import java.util.Objects;
import java.util.Optional;

/**
 * Room naming scheme.
 * <ul>
 * <li>{@value #MESSAGES}: global room every connection joins on connect.</li>
 * <li>{@code location_updates_{userId}}: per-user location channel.</li>
 * </ul>
 */
@UtilityClass
public class Rooms {
    public static final String MESSAGES = "messages";
    public static final String LOCATION_PREFIX = "location_updates_";

    public static final String REASON_UNKNOWN_ROOM = "ROOM_UNKNOWN_ROOM";

    /**
     * Location room name of a user.
     */
    public static String locationRoom(String userId) {
        Objects.requireNonNull(userId, "userId");
        if (userId.isBlank()) {
            throw new ValidationException(REASON_UNKNOWN_ROOM, "userId must be non-blank");
        }
        return LOCATION_PREFIX + userId;
    }

    /**
     * Owner user id of a location room, empty for any other room name.
     */
    public static Optional<String> locationRoomOwner(String roomId) {
        if (roomId == null || !roomId.startsWith(LOCATION_PREFIX) || roomId.length() == LOCATION_PREFIX.length()) {
            return Optional.empty();
        }
        return Optional.of(roomId.substring(LOCATION_PREFIX.length()));
    }

    /**
     * Rejects room names outside the naming scheme.
     *
     * @return the room id.
     */
    public static String requireKnown(String roomId) {
        if (MESSAGES.equals(roomId) || locationRoomOwner(roomId).isPresent()) {
            return roomId;
        }
        throw new ValidationException(REASON_UNKNOWN_ROOM, "Unknown room: " + roomId);
    }
}

package org.proxima.core;

import org.proxima.proximity.NearbyUser;
import org.proxima.realtime.ConnectionOutbox;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Caller-facing contract of the proximity and fan-out core.
 *
 * <p>Identities passed in are trusted: authentication happens upstream.</p>
 */
public interface ProximaService {

    /**
     * Records the caller's position at the current instant.
     *
     * @return true if applied, false if dropped as stale.
     */
    boolean updateLocation(String userId, double latitude, double longitude);

    /**
     * Records the caller's position as of a client-reported instant.
     *
     * @return true if applied, false if the stored position is newer than {@code at}.
     */
    boolean updateLocation(String userId, double latitude, double longitude, Instant at);

    /**
     * Active users within {@code radiusMiles} of a point, nearest first.
     */
    List<NearbyUser> findNearby(String requesterId, double latitude, double longitude, double radiusMiles);

    /**
     * Persists then fans out a message.
     *
     * @return persisted message id.
     */
    String sendMessage(String senderId, Collection<String> recipientIds, String content, String imageData);

    /**
     * Registers an anonymous transport session.
     */
    ConnectionOutbox onConnect(String connectionId);

    /**
     * Registers a transport session bound to an authenticated user.
     */
    ConnectionOutbox onConnect(String connectionId, String userId);

    /**
     * Tears a transport session down.
     *
     * @return true if the session was live.
     */
    boolean onDisconnect(String connectionId);

    boolean joinRoom(String connectionId, String roomId);

    boolean leaveRoom(String connectionId, String roomId);

    /**
     * Outbound events of a live session.
     */
    ConnectionOutbox eventStream(String connectionId);

    /**
     * Lets {@code viewerId} follow {@code ownerId}'s location room.
     */
    boolean grantLocationAccess(String ownerId, String viewerId);

    /**
     * Withdraws a grant and evicts the viewer's current subscriptions.
     */
    boolean revokeLocationAccess(String ownerId, String viewerId);
}

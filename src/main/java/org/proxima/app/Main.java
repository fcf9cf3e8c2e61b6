package org.proxima.app;

import lombok.extern.slf4j.Slf4j;
import org.proxima.core.ProximaCore;
import org.proxima.proximity.NearbyUser;
import org.proxima.realtime.ConnectionOutbox;
import org.proxima.realtime.RoomEvent;
import org.proxima.store.InMemoryLocationStore;
import org.proxima.store.InMemoryMessageStore;
import org.proxima.store.InMemoryUserDirectory;

import java.util.List;
import java.util.Locale;

/**
 * Minimal application entry point used for local smoke runs.
 *
 * <p>Wires a core over in-memory stores, places two users in San Francisco, runs one
 * nearby query and one message send, and prints what a connected client would see.</p>
 */
@Slf4j
public class Main {
    /**
     * Launches the smoke routine.
     *
     * @param args command-line arguments (unused).
     */
    public static void main(String[] args) {
        ProximaCore core = ProximaCore.builder()
                .userDirectory(new InMemoryUserDirectory(List.of("alice", "bob")))
                .messageStore(new InMemoryMessageStore())
                .locationStore(new InMemoryLocationStore())
                .build();

        ConnectionOutbox bobStream = core.onConnect("conn-bob", "bob");
        core.updateLocation("alice", 37.7749, -122.4194);
        core.updateLocation("bob", 37.7849, -122.4094);

        List<NearbyUser> nearby = core.findNearby("alice", 37.7749, -122.4194, 2.0);
        System.out.println("Nearby alice: " + nearby.size());
        for (NearbyUser user : nearby) {
            System.out.printf(Locale.ROOT, "  %s %.2f mi%n", user.getUserId(), user.getDistanceMiles());
        }

        String messageId = core.sendMessage("alice", List.of("bob"), "hello from the corner", null);
        System.out.println("Sent message " + messageId);
        for (RoomEvent event : bobStream.drain(16)) {
            System.out.println("conn-bob <- " + event.eventName() + " @" + event.getRoomId());
        }

        core.onDisconnect("conn-bob");
        log.info("Smoke run finished: {}", core.roomRouter().telemetry());
    }
}

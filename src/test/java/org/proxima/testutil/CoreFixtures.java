package org.proxima.testutil;

import org.proxima.config.ProximaConfig;
import org.proxima.core.ProximaCore;
import org.proxima.store.InMemoryLocationStore;
import org.proxima.store.InMemoryMessageStore;
import org.proxima.store.InMemoryUserDirectory;

import java.util.List;

/**
 * Shared wiring for facade-level tests.
 */
public final class CoreFixtures {
    public static final double SF_LAT = 37.7749;
    public static final double SF_LON = -122.4194;
    public static final double SF_NEAR_LAT = 37.7849;
    public static final double SF_NEAR_LON = -122.4094;

    private CoreFixtures() {
    }

    /**
     * Core over in-memory stores with the given users registered.
     */
    public record Fixture(
            ProximaCore core,
            MutableClock clock,
            InMemoryUserDirectory users,
            InMemoryMessageStore messages,
            InMemoryLocationStore locations
    ) {}

    public static Fixture create(String... userIds) {
        return create(ProximaConfig.defaults(), userIds);
    }

    public static Fixture create(ProximaConfig config, String... userIds) {
        MutableClock clock = MutableClock.at("2024-05-01T12:00:00Z");
        InMemoryUserDirectory users = new InMemoryUserDirectory(List.of(userIds));
        InMemoryMessageStore messages = new InMemoryMessageStore();
        InMemoryLocationStore locations = new InMemoryLocationStore();
        ProximaCore core = ProximaCore.builder()
                .config(config)
                .clock(clock)
                .userDirectory(users)
                .messageStore(messages)
                .locationStore(locations)
                .build();
        return new Fixture(core, clock, users, messages, locations);
    }
}

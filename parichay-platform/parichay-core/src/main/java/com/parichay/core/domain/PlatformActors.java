package com.parichay.core.domain;

import java.util.UUID;

/**
 * Reserved identities used when the platform itself acts.
 */
public final class PlatformActors {

    /** Actor recorded for sweeps and automatic escalation. */
    public static final UUID SYSTEM = new UUID(0L, 0L);

    /** Blocker identity of platform-wide bans. */
    public static final UUID PLATFORM = new UUID(0L, 1L);

    private PlatformActors() {}

    public static boolean isReserved(UUID id) {
        return SYSTEM.equals(id) || PLATFORM.equals(id);
    }
}

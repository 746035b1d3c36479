package com.questrail.ccremote.time;

import java.time.Instant;

/**
 * Production {@link WallClock} backed by {@link Instant#now()}.
 *
 * <p>Thread-safe.</p>
 */
public enum SystemWallClock implements WallClock {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}

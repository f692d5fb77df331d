package com.questrail.uprotocol.time;

import java.time.Instant;

/**
 * SystemWallClock
 * =============================================================================
 * Production {@link WallClock} backed by the system clock.
 *
 * <h2>Thread Safety</h2>
 * <p>Thread-safe; {@link System#currentTimeMillis()} and {@link Instant#now()}
 * are safe for concurrent access.</p>
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

    @Override
    public long nowMillis() {
        return System.currentTimeMillis();
    }
}

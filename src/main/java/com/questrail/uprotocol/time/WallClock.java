package com.questrail.uprotocol.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock time source.
 *
 * <p>
 * Used for identifier timestamps and for observability event timestamps. The
 * clock may jump (NTP, manual adjustment); identifier generation tolerates this
 * because its counter only depends on timestamp equality.
 * </p>
 *
 * <p>Tests inject a manual implementation to make time deterministic.</p>
 */
@FunctionalInterface
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();

    /**
     * Returns the current time in milliseconds since the Unix epoch.
     */
    default long nowMillis() {
        return now().toEpochMilli();
    }
}

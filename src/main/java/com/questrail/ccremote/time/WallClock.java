package com.questrail.ccremote.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used to timestamp message log entries.
 *
 * <p>
 * This clock may jump due to DST, NTP adjustments, or explicit time setting.
 * Entries are ordered by insertion, never by timestamp.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}

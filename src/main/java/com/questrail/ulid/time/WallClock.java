package com.questrail.ulid.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Source of the instant written into the time part of new ULIDs.
 *
 * <p>
 * A wall clock may jump due to NTP adjustments or explicit time setting.
 * Consumers that need strictly increasing identifiers must tolerate a clock
 * that moves backwards (see {@code MonotonicUlidGenerator}).
 * </p>
 */
@FunctionalInterface
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}

package com.questrail.ulid.time;

import java.time.Instant;

/**
 * SystemWallClock
 * =============================================================================
 * Production {@link WallClock} implementation backed by {@link Instant#now()}.
 *
 * <h2>Thread Safety</h2>
 * <p>This implementation is thread-safe. {@link Instant#now()} is inherently
 * safe for concurrent access.</p>
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

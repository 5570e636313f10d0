package com.questrail.ulid.rng;

import com.questrail.ulid.api.UlidRng;

import java.util.concurrent.ThreadLocalRandom;

/**
 * SimpleUlidRng
 * -----------------------------------------------------------------------------
 * Fast {@link UlidRng} backed by {@link ThreadLocalRandom}.
 *
 * <p><strong>Not cryptographically strong.</strong> Suitable where ULIDs only
 * need to be unique and sortable, not unguessable (test data, log correlation).</p>
 */
public enum SimpleUlidRng implements UlidRng
{
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public byte[] getRandomBytes(int count) {
        final byte[] out = new byte[RngArguments.requireCount(count)];
        ThreadLocalRandom.current().nextBytes(out);
        return out;
    }
}

package com.questrail.ulid.rng;

import com.questrail.ulid.api.UlidRng;

import java.security.SecureRandom;
import java.util.Objects;

/**
 * SecureUlidRng
 * -----------------------------------------------------------------------------
 * Default {@link UlidRng} backed by {@link SecureRandom}.
 *
 * <h2>Thread Safety</h2>
 * <p>{@link SecureRandom} is safe for concurrent use, so a single instance may
 * be shared process-wide.</p>
 */
public final class SecureUlidRng implements UlidRng
{
    private final SecureRandom random;

    public SecureUlidRng() {
        this(new SecureRandom());
    }

    public SecureUlidRng(SecureRandom random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public byte[] getRandomBytes(int count) {
        final byte[] out = new byte[RngArguments.requireCount(count)];
        random.nextBytes(out);
        return out;
    }

    @Override
    public String toString() {
        return "SecureUlidRng[" + random.getAlgorithm() + "]";
    }
}

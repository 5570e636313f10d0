package com.questrail.ulid.api;

/**
 * UlidRng
 * -----------------------------------------------------------------------------
 * Entropy source consulted once per ULID construction.
 *
 * <p>Implementations must return a fresh array of exactly {@code count}
 * bytes. Any exception thrown here is propagated unmodified to the caller of
 * {@link Ulid#newUlid(java.time.Instant, UlidRng)}.</p>
 *
 * <p>Thread safety is the implementation's responsibility: {@link Ulid}
 * itself never synchronizes around calls to this interface.</p>
 */
@FunctionalInterface
public interface UlidRng
{
    /**
     * Returns {@code count} random bytes.
     *
     * @param count number of bytes requested (never negative)
     * @return a new array of length {@code count}
     */
    byte[] getRandomBytes(int count);
}

package com.questrail.ulid.generator;

import com.questrail.ulid.api.Ulid;
import com.questrail.ulid.api.UlidErrorKind;
import com.questrail.ulid.api.UlidException;
import com.questrail.ulid.api.UlidRng;
import com.questrail.ulid.observability.ClockRegressionEvent;
import com.questrail.ulid.observability.RandomOverflowEvent;
import com.questrail.ulid.observability.UlidObservabilitySink;
import com.questrail.ulid.time.WallClock;

import java.time.Instant;
import java.util.Objects;

/**
 * MonotonicUlidGenerator
 * =============================================================================
 * Issues ULIDs that are strictly increasing for the lifetime of the instance.
 *
 * <h2>Algorithm</h2>
 * <ul>
 *   <li>If the clock reads a later millisecond than the last issued value, a
 *       fresh random part is drawn from the configured {@link UlidRng}.</li>
 *   <li>Otherwise the last time part is reused and the previous random part
 *       is incremented by one, treated as an unsigned 80-bit big-endian
 *       integer.</li>
 * </ul>
 *
 * <p>A clock that moves backwards never moves the time part backwards; the
 * regression is reported to the {@link UlidObservabilitySink} and generation
 * continues from the last issued time. When the random part is already at its
 * maximum the overflow is reported and {@link #next()} fails with
 * {@link UlidErrorKind#RANDOM_OVERFLOW} until the clock advances.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>{@link #next()} is synchronized; one instance may be shared.</p>
 */
public final class MonotonicUlidGenerator
{
    private final WallClock clock;
    private final UlidRng rng;
    private final UlidObservabilitySink sink;

    private long lastMillis = -1L;
    private byte[] lastRandom;

    public MonotonicUlidGenerator() {
        this(UlidGeneratorConfig.defaults());
    }

    public MonotonicUlidGenerator(UlidGeneratorConfig config) {
        Objects.requireNonNull(config, "config");
        this.clock = config.clock();
        this.rng = config.rng();
        this.sink = config.observabilitySink();
    }

    /**
     * Returns a ULID greater than every ULID previously returned by this instance.
     *
     * @throws UlidException {@link UlidErrorKind#INVALID_TIMESTAMP} if the first
     *         reading of the clock is out of range;
     *         {@link UlidErrorKind#RANDOM_OVERFLOW} if the current millisecond
     *         is exhausted
     */
    public synchronized Ulid next() {
        final Instant now = Objects.requireNonNull(clock.now(), "clock.now()");

        if (lastRandom == null || !now.isBefore(lastIssuedTime().plusMillis(1))) {
            final Ulid fresh = Ulid.newUlid(now, rng);
            lastMillis = fresh.timeMillis();
            lastRandom = fresh.random();
            return fresh;
        }

        final Instant issuedTime = lastIssuedTime();
        if (now.isBefore(issuedTime)) {
            sink.onClockRegression(new ClockRegressionEvent(issuedTime, now));
        }

        final byte[] incremented = lastRandom.clone();
        if (!increment(incremented)) {
            sink.onRandomOverflow(new RandomOverflowEvent(issuedTime));
            throw new UlidException(UlidErrorKind.RANDOM_OVERFLOW,
                    "Random part exhausted for " + issuedTime);
        }

        lastRandom = incremented;
        return Ulid.of(issuedTime, incremented);
    }

    private Instant lastIssuedTime() {
        return Instant.ofEpochMilli(lastMillis);
    }

    /* Adds one in place; returns false (array unchanged) if every byte is 0xFF. */
    private static boolean increment(byte[] value) {
        for (int i = value.length - 1; i >= 0; i--) {
            if (value[i] != (byte) 0xFF) {
                value[i]++;
                for (int j = i + 1; j < value.length; j++) {
                    value[j] = 0;
                }
                return true;
            }
        }
        return false;
    }
}

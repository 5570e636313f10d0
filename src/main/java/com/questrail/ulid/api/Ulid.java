package com.questrail.ulid.api;

import com.questrail.ulid.codec.Base32Codec;
import com.questrail.ulid.codec.UlidBinaryCodec;
import com.questrail.ulid.rng.SecureUlidRng;
import com.questrail.ulid.time.SystemWallClock;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Ulid
 * -----------------------------------------------------------------------------
 * Universally unique, lexicographically sortable identifier.
 *
 * <h2>Layout</h2>
 * <ul>
 *   <li>time: 48-bit unsigned milliseconds since {@link #EPOCH}, big-endian</li>
 *   <li>random: 80 bits of entropy</li>
 * </ul>
 *
 * <p>The binary form is 16 bytes (time then random). The text form is 26
 * characters from {@link Base32Codec#ALPHABET}: 10 for the time part followed
 * by 16 for the random part. The GUID/UUID form uses the same 16 bytes in the
 * same order.</p>
 *
 * <h2>Ordering</h2>
 * <p>Values order by time, then by the random part compared as unsigned bytes
 * from left to right. Because both text blocks are fixed length and the
 * alphabet is in ASCII order, comparing {@link #toString()} values gives the
 * same result as {@link #compareTo(Ulid)}.</p>
 *
 * <h2>Immutability</h2>
 * <p>Instances own their buffers. Accessors returning arrays return copies,
 * and factories copy their inputs, so no caller can observe or cause a change
 * in an existing value. Instances are safe to share between threads.</p>
 */
public final class Ulid implements Comparable<Ulid>
{
    /** Length of the binary form. */
    public static final int LENGTH = UlidBinaryCodec.LENGTH;

    /** Length of the time part. */
    public static final int TIME_LENGTH = UlidBinaryCodec.TIME_LENGTH;

    /** Length of the random part. */
    public static final int RANDOM_LENGTH = UlidBinaryCodec.RANDOM_LENGTH;

    /** Length of the text form. */
    public static final int TEXT_LENGTH = Base32Codec.TIME_TEXT_LENGTH + Base32Codec.RANDOM_TEXT_LENGTH;

    /** Zero point of the time part. */
    public static final Instant EPOCH = Instant.EPOCH;

    /** Latest instant the time part can hold (2^48 - 1 ms after the epoch). */
    public static final Instant MAX_TIME = Instant.ofEpochMilli(UlidBinaryCodec.MAX_TIME_MILLIS);

    private static final UlidRng DEFAULT_RNG = new SecureUlidRng();

    /** Epoch time and an all-zero random part. */
    public static final Ulid EMPTY = new Ulid(
            UlidBinaryCodec.encodeTime(0L),
            new byte[RANDOM_LENGTH]);

    /** Maximum time and an all-0xFF random part; compares greater than or equal to every value. */
    public static final Ulid MAX_VALUE = new Ulid(
            UlidBinaryCodec.encodeTime(UlidBinaryCodec.MAX_TIME_MILLIS),
            filled(RANDOM_LENGTH, (byte) 0xFF));

    private final byte[] time;
    private final byte[] random;

    /* Arguments are owned by the new instance; callers pass fresh arrays only. */
    private Ulid(byte[] time, byte[] random) {
        this.time = time;
        this.random = random;
    }

    // -------------------------------------------------------------------------
    // Construction
    // -------------------------------------------------------------------------

    /**
     * Creates a ULID for the current wall-clock time using the default
     * cryptographically strong entropy source.
     */
    public static Ulid newUlid() {
        return newUlid(SystemWallClock.INSTANCE.now(), DEFAULT_RNG);
    }

    /**
     * Creates a ULID for {@code time} using the default entropy source.
     */
    public static Ulid newUlid(Instant time) {
        return newUlid(time, DEFAULT_RNG);
    }

    /**
     * Creates a ULID for the current wall-clock time using {@code rng}.
     */
    public static Ulid newUlid(UlidRng rng) {
        return newUlid(SystemWallClock.INSTANCE.now(), rng);
    }

    /**
     * Creates a ULID for {@code time}, drawing exactly {@value #RANDOM_LENGTH}
     * bytes from {@code rng}.
     *
     * <p>Exceptions thrown by {@code rng} propagate unchanged.</p>
     *
     * @throws UlidException {@link UlidErrorKind#INVALID_TIMESTAMP} if {@code time}
     *         lies outside [{@link #EPOCH}, {@link #MAX_TIME}];
     *         {@link UlidErrorKind#INVALID_RANDOM_LENGTH} if {@code rng} returns
     *         the wrong number of bytes
     */
    public static Ulid newUlid(Instant time, UlidRng rng) {
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(rng, "rng");
        requireTimeInRange(time);
        return of(time, rng.getRandomBytes(RANDOM_LENGTH));
    }

    /**
     * Creates a ULID from an explicit time and random part.
     *
     * @param time   instant in [{@link #EPOCH}, {@link #MAX_TIME}]; sub-millisecond
     *               precision is discarded
     * @param random exactly {@value #RANDOM_LENGTH} bytes (copied)
     * @throws UlidException {@link UlidErrorKind#INVALID_TIMESTAMP} or
     *         {@link UlidErrorKind#INVALID_RANDOM_LENGTH}
     */
    public static Ulid of(Instant time, byte[] random) {
        Objects.requireNonNull(time, "time");
        requireTimeInRange(time);
        if (random == null || random.length != RANDOM_LENGTH) {
            throw new UlidException(UlidErrorKind.INVALID_RANDOM_LENGTH,
                    "Random part requires " + RANDOM_LENGTH + " bytes (was "
                            + (random == null ? "null" : random.length) + ")");
        }
        return new Ulid(UlidBinaryCodec.encodeTime(time), random.clone());
    }

    /**
     * Wraps a 16-byte binary form (copied).
     *
     * @throws UlidException {@link UlidErrorKind#INVALID_LENGTH} unless exactly 16 bytes
     */
    public static Ulid fromBytes(byte[] bytes) {
        return new Ulid(UlidBinaryCodec.timePart(bytes), UlidBinaryCodec.randomPart(bytes));
    }

    /**
     * Wraps a GUID-compatible 16-byte value. The bytes are taken in the order
     * given; no field is byte-swapped.
     *
     * @throws UlidException {@link UlidErrorKind#INVALID_LENGTH} unless exactly 16 bytes
     */
    public static Ulid fromGuidBytes(byte[] guid) {
        return fromBytes(guid);
    }

    /**
     * Converts a {@link UUID}: the most significant long supplies bytes 0..7
     * and the least significant long bytes 8..15.
     */
    public static Ulid fromUuid(UUID uuid) {
        Objects.requireNonNull(uuid, "uuid");
        return fromBytes(ByteBuffer.allocate(LENGTH)
                .putLong(uuid.getMostSignificantBits())
                .putLong(uuid.getLeastSignificantBits())
                .array());
    }

    // -------------------------------------------------------------------------
    // Parsing
    // -------------------------------------------------------------------------

    /**
     * Parses the 26-character text form. Input is case-insensitive.
     *
     * @throws UlidException {@link UlidErrorKind#INVALID_INPUT} for null or empty
     *         text; {@link UlidErrorKind#INVALID_LENGTH} unless 26 characters;
     *         {@link UlidErrorKind#INVALID_CHARACTER} for a symbol outside the
     *         alphabet
     */
    public static Ulid parse(CharSequence text) {
        if (text == null || text.length() == 0) {
            throw new UlidException(UlidErrorKind.INVALID_INPUT, "ULID text must not be null or empty");
        }
        if (text.length() != TEXT_LENGTH) {
            throw new UlidException(UlidErrorKind.INVALID_LENGTH,
                    "ULID text requires " + TEXT_LENGTH + " characters (was " + text.length() + ")");
        }
        if (!Base32Codec.isValid(text)) {
            throw new UlidException(UlidErrorKind.INVALID_CHARACTER,
                    "ULID text contains a character outside the base32 alphabet: " + text);
        }

        final byte[] t = Base32Codec.decode(text.subSequence(0, Base32Codec.TIME_TEXT_LENGTH));
        final byte[] r = Base32Codec.decode(text.subSequence(Base32Codec.TIME_TEXT_LENGTH, TEXT_LENGTH));
        return new Ulid(t, r);
    }

    /**
     * Parses the text form without throwing.
     *
     * @return the parsed value, or {@link Optional#empty()} on any parse failure;
     *         {@code tryParse(s).orElse(Ulid.EMPTY)} yields the sentinel form
     */
    public static Optional<Ulid> tryParse(CharSequence text) {
        try {
            return Optional.of(parse(text));
        }
        catch (UlidException e) {
            return Optional.empty();
        }
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    /**
     * Returns the time part as an instant with millisecond resolution (UTC).
     */
    public Instant time() {
        return UlidBinaryCodec.decodeTime(time);
    }

    /**
     * Returns the time part as milliseconds since {@link #EPOCH}.
     */
    public long timeMillis() {
        return UlidBinaryCodec.decodeTimeMillis(time);
    }

    /**
     * Returns a copy of the random part.
     */
    public byte[] random() {
        return random.clone();
    }

    /**
     * Returns a new 16-byte array holding the time part followed by the random part.
     */
    public byte[] toBytes() {
        return UlidBinaryCodec.join(time, random);
    }

    /**
     * Returns the GUID-compatible byte form, identical to {@link #toBytes()}.
     */
    public byte[] toGuidBytes() {
        return toBytes();
    }

    /**
     * Returns this value as a {@link UUID} over the same 16 bytes.
     */
    public UUID toUuid() {
        final ByteBuffer buf = ByteBuffer.wrap(toBytes());
        return new UUID(buf.getLong(), buf.getLong());
    }

    /**
     * Returns the 26-character, upper-case text form.
     */
    @Override
    public String toString() {
        return Base32Codec.encode(time) + Base32Codec.encode(random);
    }

    // -------------------------------------------------------------------------
    // Identity & ordering
    // -------------------------------------------------------------------------

    @Override
    public int compareTo(Ulid other) {
        Objects.requireNonNull(other, "other");
        // Fixed-width big-endian: unsigned byte order is numeric order.
        final int byTime = Arrays.compareUnsigned(time, other.time);
        if (byTime != 0) {
            return byTime;
        }
        return Arrays.compareUnsigned(random, other.random);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Ulid that)) return false;
        return Arrays.equals(time, that.time) && Arrays.equals(random, that.random);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(time) + Arrays.hashCode(random);
    }

    private static void requireTimeInRange(Instant time) {
        if (time.isBefore(EPOCH)) {
            throw new UlidException(UlidErrorKind.INVALID_TIMESTAMP,
                    "ULID time must not precede " + EPOCH + " (was " + time + ")");
        }
        if (!time.isBefore(MAX_TIME.plusMillis(1))) {
            throw new UlidException(UlidErrorKind.INVALID_TIMESTAMP,
                    "ULID time must not exceed " + MAX_TIME + " (was " + time + ")");
        }
    }

    private static byte[] filled(int length, byte value) {
        final byte[] out = new byte[length];
        Arrays.fill(out, value);
        return out;
    }
}

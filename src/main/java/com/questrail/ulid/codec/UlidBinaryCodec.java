package com.questrail.ulid.codec;

import com.questrail.ulid.api.UlidErrorKind;
import com.questrail.ulid.api.UlidException;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * UlidBinaryCodec
 * -----------------------------------------------------------------------------
 * Fixed 16-byte ULID layout:
 *
 * <pre>
 *   byte 0..5  : time   (unsigned 48-bit milliseconds since 1970-01-01Z, big-endian)
 *   byte 6..15 : random (opaque)
 * </pre>
 *
 * <p>Every method returns a newly allocated array. Nothing here retains or
 * aliases caller buffers.</p>
 */
public final class UlidBinaryCodec
{
    /** Total encoded length. */
    public static final int LENGTH = 16;

    /** Length of the time part. */
    public static final int TIME_LENGTH = 6;

    /** Length of the random part. */
    public static final int RANDOM_LENGTH = 10;

    /** Largest millisecond offset representable in the time part. */
    public static final long MAX_TIME_MILLIS = 0xFFFF_FFFF_FFFFL;

    private UlidBinaryCodec() {}

    /**
     * Encodes the epoch-millisecond value of {@code time}.
     *
     * <p>Only the low 48 bits are kept; range checking is the caller's concern.</p>
     */
    public static byte[] encodeTime(Instant time)
    {
        Objects.requireNonNull(time, "time");
        return encodeTime(time.toEpochMilli());
    }

    /**
     * Encodes the low 48 bits of {@code millis}, most significant byte first.
     */
    public static byte[] encodeTime(long millis)
    {
        final byte[] out = new byte[TIME_LENGTH];
        for (int i = TIME_LENGTH - 1; i >= 0; i--) {
            out[i] = (byte) (millis & 0xFF);
            millis >>>= 8;
        }
        return out;
    }

    /**
     * Decodes a 6-byte time part into milliseconds, zero-extended to 64 bits.
     *
     * @throws UlidException {@link UlidErrorKind#INVALID_LENGTH} unless exactly 6 bytes
     */
    public static long decodeTimeMillis(byte[] time)
    {
        requireLength(time, TIME_LENGTH, "time part");
        long millis = 0L;
        for (int i = 0; i < TIME_LENGTH; i++) {
            millis = (millis << 8) | (time[i] & 0xFF);
        }
        return millis;
    }

    /**
     * Decodes a 6-byte time part into an {@link Instant} with millisecond resolution.
     */
    public static Instant decodeTime(byte[] time)
    {
        return Instant.ofEpochMilli(decodeTimeMillis(time));
    }

    /**
     * Concatenates the time part and the random part.
     */
    public static byte[] join(byte[] time, byte[] random)
    {
        requireLength(time, TIME_LENGTH, "time part");
        requireLength(random, RANDOM_LENGTH, "random part");

        final byte[] out = new byte[LENGTH];
        System.arraycopy(time, 0, out, 0, TIME_LENGTH);
        System.arraycopy(random, 0, out, TIME_LENGTH, RANDOM_LENGTH);
        return out;
    }

    /**
     * Returns a copy of bytes 0..5 of a 16-byte layout.
     */
    public static byte[] timePart(byte[] bytes)
    {
        requireLength(bytes, LENGTH, "ULID");
        return Arrays.copyOfRange(bytes, 0, TIME_LENGTH);
    }

    /**
     * Returns a copy of bytes 6..15 of a 16-byte layout.
     */
    public static byte[] randomPart(byte[] bytes)
    {
        requireLength(bytes, LENGTH, "ULID");
        return Arrays.copyOfRange(bytes, TIME_LENGTH, LENGTH);
    }

    private static void requireLength(byte[] bytes, int expected, String what)
    {
        Objects.requireNonNull(bytes, what);
        if (bytes.length != expected) {
            throw new UlidException(UlidErrorKind.INVALID_LENGTH,
                    "A " + what + " requires " + expected + " bytes (was " + bytes.length + ")");
        }
    }
}

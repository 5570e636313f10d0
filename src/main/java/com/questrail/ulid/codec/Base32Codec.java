package com.questrail.ulid.codec;

import com.questrail.ulid.api.UlidErrorKind;
import com.questrail.ulid.api.UlidException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Base32Codec
 * -----------------------------------------------------------------------------
 * Base-32 text transform for the two block sizes used by a ULID.
 *
 * <ul>
 *   <li>6-byte time block &harr; 10 characters (48 bits, 2 leading zero bits)</li>
 *   <li>10-byte random block &harr; 16 characters (80 bits, exact fit)</li>
 * </ul>
 *
 * <p>Bits are consumed most significant first in 5-bit groups. Because the
 * 6-byte block does not fall on a 40-bit boundary, every output position has
 * its own shift/mask expression; the tables below are written out per
 * character rather than derived from a generic bit stream so that each
 * position can be checked against a known vector.</p>
 *
 * <p>The alphabet is ordered by ASCII value, so for equal-length blocks the
 * text order equals the unsigned byte order of the input.</p>
 */
public final class Base32Codec
{
    /** Crockford-style alphabet; excludes I, L, O and U. */
    public static final String ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ";

    /** Encoded length of a 6-byte time block. */
    public static final int TIME_TEXT_LENGTH = 10;

    /** Encoded length of a 10-byte random block. */
    public static final int RANDOM_TEXT_LENGTH = 16;

    private static final char[] ENCODE = ALPHABET.toCharArray();

    /* ASCII code point -> 5-bit index, or -1. Lower case maps like upper case. */
    private static final byte[] DECODE = new byte[128];

    static {
        Arrays.fill(DECODE, (byte) -1);
        for (int i = 0; i < ENCODE.length; i++) {
            char c = ENCODE[i];
            DECODE[c] = (byte) i;
            DECODE[Character.toLowerCase(c)] = (byte) i;
        }
    }

    private Base32Codec() {}

    /**
     * Encodes a 6-byte or 10-byte block.
     *
     * @throws UlidException {@link UlidErrorKind#INVALID_LENGTH} for any other size
     */
    public static String encode(byte[] value)
    {
        Objects.requireNonNull(value, "value");
        if (value.length == UlidBinaryCodec.TIME_LENGTH) {
            return new String(encodeTime(value));
        }
        if (value.length == UlidBinaryCodec.RANDOM_LENGTH) {
            return new String(encodeRandom(value));
        }
        throw new UlidException(UlidErrorKind.INVALID_LENGTH,
                "Base32 block must be 6 or 10 bytes (was " + value.length + ")");
    }

    /**
     * Decodes a 10-character or 16-character block.
     *
     * <p>Input is case-insensitive. For the 10-character form the first symbol
     * carries only three significant bits, so anything above {@code '7'} would
     * describe more than 48 bits and is rejected.</p>
     *
     * @throws UlidException {@link UlidErrorKind#INVALID_LENGTH} for any other
     *         length, {@link UlidErrorKind#INVALID_CHARACTER} for a symbol
     *         outside the alphabet
     */
    public static byte[] decode(CharSequence text)
    {
        if (text == null) {
            throw new UlidException(UlidErrorKind.INVALID_INPUT, "Text to decode must not be null");
        }
        final int len = text.length();
        if (len != TIME_TEXT_LENGTH && len != RANDOM_TEXT_LENGTH) {
            throw new UlidException(UlidErrorKind.INVALID_LENGTH,
                    "Base32 block must be 10 or 16 characters (was " + len + ")");
        }

        final int[] ix = indexes(text);

        if (len == TIME_TEXT_LENGTH) {
            if (ix[0] > 7) {
                throw new UlidException(UlidErrorKind.INVALID_CHARACTER,
                        "Time block overflows 48 bits: leading character '" + text.charAt(0) + "'");
            }
            return decodeTime(ix);
        }
        return decodeRandom(ix);
    }

    /**
     * Returns true if every character of {@code text} belongs to the alphabet
     * (either case). Length is not checked.
     */
    public static boolean isValid(CharSequence text)
    {
        if (text == null) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (indexOf(text.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }

    static int indexOf(char c)
    {
        return (c < DECODE.length) ? DECODE[c] : -1;
    }

    private static int[] indexes(CharSequence text)
    {
        final int[] ix = new int[text.length()];
        for (int i = 0; i < ix.length; i++) {
            final char c = text.charAt(i);
            final int v = indexOf(c);
            if (v < 0) {
                throw new UlidException(UlidErrorKind.INVALID_CHARACTER,
                        "Invalid base32 character '" + c + "' at index " + i);
            }
            ix[i] = v;
        }
        return ix;
    }

    private static char[] encodeTime(byte[] value)
    {
        final int b0 = value[0] & 0xFF;
        final int b1 = value[1] & 0xFF;
        final int b2 = value[2] & 0xFF;
        final int b3 = value[3] & 0xFF;
        final int b4 = value[4] & 0xFF;
        final int b5 = value[5] & 0xFF;

        return new char[] {
                /* 0 */ ENCODE[(b0 & 0xE0) >>> 5],
                /* 1 */ ENCODE[b0 & 0x1F],
                /* 2 */ ENCODE[(b1 & 0xF8) >>> 3],
                /* 3 */ ENCODE[((b1 & 0x07) << 2) | ((b2 & 0xC0) >>> 6)],
                /* 4 */ ENCODE[(b2 & 0x3E) >>> 1],
                /* 5 */ ENCODE[((b2 & 0x01) << 4) | ((b3 & 0xF0) >>> 4)],
                /* 6 */ ENCODE[((b3 & 0x0F) << 1) | ((b4 & 0x80) >>> 7)],
                /* 7 */ ENCODE[(b4 & 0x7C) >>> 2],
                /* 8 */ ENCODE[((b4 & 0x03) << 3) | ((b5 & 0xE0) >>> 5)],
                /* 9 */ ENCODE[b5 & 0x1F],
        };
    }

    private static char[] encodeRandom(byte[] value)
    {
        final int b0 = value[0] & 0xFF;
        final int b1 = value[1] & 0xFF;
        final int b2 = value[2] & 0xFF;
        final int b3 = value[3] & 0xFF;
        final int b4 = value[4] & 0xFF;
        final int b5 = value[5] & 0xFF;
        final int b6 = value[6] & 0xFF;
        final int b7 = value[7] & 0xFF;
        final int b8 = value[8] & 0xFF;
        final int b9 = value[9] & 0xFF;

        return new char[] {
                /* 0  */ ENCODE[(b0 & 0xF8) >>> 3],
                /* 1  */ ENCODE[((b0 & 0x07) << 2) | ((b1 & 0xC0) >>> 6)],
                /* 2  */ ENCODE[(b1 & 0x3E) >>> 1],
                /* 3  */ ENCODE[((b1 & 0x01) << 4) | ((b2 & 0xF0) >>> 4)],
                /* 4  */ ENCODE[((b2 & 0x0F) << 1) | ((b3 & 0x80) >>> 7)],
                /* 5  */ ENCODE[(b3 & 0x7C) >>> 2],
                /* 6  */ ENCODE[((b3 & 0x03) << 3) | ((b4 & 0xE0) >>> 5)],
                /* 7  */ ENCODE[b4 & 0x1F],
                /* 8  */ ENCODE[(b5 & 0xF8) >>> 3],
                /* 9  */ ENCODE[((b5 & 0x07) << 2) | ((b6 & 0xC0) >>> 6)],
                /* 10 */ ENCODE[(b6 & 0x3E) >>> 1],
                /* 11 */ ENCODE[((b6 & 0x01) << 4) | ((b7 & 0xF0) >>> 4)],
                /* 12 */ ENCODE[((b7 & 0x0F) << 1) | ((b8 & 0x80) >>> 7)],
                /* 13 */ ENCODE[(b8 & 0x7C) >>> 2],
                /* 14 */ ENCODE[((b8 & 0x03) << 3) | ((b9 & 0xE0) >>> 5)],
                /* 15 */ ENCODE[b9 & 0x1F],
        };
    }

    private static byte[] decodeTime(int[] ix)
    {
        return new byte[] {
                /* 0 */ (byte) ((ix[0] << 5) | ix[1]),
                /* 1 */ (byte) ((ix[2] << 3) | (ix[3] >>> 2)),
                /* 2 */ (byte) ((ix[3] << 6) | (ix[4] << 1) | (ix[5] >>> 4)),
                /* 3 */ (byte) ((ix[5] << 4) | (ix[6] >>> 1)),
                /* 4 */ (byte) ((ix[6] << 7) | (ix[7] << 2) | (ix[8] >>> 3)),
                /* 5 */ (byte) ((ix[8] << 5) | ix[9]),
        };
    }

    private static byte[] decodeRandom(int[] ix)
    {
        return new byte[] {
                /* 0 */ (byte) ((ix[0] << 3) | (ix[1] >>> 2)),
                /* 1 */ (byte) ((ix[1] << 6) | (ix[2] << 1) | (ix[3] >>> 4)),
                /* 2 */ (byte) ((ix[3] << 4) | (ix[4] >>> 1)),
                /* 3 */ (byte) ((ix[4] << 7) | (ix[5] << 2) | (ix[6] >>> 3)),
                /* 4 */ (byte) ((ix[6] << 5) | ix[7]),
                /* 5 */ (byte) ((ix[8] << 3) | (ix[9] >>> 2)),
                /* 6 */ (byte) ((ix[9] << 6) | (ix[10] << 1) | (ix[11] >>> 4)),
                /* 7 */ (byte) ((ix[11] << 4) | (ix[12] >>> 1)),
                /* 8 */ (byte) ((ix[12] << 7) | (ix[13] << 2) | (ix[14] >>> 3)),
                /* 9 */ (byte) ((ix[14] << 5) | ix[15]),
        };
    }
}

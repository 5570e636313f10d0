package com.questrail.ulid.codec;

import com.questrail.ulid.api.UlidErrorKind;
import com.questrail.ulid.api.UlidException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Base32CodecTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link Base32Codec}.
 *
 * <p>Known vectors pin the per-position shift tables; a single-bit vector per
 * block size catches an off-by-one in any one position that a round trip
 * alone would not.</p>
 */
final class Base32CodecTest
{
    private static final byte[] REFERENCE_TIME = bytes(0x01, 0x56, 0x3E, 0x3A, 0xB5, 0xD3);
    private static final byte[] REFERENCE_RANDOM = bytes(0x04, 0x15, 0x56, 0x9D, 0x5C, 0x2F, 0xA3, 0x10, 0xCF, 0x61);

    @Test
    void encodeTimeReferenceVector()
    {
        assertEquals("01ARZ3NDEK", Base32Codec.encode(REFERENCE_TIME));
    }

    @Test
    void encodeRandomReferenceVector()
    {
        assertEquals("0GAND7AW5YHH1KV1", Base32Codec.encode(REFERENCE_RANDOM));
    }

    @Test
    void decodeRandomReferenceVector()
    {
        byte[] decoded = Base32Codec.decode("TSV4RRFFQ69G5FAV");
        assertArrayEquals(bytes(0xD6, 0x76, 0x4C, 0x61, 0xEF, 0xB9, 0x93, 0x02, 0xBD, 0x5B), decoded);
    }

    @Test
    void encodeSingleBitPositions()
    {
        // 2^39 sits in the third 5-bit group of the 50-bit time block.
        assertEquals("00G0000000", Base32Codec.encode(bytes(0x00, 0x80, 0x00, 0x00, 0x00, 0x00)));
        assertEquals("G000000000000000", Base32Codec.encode(bytes(0x80, 0, 0, 0, 0, 0, 0, 0, 0, 0)));
        assertEquals("0000000000000001", Base32Codec.encode(bytes(0, 0, 0, 0, 0, 0, 0, 0, 0, 0x01)));
    }

    @Test
    void encodeExtremes()
    {
        assertEquals("0000000000", Base32Codec.encode(new byte[6]));
        assertEquals("7ZZZZZZZZZ", Base32Codec.encode(filled(6, 0xFF)));
        assertEquals("ZZZZZZZZZZZZZZZZ", Base32Codec.encode(filled(10, 0xFF)));
    }

    @Test
    void decodeIsCaseInsensitive()
    {
        assertArrayEquals(REFERENCE_TIME, Base32Codec.decode("01arz3ndek"));
        assertArrayEquals(REFERENCE_RANDOM, Base32Codec.decode("0gand7aw5yhh1kv1"));
    }

    @Test
    void decodeInvertsEncodeForRandomBlocks()
    {
        Random random = new Random(42);
        for (int i = 0; i < 200; i++) {
            byte[] time = new byte[6];
            byte[] rnd = new byte[10];
            random.nextBytes(time);
            random.nextBytes(rnd);

            assertArrayEquals(time, Base32Codec.decode(Base32Codec.encode(time)));
            assertArrayEquals(rnd, Base32Codec.decode(Base32Codec.encode(rnd)));
        }
    }

    @Test
    void textOrderMatchesUnsignedByteOrder()
    {
        Random random = new Random(7);
        for (int i = 0; i < 200; i++) {
            byte[] a = new byte[10];
            byte[] b = new byte[10];
            random.nextBytes(a);
            random.nextBytes(b);

            int byBytes = Integer.signum(Arrays.compareUnsigned(a, b));
            int byText = Integer.signum(Base32Codec.encode(a).compareTo(Base32Codec.encode(b)));
            assertEquals(byBytes, byText);
        }
    }

    @Test
    void encodeRejectsUnsupportedBlockSize()
    {
        UlidException e = assertThrows(UlidException.class, () -> Base32Codec.encode(new byte[5]));
        assertEquals(UlidErrorKind.INVALID_LENGTH, e.kind());
        assertThrows(UlidException.class, () -> Base32Codec.encode(new byte[16]));
    }

    @Test
    void decodeRejectsUnsupportedLength()
    {
        UlidException e = assertThrows(UlidException.class, () -> Base32Codec.decode("0123456789A"));
        assertEquals(UlidErrorKind.INVALID_LENGTH, e.kind());
        assertEquals(UlidErrorKind.INVALID_LENGTH,
                assertThrows(UlidException.class, () -> Base32Codec.decode("")).kind());
    }

    @Test
    void decodeRejectsCharactersOutsideAlphabet()
    {
        for (String bad : new String[] { "000000000I", "000000000L", "000000000O", "000000000U",
                                          "000000000i", "000000000!", "000000000é" }) {
            UlidException e = assertThrows(UlidException.class, () -> Base32Codec.decode(bad), bad);
            assertEquals(UlidErrorKind.INVALID_CHARACTER, e.kind(), bad);
        }
    }

    @Test
    void decodeRejectsTimeBlockBeyondFortyEightBits()
    {
        UlidException e = assertThrows(UlidException.class, () -> Base32Codec.decode("8000000000"));
        assertEquals(UlidErrorKind.INVALID_CHARACTER, e.kind());
        assertArrayEquals(filled(6, 0xFF), Base32Codec.decode("7ZZZZZZZZZ"));
    }

    @Test
    void isValidChecksAlphabetOnly()
    {
        assertTrue(Base32Codec.isValid("0123456789abcdefghjkmnpqrstvwxyz"));
        assertTrue(Base32Codec.isValid(""));
        assertFalse(Base32Codec.isValid("01ARZ3NDEK!"));
        assertFalse(Base32Codec.isValid(null));
    }

    private static byte[] bytes(int... values)
    {
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (byte) values[i];
        }
        return out;
    }

    private static byte[] filled(int length, int value)
    {
        byte[] out = new byte[length];
        Arrays.fill(out, (byte) value);
        return out;
    }
}

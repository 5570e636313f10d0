package com.questrail.ulid.codec.netty;

import com.questrail.ulid.api.Ulid;
import com.questrail.ulid.api.UlidErrorKind;
import com.questrail.ulid.api.UlidException;

import io.netty.buffer.ByteBuf;

import java.util.Objects;

/**
 * UlidByteBufs
 * -----------------------------------------------------------------------------
 * Reads and writes the 16-byte ULID binary form on Netty buffers.
 *
 * <p>Both methods move the buffer's reader or writer index by exactly
 * {@value Ulid#LENGTH} bytes on success and leave it untouched on failure.</p>
 */
public final class UlidByteBufs
{
    private UlidByteBufs() {}

    /**
     * Appends the binary form of {@code ulid} at the writer index.
     */
    public static ByteBuf write(ByteBuf buf, Ulid ulid)
    {
        Objects.requireNonNull(buf, "buf");
        Objects.requireNonNull(ulid, "ulid");
        return buf.writeBytes(ulid.toBytes());
    }

    /**
     * Consumes {@value Ulid#LENGTH} bytes at the reader index.
     *
     * @throws UlidException {@link UlidErrorKind#INVALID_LENGTH} if fewer bytes are readable
     */
    public static Ulid read(ByteBuf buf)
    {
        Objects.requireNonNull(buf, "buf");
        if (buf.readableBytes() < Ulid.LENGTH) {
            throw new UlidException(UlidErrorKind.INVALID_LENGTH,
                    "A ULID requires " + Ulid.LENGTH + " readable bytes (was " + buf.readableBytes() + ")");
        }
        final byte[] bytes = new byte[Ulid.LENGTH];
        buf.readBytes(bytes);
        return Ulid.fromBytes(bytes);
    }
}

package com.questrail.ulid.codec.netty;

import com.questrail.ulid.api.Ulid;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * UlidFrameDecoder
 * -----------------------------------------------------------------------------
 * Inbound handler splitting a byte stream into consecutive 16-byte ULIDs.
 *
 * <p>Partial frames stay in the cumulation buffer until the remaining bytes
 * arrive. Holds per-channel state, so each pipeline needs its own instance.</p>
 */
public final class UlidFrameDecoder extends ByteToMessageDecoder
{
    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out)
    {
        while (in.readableBytes() >= Ulid.LENGTH) {
            out.add(UlidByteBufs.read(in));
        }
    }
}

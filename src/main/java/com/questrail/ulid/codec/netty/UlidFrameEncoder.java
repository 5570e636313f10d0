package com.questrail.ulid.codec.netty;

import com.questrail.ulid.api.Ulid;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

/**
 * UlidFrameEncoder
 * -----------------------------------------------------------------------------
 * Outbound handler writing each {@link Ulid} as its raw 16-byte binary form.
 *
 * <p>Stateless; a single instance may be added to many pipelines.</p>
 */
@ChannelHandler.Sharable
public final class UlidFrameEncoder extends MessageToByteEncoder<Ulid>
{
    public UlidFrameEncoder()
    {
        super(Ulid.class);
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, Ulid msg, ByteBuf out)
    {
        UlidByteBufs.write(out, msg);
    }
}

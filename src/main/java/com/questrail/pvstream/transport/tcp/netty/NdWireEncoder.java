package com.questrail.pvstream.transport.tcp.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

/**
 * Writes an {@link NdWireMessage} body; the length prefix is added further
 * down the pipeline.
 */
@ChannelHandler.Sharable
final class NdWireEncoder extends MessageToByteEncoder<NdWireMessage>
{
    @Override
    protected void encode(ChannelHandlerContext ctx, NdWireMessage message, ByteBuf out)
    {
        NdWireCodec.encode(message, out);
    }
}

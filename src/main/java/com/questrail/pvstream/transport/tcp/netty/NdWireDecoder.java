package com.questrail.pvstream.transport.tcp.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.MessageToMessageDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns one length-delimited body into an {@link NdWireMessage}.
 *
 * <p>A malformed body is logged and dropped. The connection stays open: the
 * length prefix already resynchronised the stream, so the next message is
 * unaffected.</p>
 */
final class NdWireDecoder extends MessageToMessageDecoder<ByteBuf>
{
    private static final Logger log = LoggerFactory.getLogger(NdWireDecoder.class);

    private long malformed;

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf body, List<Object> out)
    {
        try {
            out.add(NdWireCodec.decode(body));
        }
        catch (CorruptedFrameException e) {
            malformed++;
            log.warn("Dropping malformed message from {} ({} so far): {}",
                    ctx.channel().remoteAddress(), malformed, e.getMessage());
            body.skipBytes(body.readableBytes());
        }
    }
}

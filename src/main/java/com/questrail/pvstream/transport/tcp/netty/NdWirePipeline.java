package com.questrail.pvstream.transport.tcp.netty;

import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;

/**
 * Shared pipeline layout for both ends of the frame stream:
 *
 * <pre>
 *   inbound : LengthFieldBasedFrameDecoder → NdWireDecoder → (endpoint handler)
 *   outbound: NdWireEncoder → LengthFieldPrepender
 * </pre>
 */
final class NdWirePipeline
{
    /** Largest accepted message body (1 GiB). */
    static final int MAX_MESSAGE_BYTES = 1 << 30;

    private static final int LENGTH_FIELD_BYTES = 4;

    private NdWirePipeline() {}

    static void configure(ChannelPipeline p)
    {
        p.addLast("frameDecoder", new LengthFieldBasedFrameDecoder(
                MAX_MESSAGE_BYTES, 0, LENGTH_FIELD_BYTES, 0, LENGTH_FIELD_BYTES));
        p.addLast("framePrepender", new LengthFieldPrepender(LENGTH_FIELD_BYTES));
        p.addLast("wireDecoder", new NdWireDecoder());
        p.addLast("wireEncoder", new NdWireEncoder());
    }
}

package com.questrail.pvstream.transport.tcp.netty;

import com.questrail.pvstream.ntnd.model.RawFrame;

import java.util.Objects;

/**
 * Messages exchanged between {@link NettyFrameFeed} and
 * {@link NettyFrameStreamServer}. Package-internal; the feed port only ever
 * sees {@link RawFrame}.
 */
sealed interface NdWireMessage
        permits NdWireMessage.Subscribe, NdWireMessage.Unsubscribe, NdWireMessage.FrameUpdate
{
    byte SUBSCRIBE = 0x01;
    byte UNSUBSCRIBE = 0x02;
    byte FRAME = 0x03;

    String channelName();

    /** Client to server: start sending frames of {@code channelName}. */
    record Subscribe(String channelName) implements NdWireMessage
    {
        public Subscribe
        {
            Objects.requireNonNull(channelName, "channelName");
        }
    }

    /** Client to server: stop sending frames of {@code channelName}. */
    record Unsubscribe(String channelName) implements NdWireMessage
    {
        public Unsubscribe
        {
            Objects.requireNonNull(channelName, "channelName");
        }
    }

    /** Server to client: one frame of {@code channelName}. */
    record FrameUpdate(String channelName, RawFrame frame) implements NdWireMessage
    {
        public FrameUpdate
        {
            Objects.requireNonNull(channelName, "channelName");
            Objects.requireNonNull(frame, "frame");
        }
    }
}

package com.questrail.pvstream.transport.tcp.netty;

import com.questrail.pvstream.ntnd.model.NdValue;
import com.questrail.pvstream.ntnd.model.RawFrame;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NdWireDecoderTest
 * -----------------------------------------------------------------------------
 * Full inbound pipeline on an {@link EmbeddedChannel}: length framing plus
 * body decoding, with a malformed message in the middle of the stream.
 */
final class NdWireDecoderTest
{
    private static ByteBuf framed(ByteBuf body)
    {
        ByteBuf out = Unpooled.buffer();
        out.writeInt(body.readableBytes());
        out.writeBytes(body);
        body.release();
        return out;
    }

    private static ByteBuf framed(NdWireMessage message)
    {
        ByteBuf body = Unpooled.buffer();
        NdWireCodec.encode(message, body);
        return framed(body);
    }

    @Test
    void malformedMessageIsDroppedAndStreamContinues()
    {
        EmbeddedChannel ch = new EmbeddedChannel();
        NdWirePipeline.configure(ch.pipeline());

        RawFrame frame = new RawFrame(1, List.of(), new NdValue.UInt8Values(new byte[] {1}), List.of(), null, "");
        ByteBuf garbage = Unpooled.buffer().writeByte(0x7F).writeShort(0);

        ch.writeInbound(framed(new NdWireMessage.Subscribe("a")));
        ch.writeInbound(framed(garbage));
        ch.writeInbound(framed(new NdWireMessage.FrameUpdate("a", frame)));

        NdWireMessage first = ch.readInbound();
        NdWireMessage.FrameUpdate update = ch.readInbound();
        assertEquals(new NdWireMessage.Subscribe("a"), first);
        assertEquals(1L, update.frame().uniqueId());
        Object rest = ch.readInbound();
        assertNull(rest);
        assertTrue(ch.isOpen());
        assertFalse(ch.finish());
    }

    @Test
    void messageSplitAcrossReadsIsReassembled()
    {
        EmbeddedChannel ch = new EmbeddedChannel();
        NdWirePipeline.configure(ch.pipeline());

        ByteBuf whole = framed(new NdWireMessage.Unsubscribe("13SIM1:Image"));
        ByteBuf head = whole.readRetainedSlice(3);
        ByteBuf tail = whole.readRetainedSlice(whole.readableBytes());
        whole.release();

        ch.writeInbound(head);
        Object partial = ch.readInbound();
        assertNull(partial);
        ch.writeInbound(tail);

        NdWireMessage message = ch.readInbound();
        assertEquals(new NdWireMessage.Unsubscribe("13SIM1:Image"), message);
        ch.finishAndReleaseAll();
    }

    @Test
    void outboundMessagesAreLengthPrefixed()
    {
        EmbeddedChannel ch = new EmbeddedChannel();
        NdWirePipeline.configure(ch.pipeline());

        assertTrue(ch.writeOutbound(new NdWireMessage.Subscribe("x")));

        ByteBuf wire = Unpooled.buffer();
        for (ByteBuf part; (part = ch.readOutbound()) != null; ) {
            wire.writeBytes(part);
            part.release();
        }
        // u8 type + u16 length + "x"
        assertEquals(4, wire.readInt());
        assertEquals(NdWireMessage.Subscribe.class, NdWireCodec.decode(wire).getClass());
        wire.release();
        ch.finishAndReleaseAll();
    }
}

package com.questrail.pvstream.ntnd.codec;

import com.questrail.pvstream.api.ColorMode;
import com.questrail.pvstream.model.DecodedFrame;
import com.questrail.pvstream.ntnd.model.RawFrame;

/**
 * FrameEncoder
 * -----------------------------------------------------------------------------
 * Inverse of {@link FrameDecoder}: lays a {@link DecodedFrame} out on the wire
 * in a chosen colour layout.
 *
 * <p>Used by publishers (the Netty stream server, the test-pattern streamer)
 * and by tests. For every supported layout,
 * {@code decoder.decode(encoder.encode(frame, layout))} yields the same pixels
 * and geometry as {@code frame}.</p>
 */
public interface FrameEncoder
{
    /**
     * @param frame  frame to lay out
     * @param layout wire layout; MONO or BAYER for 1-channel frames, RGB1, RGB2
     *               or RGB3 for 3-channel frames
     * @throws IllegalArgumentException if the layout does not fit the frame's channel count
     */
    RawFrame encode(DecodedFrame frame, ColorMode layout);

    /** Encode in the frame's own colour mode. */
    default RawFrame encode(DecodedFrame frame)
    {
        return encode(frame, frame.colorMode());
    }
}

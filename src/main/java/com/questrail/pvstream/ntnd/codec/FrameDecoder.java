package com.questrail.pvstream.ntnd.codec;

import com.questrail.pvstream.model.DecodedFrame;
import com.questrail.pvstream.ntnd.model.RawFrame;

/**
 * FrameDecoder
 * -----------------------------------------------------------------------------
 * Pure conversion from a feed-delivered {@link RawFrame} to a typed
 * {@link DecodedFrame}.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Reading the {@code ColorMode} attribute (leniently)</li>
 *   <li>Validating payload presence and dimension count</li>
 *   <li>Reordering the flat buffer into row-major {@code (height, width, channels)}</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Luminance conversion or any other display transform</li>
 *   <li>Queueing, logging or dropping frames</li>
 * </ul>
 *
 * <p>Implementations hold no mutable state and may be called from any thread.</p>
 */
public interface FrameDecoder
{
    /**
     * Decode one frame.
     *
     * @param raw frame as delivered by the feed
     * @return the decoded frame; never {@code null}
     * @throws FrameDecodeException if the frame carries no image or an
     *         unsupported layout; see {@link FrameDecodeException.Reason}
     */
    DecodedFrame decode(RawFrame raw);
}

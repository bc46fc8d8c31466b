package com.questrail.pvstream.transport;

import com.questrail.pvstream.ntnd.model.RawFrame;

/**
 * FrameFeedListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link FrameFeed}.
 *
 * <p>Callbacks are delivered serially on the feed's own thread (for Netty
 * feeds, the channel's event loop). Implementations must not block for long:
 * a slow listener delays every later frame.</p>
 */
public interface FrameFeedListener
{
    /** The feed became usable. Lifecycle signal only. */
    void onFeedUp();

    /**
     * The feed became unusable.
     *
     * @param cause an exception or diagnostic cause; may be {@code null} for
     *              orderly shutdown
     */
    void onFeedDown(Throwable cause);

    /**
     * A frame arrived. The frame is handed over; the feed keeps no reference.
     */
    void onFrame(RawFrame frame);
}

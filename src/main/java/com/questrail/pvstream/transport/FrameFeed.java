package com.questrail.pvstream.transport;

/**
 * FrameFeed
 * -----------------------------------------------------------------------------
 * Minimal port for a subscription-based frame source (a detector channel).
 *
 * <p>Higher layers ({@code StreamSubscriber}) are responsible for decoding
 * delivered frames and handing them to the display side. The feed only
 * delivers.</p>
 *
 * <p>Implementations may be backed by Netty, an in-process simulator or a
 * test double.</p>
 */
public interface FrameFeed
{
    /**
     * Register the listener that receives frames and lifecycle events.
     *
     * <p>This must be called before {@link #subscribe(String)}.</p>
     */
    void setListener(FrameFeedListener listener);

    /**
     * Connect (if needed) and start receiving frames for {@code channelName}.
     *
     * <p>This is the only operation allowed to wait on the network, bounded by
     * the feed's connect timeout.</p>
     *
     * @throws FeedConnectionException if the channel cannot be reached
     */
    void subscribe(String channelName);

    /**
     * Stop delivering frames. Idempotent. After this returns, no new
     * {@link FrameFeedListener#onFrame} callback begins.
     */
    void unsubscribe();

    /** Release all transport resources. Implies {@link #unsubscribe()}. */
    void close();
}

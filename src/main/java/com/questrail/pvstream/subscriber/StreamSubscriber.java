package com.questrail.pvstream.subscriber;

import com.questrail.pvstream.internal.time.WallClock;
import com.questrail.pvstream.model.DecodedFrame;
import com.questrail.pvstream.model.QueuedFrame;
import com.questrail.pvstream.ntnd.codec.FrameDecodeException;
import com.questrail.pvstream.ntnd.codec.FrameDecoder;
import com.questrail.pvstream.ntnd.model.RawFrame;
import com.questrail.pvstream.observability.FeedEvent;
import com.questrail.pvstream.observability.FrameDropEvent;
import com.questrail.pvstream.observability.StreamObservabilitySink;
import com.questrail.pvstream.queue.FrameQueue;
import com.questrail.pvstream.transport.FeedConnectionException;
import com.questrail.pvstream.transport.FrameFeed;
import com.questrail.pvstream.transport.FrameFeedListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * StreamSubscriber
 * =============================================================================
 * Owns the feed subscription for one channel and turns every delivered frame
 * into a queued, decoded frame.
 *
 * <h2>Inbound path</h2>
 *
 * <pre>
 *   FrameFeed (feed thread)
 *        → FrameDecoder
 *            → QueuedFrame (wall-clock stamped)
 *                → FrameQueue.publish
 * </pre>
 *
 * <h2>Drops</h2>
 * Expected decode failures (no payload, no dimensions) and everything else
 * that goes wrong inside a callback are reported to the
 * {@link StreamObservabilitySink} and the frame is dropped. Nothing escapes
 * into the feed's thread, including a failure of the sink itself while it
 * reports a drop, which is logged instead. RGB frames are published as they are; luminance is
 * a display concern.
 *
 * <h2>Stop guarantee</h2>
 * Callbacks run under the read side of a {@link ReentrantReadWriteLock};
 * {@link #stop()} takes the write side to clear the active flag. It therefore
 * waits for an in-flight callback to finish, and no publish happens after it
 * returns. Stopping from inside a callback is allowed: the calling callback
 * sees the cleared flag before it publishes.
 */
public final class StreamSubscriber implements FrameFeedListener {
    private static final Logger log = LoggerFactory.getLogger(StreamSubscriber.class);

    private final String channelName;
    private final FrameFeed feed;
    private final FrameDecoder decoder;
    private final FrameQueue queue;
    private final WallClock wallClock;
    private final StreamObservabilitySink sink;

    private final ReentrantReadWriteLock callbackLock = new ReentrantReadWriteLock();
    private volatile boolean active;

    private final LongAdder received = new LongAdder();
    private final LongAdder published = new LongAdder();
    private final LongAdder dropped = new LongAdder();

    public StreamSubscriber(String channelName,
                            FrameFeed feed,
                            FrameDecoder decoder,
                            FrameQueue queue,
                            WallClock wallClock,
                            StreamObservabilitySink sink) {
        this.channelName = Objects.requireNonNull(channelName, "channelName");
        this.feed = Objects.requireNonNull(feed, "feed");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");

        this.feed.setListener(this);
    }

    /**
     * Subscribe to the channel. Calling start on a running subscriber does nothing.
     *
     * @throws FeedConnectionException if the feed cannot subscribe
     */
    public synchronized void start() {
        if (active) {
            return;
        }
        active = true;
        try {
            feed.subscribe(channelName);
        } catch (RuntimeException e) {
            active = false;
            throw e;
        }
        sink.onFeedEvent(new FeedEvent(wallClock.now(), channelName, FeedEvent.Kind.SUBSCRIBED, null));
    }

    /**
     * Stop publishing and unsubscribe. Idempotent.
     */
    public synchronized void stop() {
        if (!active) {
            return;
        }
        if (callbackLock.getReadHoldCount() > 0) {
            // Called from inside a callback on this thread; the write lock is unreachable.
            active = false;
        } else {
            callbackLock.writeLock().lock();
            try {
                active = false;
            } finally {
                callbackLock.writeLock().unlock();
            }
        }
        feed.unsubscribe();
        sink.onFeedEvent(new FeedEvent(wallClock.now(), channelName, FeedEvent.Kind.UNSUBSCRIBED, null));
    }

    public boolean isActive() {
        return active;
    }

    public String channelName() {
        return channelName;
    }

    public long receivedCount() {
        return received.sum();
    }

    public long publishedCount() {
        return published.sum();
    }

    public long droppedCount() {
        return dropped.sum();
    }

    // -------------------------------------------------------------------------
    // FrameFeedListener
    // -------------------------------------------------------------------------

    @Override
    public void onFeedUp() {
        sink.onFeedEvent(new FeedEvent(wallClock.now(), channelName, FeedEvent.Kind.CONNECTION_UP, null));
    }

    @Override
    public void onFeedDown(Throwable cause) {
        sink.onFeedEvent(new FeedEvent(wallClock.now(), channelName, FeedEvent.Kind.CONNECTION_DOWN, cause));
    }

    @Override
    public void onFrame(RawFrame raw) {
        callbackLock.readLock().lock();
        try {
            if (!active) {
                return;
            }
            received.increment();
            handle(raw);
        } finally {
            callbackLock.readLock().unlock();
        }
    }

    private void handle(RawFrame raw) {
        final long uid = raw == null ? -1L : raw.uniqueId();
        try {
            final DecodedFrame frame;
            try {
                frame = decoder.decode(raw);
            } catch (FrameDecodeException e) {
                drop(uid, FrameDropEvent.Reason.of(e.reason()), e.getMessage(), e.isExpected() ? null : e);
                return;
            }

            if (!active) {
                return;
            }
            queue.publish(new QueuedFrame(wallClock.now(), frame));
            published.increment();
        } catch (RuntimeException e) {
            drop(uid, FrameDropEvent.Reason.CALLBACK_FAILURE, String.valueOf(e.getMessage()), e);
        }
    }

    private void drop(long uid, FrameDropEvent.Reason reason, String detail, Throwable cause) {
        dropped.increment();
        try {
            sink.onFrameDropped(new FrameDropEvent(wallClock.now(), channelName, uid, reason, detail, cause));
        } catch (RuntimeException e) {
            log.warn("Drop of frame {} on {} ({}) could not be reported", uid, channelName, reason, e);
        }
    }
}

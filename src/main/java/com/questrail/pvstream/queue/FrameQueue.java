package com.questrail.pvstream.queue;

import com.questrail.pvstream.model.QueuedFrame;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * FrameQueue
 * =============================================================================
 * Capacity-1, latest-wins mailbox between the feed thread and the display
 * thread.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>{@link #publish(QueuedFrame)} never blocks and always succeeds; an unread
 *       frame is replaced (and counted as overwritten).</li>
 *   <li>{@link #tryTake()} never blocks; it returns the most recent frame
 *       published since the previous take, or empty.</li>
 *   <li>A frame is taken at most once.</li>
 * </ul>
 *
 * <h2>Implementation</h2>
 * A single {@link AtomicReference} slot with {@code getAndSet}. Publication of
 * the reference is a release/acquire pair, so a taker either sees a fully
 * constructed frame or nothing. This is the only state shared between the
 * producer and the consumer.
 */
public final class FrameQueue {

    private final AtomicReference<QueuedFrame> slot = new AtomicReference<>();

    private final LongAdder published = new LongAdder();
    private final LongAdder taken = new LongAdder();
    private final LongAdder overwritten = new LongAdder();

    /**
     * Store {@code frame} as the latest frame.
     *
     * @return the unread frame that was displaced, if any
     */
    public Optional<QueuedFrame> publish(QueuedFrame frame) {
        Objects.requireNonNull(frame, "frame");
        QueuedFrame previous = slot.getAndSet(frame);
        published.increment();
        if (previous != null) {
            overwritten.increment();
        }
        return Optional.ofNullable(previous);
    }

    /** Take the latest unread frame, if any. */
    public Optional<QueuedFrame> tryTake() {
        QueuedFrame frame = slot.getAndSet(null);
        if (frame != null) {
            taken.increment();
        }
        return Optional.ofNullable(frame);
    }

    /** True when an unread frame is waiting. Advisory only. */
    public boolean hasPending() {
        return slot.get() != null;
    }

    public long publishedCount() {
        return published.sum();
    }

    public long takenCount() {
        return taken.sum();
    }

    public long overwrittenCount() {
        return overwritten.sum();
    }
}

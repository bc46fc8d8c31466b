package com.questrail.pvstream.sim;

import com.questrail.pvstream.api.ColorMode;
import com.questrail.pvstream.internal.time.Cancellable;
import com.questrail.pvstream.internal.time.MonotonicClock;
import com.questrail.pvstream.internal.time.MonotonicScheduler;
import com.questrail.pvstream.internal.time.WallClock;
import com.questrail.pvstream.model.DecodedFrame;
import com.questrail.pvstream.ntnd.codec.FrameEncoder;
import com.questrail.pvstream.ntnd.model.RawFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Random;

/**
 * TestPatternStreamer
 * =============================================================================
 * Synthetic detector: renders a {@link TestPattern} at a target frame rate and
 * hands the encoded frames to a {@link FramePublisher}.
 *
 * <p>Frames carry increasing unique ids starting at 1 and a {@code ColorMode}
 * attribute of MONO. Publisher failures are logged and the stream continues.</p>
 */
public final class TestPatternStreamer {
    private static final Logger log = LoggerFactory.getLogger(TestPatternStreamer.class);

    private final FramePublisher publisher;
    private final FrameEncoder encoder;
    private final TestPattern pattern;
    private final int width;
    private final int height;
    private final long periodNanos;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Random random;

    private final Object lock = new Object();
    private boolean running;
    private Cancellable pending;
    private long frameCount;

    public TestPatternStreamer(FramePublisher publisher,
                               FrameEncoder encoder,
                               TestPattern pattern,
                               int width,
                               int height,
                               double fps,
                               MonotonicScheduler scheduler,
                               MonotonicClock clock,
                               WallClock wallClock,
                               long seed) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("image must be at least 1x1, got " + width + "x" + height);
        }
        if (!(fps > 0) || Double.isInfinite(fps)) {
            throw new IllegalArgumentException("fps must be finite and > 0, got " + fps);
        }
        this.width = width;
        this.height = height;
        this.periodNanos = Math.max(1L, (long) (1e9 / fps));
        this.random = new Random(seed);
    }

    public void start() {
        synchronized (lock) {
            if (running) {
                return;
            }
            running = true;
            long first = clock.nowNanos();
            pending = scheduler.scheduleAtNanos(first, () -> runFrame(first));
        }
        log.info("Streaming {} {}x{} every {} ns", pattern, width, height, periodNanos);
    }

    public void stop() {
        synchronized (lock) {
            running = false;
            if (pending != null) {
                pending.cancel();
                pending = null;
            }
        }
    }

    public long frameCount() {
        synchronized (lock) {
            return frameCount;
        }
    }

    /**
     * Render, encode and publish the next frame immediately.
     */
    public RawFrame publishNext() {
        final long index;
        synchronized (lock) {
            index = frameCount++;
        }
        DecodedFrame image = pattern.render(width, height, index + 1, random, wallClock.now());
        RawFrame raw = encoder.encode(image, ColorMode.MONO);
        publisher.publish(raw);
        return raw;
    }

    private void runFrame(long deadline) {
        synchronized (lock) {
            if (!running) {
                return;
            }
        }
        try {
            publishNext();
        } catch (RuntimeException e) {
            log.warn("Publishing test frame failed", e);
        } finally {
            synchronized (lock) {
                if (running) {
                    long next = deadline + periodNanos;
                    long now = clock.nowNanos();
                    if (next <= now) {
                        next = now + periodNanos;
                    }
                    final long scheduled = next;
                    pending = scheduler.scheduleAtNanos(scheduled, () -> runFrame(scheduled));
                }
            }
        }
    }
}

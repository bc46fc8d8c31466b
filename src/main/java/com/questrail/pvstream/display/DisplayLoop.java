package com.questrail.pvstream.display;

import com.questrail.pvstream.internal.time.Cancellable;
import com.questrail.pvstream.internal.time.MonotonicClock;
import com.questrail.pvstream.internal.time.MonotonicScheduler;
import com.questrail.pvstream.internal.time.WallClock;
import com.questrail.pvstream.observability.StreamErrorEvent;
import com.questrail.pvstream.observability.StreamObservabilitySink;

import java.time.Duration;
import java.util.Objects;

/**
 * Drives {@link DisplayPump#tick()} at a fixed cadence on a
 * {@link MonotonicScheduler}.
 *
 * <p>Each tick schedules the next one at {@code previousDeadline + interval}.
 * When the loop has fallen behind, missed ticks are skipped rather than run in
 * a burst. A tick that throws is reported to the sink and the loop keeps
 * going.</p>
 *
 * <p>With a single-threaded scheduler every tick runs on the same thread,
 * which is what makes the pump's state thread-confined.</p>
 */
public final class DisplayLoop {

    private final DisplayPump pump;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final StreamObservabilitySink sink;
    private final long intervalNanos;

    private final Object lock = new Object();
    private boolean running;
    private long generation;
    private Cancellable pending;
    private long ticks;

    public DisplayLoop(DisplayPump pump,
                       MonotonicScheduler scheduler,
                       MonotonicClock clock,
                       WallClock wallClock,
                       StreamObservabilitySink sink,
                       Duration interval) {
        this.pump = Objects.requireNonNull(pump, "pump");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
        this.intervalNanos = interval.toNanos();
    }

    public void start() {
        synchronized (lock) {
            if (running) {
                return;
            }
            running = true;
            final long gen = ++generation;
            final long first = clock.nowNanos();
            pending = scheduler.scheduleAtNanos(first, () -> runTick(gen, first));
        }
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

    public boolean isRunning() {
        synchronized (lock) {
            return running;
        }
    }

    /** Number of ticks run so far. */
    public long tickCount() {
        synchronized (lock) {
            return ticks;
        }
    }

    private boolean isCurrent(long gen) {
        return running && gen == generation;
    }

    /**
     * One tick of the chain started as {@code gen}. A restart during the tick
     * starts a new chain, and this one ends without re-arming.
     */
    private void runTick(long gen, long deadline) {
        synchronized (lock) {
            if (!isCurrent(gen)) {
                return;
            }
            ticks++;
        }

        try {
            pump.tick();
        } catch (RuntimeException e) {
            sink.onError(new StreamErrorEvent(wallClock.now(), "display tick failed", e));
        } finally {
            synchronized (lock) {
                if (isCurrent(gen)) {
                    long next = deadline + intervalNanos;
                    long now = clock.nowNanos();
                    if (next <= now) {
                        next = now + intervalNanos;
                    }
                    final long scheduled = next;
                    pending = scheduler.scheduleAtNanos(scheduled, () -> runTick(gen, scheduled));
                }
            }
        }
    }
}

package com.questrail.pvstream.internal.time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <h2>Design</h2>
 * <p>Monotonic deadlines are converted into relative delays at scheduling time
 * using the supplied {@link MonotonicClock}. Callers must compute deadlines
 * with the same clock instance.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>The executor is borrowed, not owned. {@code ViewerRuntime} creates a
 * single-threaded executor which becomes the display (consumer) thread and
 * shuts it down on stop.</p>
 *
 * <h2>Shutdown</h2>
 * <p>Once the executor is shut down, scheduling is a no-op that returns an
 * already-spent handle. A display tick that re-arms while the runtime is
 * stopping therefore ends quietly instead of failing on the display
 * thread.</p>
 *
 * <h2>Precision</h2>
 * <p>Tasks may run slightly after their deadline, never before.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {
    private static final Logger log = LoggerFactory.getLogger(ScheduledExecutorScheduler.class);

    private static final Cancellable SPENT = () -> false;

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // A deadline already in the past runs immediately.
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());

        try {
            return new FutureCancellable(executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS));
        } catch (RejectedExecutionException e) {
            if (!executor.isShutdown()) {
                throw e;
            }
            log.debug("Executor shut down; task due in {} ns dropped", delayNanos);
            return SPENT;
        }
    }

    private static final class FutureCancellable implements Cancellable {
        private final ScheduledFuture<?> future;

        private FutureCancellable(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            // never interrupt a tick that is already running
            return future.cancel(false);
        }
    }
}

package com.questrail.pvstream.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for display cadence.
 *
 * <h2>Binding invariant</h2>
 * Rate limiting, FPS estimation and tick scheduling MUST use a monotonic time
 * source. Wall-clock time (see {@link WallClock}) is permitted only for frame
 * timestamps and observability.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>Values are only meaningful for elapsed time computations.</p>
     */
    long nowNanos();
}

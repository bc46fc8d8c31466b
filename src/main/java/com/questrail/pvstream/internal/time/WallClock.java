package com.questrail.pvstream.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used to stamp received frames and observability events.
 *
 * <p>This clock may jump. It MUST NOT be used for display cadence.</p>
 */
public interface WallClock
{
    Instant now();
}

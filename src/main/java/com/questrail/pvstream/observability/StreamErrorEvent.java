package com.questrail.pvstream.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the stream pipeline.
 */
public record StreamErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}

package com.questrail.pvstream.observability;

import java.time.Instant;

/**
 * Record representing a post-processing hook that threw; its output for this
 * frame was discarded.
 */
public record ProcessorFailureEvent(
    Instant timestamp,
    String processorName,
    long uniqueId,
    Throwable cause
) {
}

package com.questrail.pvstream.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A decoded frame in transit through the frame queue, stamped with the wall
 * clock time at which the subscriber published it.
 */
public record QueuedFrame(Instant receiveTimestamp, DecodedFrame frame) {
    public QueuedFrame {
        Objects.requireNonNull(receiveTimestamp, "receiveTimestamp");
        Objects.requireNonNull(frame, "frame");
    }
}

package com.questrail.pvstream.observability;

import java.time.Instant;

/**
 * Record representing a feed lifecycle change.
 *
 * @param cause diagnostic cause for {@link Kind#CONNECTION_DOWN}; may be {@code null}
 */
public record FeedEvent(
    Instant timestamp,
    String channelName,
    Kind kind,
    Throwable cause
) {
    public enum Kind {
        SUBSCRIBED,
        UNSUBSCRIBED,
        CONNECTION_UP,
        CONNECTION_DOWN
    }
}

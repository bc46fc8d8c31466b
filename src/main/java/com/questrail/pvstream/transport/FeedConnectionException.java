package com.questrail.pvstream.transport;

/**
 * Raised when a feed cannot establish its subscription (unknown host, refused
 * connection, connect timeout). This is the only fatal error of the frame path
 * and surfaces only from {@code subscribe} / {@code start}.
 */
public final class FeedConnectionException extends RuntimeException
{
    public FeedConnectionException(String message) {
        super(message);
    }

    public FeedConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}

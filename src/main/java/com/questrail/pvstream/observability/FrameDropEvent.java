package com.questrail.pvstream.observability;

import com.questrail.pvstream.ntnd.codec.FrameDecodeException;

import java.time.Instant;

/**
 * Record representing a frame dropped on the feed side before reaching the
 * frame queue.
 *
 * @param uniqueId producer id of the dropped frame
 * @param cause    the exception behind the drop; may be {@code null}
 */
public record FrameDropEvent(
    Instant timestamp,
    String channelName,
    long uniqueId,
    Reason reason,
    String detail,
    Throwable cause
) {
    public enum Reason {
        EMPTY_PAYLOAD(true),
        NO_DIMENSIONS(true),
        UNSUPPORTED_LAYOUT(false),
        SIZE_MISMATCH(false),
        /** Any other runtime failure while handling the callback. */
        CALLBACK_FAILURE(false);

        private final boolean expected;

        Reason(boolean expected) {
            this.expected = expected;
        }

        public boolean isExpected() {
            return expected;
        }

        public static Reason of(FrameDecodeException.Reason decodeReason) {
            return switch (decodeReason) {
                case EMPTY_PAYLOAD -> EMPTY_PAYLOAD;
                case NO_DIMENSIONS -> NO_DIMENSIONS;
                case UNSUPPORTED_LAYOUT -> UNSUPPORTED_LAYOUT;
                case SIZE_MISMATCH -> SIZE_MISMATCH;
            };
        }
    }

    public boolean isExpected() {
        return reason.isExpected();
    }
}

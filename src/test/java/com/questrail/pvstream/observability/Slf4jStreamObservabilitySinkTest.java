package com.questrail.pvstream.observability;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class Slf4jStreamObservabilitySinkTest {

    private final Slf4jStreamObservabilitySink sink = new Slf4jStreamObservabilitySink();

    @Test
    void everyEventKindIsLoggedWithoutThrowing() {
        Instant now = Instant.EPOCH;

        assertDoesNotThrow(() -> {
            for (FeedEvent.Kind kind : FeedEvent.Kind.values()) {
                sink.onFeedEvent(new FeedEvent(now, "cam", kind, kind == FeedEvent.Kind.CONNECTION_DOWN
                    ? new IOException("reset by peer") : null));
            }
            for (FrameDropEvent.Reason reason : FrameDropEvent.Reason.values()) {
                sink.onFrameDropped(new FrameDropEvent(now, "cam", 3, reason, "detail", null));
            }
            sink.onProcessorFailure(new ProcessorFailureEvent(now, "invert", 3, new IllegalStateException()));
            sink.onError(new StreamErrorEvent(now, "display tick failed", new RuntimeException("x")));
        });
    }

    @Test
    void onlyStructuralDropsCountAsExpected() {
        assertTrue(FrameDropEvent.Reason.EMPTY_PAYLOAD.isExpected());
        assertTrue(FrameDropEvent.Reason.NO_DIMENSIONS.isExpected());
        assertFalse(FrameDropEvent.Reason.UNSUPPORTED_LAYOUT.isExpected());
        assertFalse(FrameDropEvent.Reason.SIZE_MISMATCH.isExpected());
        assertFalse(FrameDropEvent.Reason.CALLBACK_FAILURE.isExpected());
    }
}

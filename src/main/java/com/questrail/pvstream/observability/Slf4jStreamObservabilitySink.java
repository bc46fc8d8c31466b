package com.questrail.pvstream.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of StreamObservabilitySink that emits logs via SLF4J.
 *
 * <p>Expected drops (no payload, no dimensions) happen on every idle detector
 * and only go to TRACE.</p>
 */
public final class Slf4jStreamObservabilitySink implements StreamObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jStreamObservabilitySink.class);

    @Override
    public void onFeedEvent(FeedEvent event) {
        switch (event.kind()) {
            case CONNECTION_DOWN -> log.warn("Feed {} connection down", event.channelName(), event.cause());
            default -> log.info("Feed {}: {}", event.channelName(), event.kind());
        }
    }

    @Override
    public void onFrameDropped(FrameDropEvent event) {
        if (event.isExpected()) {
            log.trace("Frame {} on {} skipped: {}", event.uniqueId(), event.channelName(), event.reason());
            return;
        }
        log.warn("Frame {} on {} dropped ({}): {}",
            event.uniqueId(), event.channelName(), event.reason(), event.detail(), event.cause());
    }

    @Override
    public void onProcessorFailure(ProcessorFailureEvent event) {
        log.warn("Processor '{}' failed on frame {}; skipped",
            event.processorName(), event.uniqueId(), event.cause());
    }

    @Override
    public void onError(StreamErrorEvent event) {
        log.error("Stream error: {}", event.message(), event.cause());
    }
}

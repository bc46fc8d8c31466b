package com.questrail.pvstream.observability;

/**
 * Main interface for receiving frame-path observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive on whichever thread observed the event (the feed thread
 * for drops and feed events, the display thread for processor failures and
 * render errors). Implementations must be thread-safe and must not block.</p>
 */
public interface StreamObservabilitySink {
    /**
     * Called when the feed subscription changes state (subscribed, connection up/down).
     * @param event the feed event
     */
    void onFeedEvent(FeedEvent event);

    /**
     * Called when a delivered frame is not published to the display.
     * @param event the drop details
     */
    void onFrameDropped(FrameDropEvent event);

    /**
     * Called when a post-processing hook throws and is skipped for one frame.
     * @param event the failure details
     */
    void onProcessorFailure(ProcessorFailureEvent event);

    /**
     * Called when an error occurs that is not tied to a single frame
     * (renderer failure, tick failure).
     * @param event the error event
     */
    void onError(StreamErrorEvent event);
}

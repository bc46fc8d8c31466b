package com.questrail.pvstream.observability;

/**
 * No-op implementation of StreamObservabilitySink.
 */
public final class NullObservabilitySink implements StreamObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onFeedEvent(FeedEvent event) {}

    @Override
    public void onFrameDropped(FrameDropEvent event) {}

    @Override
    public void onProcessorFailure(ProcessorFailureEvent event) {}

    @Override
    public void onError(StreamErrorEvent event) {}
}

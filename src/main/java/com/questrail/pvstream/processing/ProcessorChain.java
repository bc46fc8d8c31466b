package com.questrail.pvstream.processing;

import com.questrail.pvstream.internal.time.SystemWallClock;
import com.questrail.pvstream.internal.time.WallClock;
import com.questrail.pvstream.model.DecodedFrame;
import com.questrail.pvstream.model.FrameMetadata;
import com.questrail.pvstream.observability.NullObservabilitySink;
import com.questrail.pvstream.observability.ProcessorFailureEvent;
import com.questrail.pvstream.observability.StreamObservabilitySink;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of post-processing stages.
 *
 * <p>Each stage sees the previous stage's output. A stage that throws (or
 * returns {@code null}) is skipped for that frame: its output is discarded, the
 * failure is reported, and the next stage sees the last good frame.</p>
 */
public final class ProcessorChain {

    /** A named stage. */
    public record Stage(String name, FrameProcessor processor) {
        public Stage {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(processor, "processor");
        }
    }

    private static final ProcessorChain EMPTY =
        new ProcessorChain(List.of(), NullObservabilitySink.INSTANCE, SystemWallClock.INSTANCE);

    private final List<Stage> stages;
    private final StreamObservabilitySink sink;
    private final WallClock wallClock;

    public ProcessorChain(List<Stage> stages, StreamObservabilitySink sink, WallClock wallClock) {
        this.stages = List.copyOf(Objects.requireNonNull(stages, "stages"));
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public static ProcessorChain empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return stages.isEmpty();
    }

    public List<Stage> stages() {
        return stages;
    }

    /** Same sink and clock, one more stage at the end. */
    public ProcessorChain with(String name, FrameProcessor processor) {
        List<Stage> next = new ArrayList<>(stages);
        next.add(new Stage(name, processor));
        return new ProcessorChain(next, sink, wallClock);
    }

    public ProcessedFrame apply(DecodedFrame frame, FrameMetadata metadata) {
        DecodedFrame current = frame;
        FrameMetadata currentMeta = metadata;

        for (Stage stage : stages) {
            try {
                ProcessedFrame out = stage.processor().process(current, currentMeta);
                if (out == null) {
                    throw new IllegalStateException("processor returned null");
                }
                current = out.frame();
                currentMeta = out.metadata();
            } catch (RuntimeException e) {
                sink.onProcessorFailure(new ProcessorFailureEvent(
                    wallClock.now(), stage.name(), frame.uniqueId(), e));
            }
        }
        return new ProcessedFrame(current, currentMeta);
    }
}

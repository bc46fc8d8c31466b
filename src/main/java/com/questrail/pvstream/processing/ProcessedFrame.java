package com.questrail.pvstream.processing;

import com.questrail.pvstream.model.DecodedFrame;
import com.questrail.pvstream.model.FrameMetadata;

import java.util.Objects;

/**
 * Output of a {@link FrameProcessor}: the frame to pass on and the (possibly
 * annotated) metadata.
 */
public record ProcessedFrame(DecodedFrame frame, FrameMetadata metadata) {
    public ProcessedFrame {
        Objects.requireNonNull(frame, "frame");
        Objects.requireNonNull(metadata, "metadata");
    }
}

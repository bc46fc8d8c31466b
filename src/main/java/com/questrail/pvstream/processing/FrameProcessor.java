package com.questrail.pvstream.processing;

import com.questrail.pvstream.model.DecodedFrame;
import com.questrail.pvstream.model.FrameMetadata;

/**
 * Post-processing hook applied by the display pump after view transforms and
 * flat-field correction, before contrast and render.
 *
 * <p>Called on the display thread only. Implementations must not modify the
 * input frame's pixel buffer; they return a new frame (or the same one when
 * they have nothing to do). An exception skips this hook for one frame.</p>
 */
@FunctionalInterface
public interface FrameProcessor {

    ProcessedFrame process(DecodedFrame frame, FrameMetadata metadata);
}

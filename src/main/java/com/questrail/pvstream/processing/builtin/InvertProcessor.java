package com.questrail.pvstream.processing.builtin;

import com.questrail.pvstream.model.DecodedFrame;
import com.questrail.pvstream.model.FrameMetadata;
import com.questrail.pvstream.ntnd.model.NdValue;
import com.questrail.pvstream.processing.FrameProcessor;
import com.questrail.pvstream.processing.ProcessedFrame;

/**
 * Mirrors intensities around the frame's own range: {@code v -> max - (v - min)}.
 *
 * <p>NaN is ignored when finding the range and stays NaN. Frames with no usable
 * range (constant, all-NaN) pass through unchanged. Integral results are
 * clipped to {@code [min, max]} and keep the source type. Adds
 * {@code inverted=true} to the metadata.</p>
 */
public final class InvertProcessor implements FrameProcessor {

    public static final String INVERTED = "inverted";

    @Override
    public ProcessedFrame process(DecodedFrame frame, FrameMetadata metadata) {
        NdValue pixels = frame.pixels();
        int n = pixels.length();

        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            double v = pixels.getDouble(i);
            if (Double.isNaN(v)) {
                continue;
            }
            if (v < lo) lo = v;
            if (v > hi) hi = v;
        }
        if (!Double.isFinite(lo) || !Double.isFinite(hi) || hi <= lo) {
            return new ProcessedFrame(frame, metadata);
        }

        double[] out = new double[n];
        boolean integral = frame.dtype().isIntegral();
        for (int i = 0; i < n; i++) {
            double v = hi - (pixels.getDouble(i) - lo);
            out[i] = integral ? Math.max(lo, Math.min(hi, v)) : v;
        }
        return new ProcessedFrame(
            frame.withPixels(NdValue.fromDoubles(frame.dtype(), out)),
            metadata.with(INVERTED, Boolean.TRUE));
    }
}

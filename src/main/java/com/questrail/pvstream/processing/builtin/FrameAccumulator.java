package com.questrail.pvstream.processing.builtin;

import com.questrail.pvstream.model.DecodedFrame;
import com.questrail.pvstream.model.FrameMetadata;
import com.questrail.pvstream.ntnd.model.NdValue;
import com.questrail.pvstream.processing.FrameProcessor;
import com.questrail.pvstream.processing.ProcessedFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * FrameAccumulator
 * =============================================================================
 * Running per-pixel sum of displayed frames.
 *
 * <ul>
 *   <li>{@link #start()} / {@link #stop()} toggle accumulation; frames still
 *       pass through while stopped.</li>
 *   <li>{@link #reset()} zeroes the sum.</li>
 *   <li>A frame of a different shape (height, width or channels) restarts the
 *       sum at that shape.</li>
 *   <li>With preview on, the processor outputs the current sum as a 32-bit
 *       float frame instead of the input.</li>
 * </ul>
 *
 * <p>NaN inputs contribute 0. Control methods may be called from any thread;
 * {@link #process} runs on the display thread.</p>
 */
public final class FrameAccumulator implements FrameProcessor {
    private static final Logger log = LoggerFactory.getLogger(FrameAccumulator.class);

    public static final String SUMMED_FRAMES = "summedFrames";

    private boolean running;
    private boolean preview;

    private double[] sum;
    private int width;
    private int height;
    private int channels;
    private DecodedFrame template;
    private long count;

    public FrameAccumulator(boolean preview) {
        this.preview = preview;
    }

    public synchronized void start() {
        running = true;
    }

    public synchronized void stop() {
        running = false;
    }

    public synchronized void reset() {
        if (sum != null) {
            sum = new double[sum.length];
        }
        count = 0;
    }

    public synchronized void setPreview(boolean preview) {
        this.preview = preview;
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public synchronized long count() {
        return count;
    }

    /** Current sum as a 64-bit float frame, if any frame has been seen. */
    public synchronized Optional<DecodedFrame> snapshot() {
        if (sum == null) {
            return Optional.empty();
        }
        return Optional.of(template.withPixels(new NdValue.Float64Values(sum.clone())));
    }

    @Override
    public synchronized ProcessedFrame process(DecodedFrame frame, FrameMetadata metadata) {
        if (sum == null || frame.width() != width || frame.height() != height || frame.channels() != channels) {
            sum = new double[frame.pixels().length()];
            width = frame.width();
            height = frame.height();
            channels = frame.channels();
            count = 0;
            log.debug("Accumulator initialised at {}x{}x{}", height, width, channels);
        }
        template = frame;

        if (running) {
            NdValue pixels = frame.pixels();
            for (int i = 0; i < sum.length; i++) {
                double v = pixels.getDouble(i);
                if (!Double.isNaN(v)) {
                    sum[i] += v;
                }
            }
            count++;
        }

        if (!preview) {
            return new ProcessedFrame(frame, metadata);
        }
        float[] out = new float[sum.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = (float) sum[i];
        }
        return new ProcessedFrame(
            frame.withPixels(new NdValue.Float32Values(out)),
            metadata.with(SUMMED_FRAMES, count));
    }
}

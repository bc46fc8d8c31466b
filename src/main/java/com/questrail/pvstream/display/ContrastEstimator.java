package com.questrail.pvstream.display;

import com.questrail.pvstream.api.ContrastWindow;
import com.questrail.pvstream.model.DecodedFrame;
import com.questrail.pvstream.ntnd.model.NdValue;

import java.util.Arrays;
import java.util.Objects;

/**
 * ContrastEstimator
 * =============================================================================
 * Robust intensity window for a frame: the 0.5th and 99.5th percentiles of a
 * strided sample.
 *
 * <h2>Sampling</h2>
 * Rows and columns are taken with stride {@code ceil(max(height, width) / 512)},
 * so the sample has at most 512 entries per spatial axis. Every channel of a
 * sampled pixel is included.
 *
 * <h2>Percentiles</h2>
 * Linear interpolation between closest ranks: for sorted {@code a} of length
 * {@code n}, rank {@code q/100 * (n - 1)}.
 *
 * <h2>Fallback</h2>
 * If the sample holds a NaN, or the percentile bounds are non-finite, or
 * {@code high <= low}, the window is the exact min/max of the finite sample
 * values. A constant frame therefore yields {@code low == high}; callers must
 * handle that. A sample without finite values yields a NaN window.
 *
 * <p>Pure and stateless.</p>
 */
public final class ContrastEstimator {

    public static final int SAMPLE_AXIS_LIMIT = 512;
    public static final double LOW_PERCENTILE = 0.5;
    public static final double HIGH_PERCENTILE = 99.5;

    public ContrastWindow estimate(DecodedFrame frame) {
        Objects.requireNonNull(frame, "frame");

        int stride = sampleStride(frame.height(), frame.width());
        double[] sample = sample(frame, stride);

        boolean hasNaN = false;
        for (double v : sample) {
            if (Double.isNaN(v)) {
                hasNaN = true;
                break;
            }
        }

        if (!hasNaN) {
            double[] sorted = sample.clone();
            Arrays.sort(sorted);
            double low = percentile(sorted, LOW_PERCENTILE);
            double high = percentile(sorted, HIGH_PERCENTILE);
            if (Double.isFinite(low) && Double.isFinite(high) && high > low) {
                return new ContrastWindow(low, high);
            }
        }
        return finiteMinMax(sample);
    }

    static int sampleStride(int height, int width) {
        int longest = Math.max(height, width);
        return Math.max(1, (longest + SAMPLE_AXIS_LIMIT - 1) / SAMPLE_AXIS_LIMIT);
    }

    static double[] sample(DecodedFrame frame, int stride) {
        int rows = (frame.height() + stride - 1) / stride;
        int cols = (frame.width() + stride - 1) / stride;
        int channels = frame.channels();
        NdValue pixels = frame.pixels();

        double[] out = new double[rows * cols * channels];
        int n = 0;
        for (int r = 0; r < frame.height(); r += stride) {
            for (int c = 0; c < frame.width(); c += stride) {
                int base = frame.index(r, c, 0);
                for (int ch = 0; ch < channels; ch++) {
                    out[n++] = pixels.getDouble(base + ch);
                }
            }
        }
        return out;
    }

    /**
     * Percentile of an ascending array with linear interpolation.
     *
     * @param q percentile in [0, 100]
     */
    static double percentile(double[] sorted, double q) {
        if (sorted.length == 0) {
            return Double.NaN;
        }
        double rank = q / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(rank);
        int hi = Math.min(lo + 1, sorted.length - 1);
        double frac = rank - lo;
        if (frac == 0.0 || lo == hi) {
            return sorted[lo];
        }
        return sorted[lo] + frac * (sorted[hi] - sorted[lo]);
    }

    private static ContrastWindow finiteMinMax(double[] sample) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : sample) {
            if (!Double.isFinite(v)) {
                continue;
            }
            if (v < min) min = v;
            if (v > max) max = v;
        }
        if (min > max) {
            return new ContrastWindow(Double.NaN, Double.NaN);
        }
        return new ContrastWindow(min, max);
    }
}

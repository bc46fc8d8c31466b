package com.questrail.pvstream.display;

import com.questrail.pvstream.model.DecodedFrame;
import com.questrail.pvstream.ntnd.model.NdValue;

/**
 * Flat-field correction: {@code out = img / max(flat, 1e-6) * mean(flat)}.
 *
 * <p>Applied only when the reference has exactly the frame's shape; otherwise
 * the frame passes through. Integral results are rounded and clipped to the
 * source type's range.</p>
 */
public final class FlatFieldCorrector {

    public static final double EPSILON = 1e-6;

    private FlatFieldCorrector() {}

    public static boolean applies(DecodedFrame frame, DecodedFrame flat) {
        return flat != null && frame.sameShape(flat);
    }

    public static DecodedFrame apply(DecodedFrame frame, DecodedFrame flat) {
        if (!applies(frame, flat)) {
            return frame;
        }

        NdValue img = frame.pixels();
        NdValue ref = flat.pixels();
        int n = img.length();

        double mean = 0.0;
        for (int i = 0; i < n; i++) {
            mean += ref.getDouble(i);
        }
        mean /= n;

        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = img.getDouble(i) / Math.max(ref.getDouble(i), EPSILON) * mean;
        }
        return frame.withPixels(NdValue.fromDoubles(frame.dtype(), out));
    }
}

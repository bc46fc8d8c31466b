package com.questrail.pvstream.display;

import com.questrail.pvstream.api.ColorMode;
import com.questrail.pvstream.model.DecodedFrame;
import com.questrail.pvstream.ntnd.model.NdValue;

/**
 * Rec. 709 luminance of a 3-channel frame:
 * {@code 0.2126 R + 0.7152 G + 0.0722 B}, rounded back to the source type.
 * Single-channel frames are returned as they are.
 */
public final class LuminanceConverter {

    public static final double RED = 0.2126;
    public static final double GREEN = 0.7152;
    public static final double BLUE = 0.0722;

    private LuminanceConverter() {}

    public static DecodedFrame toLuminance(DecodedFrame frame) {
        if (!frame.isColor()) {
            return frame;
        }
        NdValue rgb = frame.pixels();
        int pixels = frame.width() * frame.height();
        double[] out = new double[pixels];
        for (int p = 0, i = 0; p < pixels; p++, i += 3) {
            out[p] = RED * rgb.getDouble(i) + GREEN * rgb.getDouble(i + 1) + BLUE * rgb.getDouble(i + 2);
        }
        return frame.withPixels(frame.width(), frame.height(), 1, ColorMode.MONO,
            NdValue.fromDoubles(frame.dtype(), out));
    }
}

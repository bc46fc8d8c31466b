package com.questrail.pvstream.display;

import com.questrail.pvstream.model.DecodedFrame;

/**
 * Geometric view operations, applied in a fixed order:
 * decimate, transpose, horizontal flip, vertical flip.
 *
 * <p>The whole sequence is one index gather; the source frame is never
 * modified. Decimation is plain striding ({@code [::b, ::b]}), not filtering.</p>
 */
public final class ViewTransforms {

    private ViewTransforms() {}

    public static DecodedFrame apply(DecodedFrame frame, int decimation,
                                     boolean transpose, boolean flipHorizontal, boolean flipVertical) {
        if (decimation < 1) {
            throw new IllegalArgumentException("decimation must be >= 1, got " + decimation);
        }
        if (decimation == 1 && !transpose && !flipHorizontal && !flipVertical) {
            return frame;
        }

        int decimatedHeight = (frame.height() + decimation - 1) / decimation;
        int decimatedWidth = (frame.width() + decimation - 1) / decimation;
        int outHeight = transpose ? decimatedWidth : decimatedHeight;
        int outWidth = transpose ? decimatedHeight : decimatedWidth;
        int channels = frame.channels();

        int[] indices = new int[outHeight * outWidth * channels];
        int n = 0;
        for (int r = 0; r < outHeight; r++) {
            int rv = flipVertical ? outHeight - 1 - r : r;
            for (int c = 0; c < outWidth; c++) {
                int cv = flipHorizontal ? outWidth - 1 - c : c;
                int dr = transpose ? cv : rv;
                int dc = transpose ? rv : cv;
                int base = frame.index(dr * decimation, dc * decimation, 0);
                for (int k = 0; k < channels; k++) {
                    indices[n++] = base + k;
                }
            }
        }
        return frame.withPixels(outWidth, outHeight, channels, frame.colorMode(), frame.pixels().gather(indices));
    }

    public static DecodedFrame decimate(DecodedFrame frame, int decimation) {
        return apply(frame, decimation, false, false, false);
    }

    public static DecodedFrame transpose(DecodedFrame frame) {
        return apply(frame, 1, true, false, false);
    }

    public static DecodedFrame flipHorizontal(DecodedFrame frame) {
        return apply(frame, 1, false, true, false);
    }

    public static DecodedFrame flipVertical(DecodedFrame frame) {
        return apply(frame, 1, false, false, true);
    }

    /**
     * Automatic decimation for a viewport: the largest integer factor that
     * still leaves the frame at least as large as the viewport along one axis.
     */
    public static int autoDecimation(int frameHeight, int frameWidth, int viewportHeight, int viewportWidth) {
        int byRows = frameHeight / Math.max(1, viewportHeight);
        int byCols = frameWidth / Math.max(1, viewportWidth);
        return Math.max(1, Math.min(byRows, byCols));
    }
}

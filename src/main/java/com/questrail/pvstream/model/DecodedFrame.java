package com.questrail.pvstream.model;

import com.questrail.pvstream.api.ColorMode;
import com.questrail.pvstream.api.ScalarType;
import com.questrail.pvstream.ntnd.model.NdValue;

import java.time.Instant;
import java.util.Objects;

/**
 * DecodedFrame
 * =============================================================================
 * Typed in-memory image in row-major {@code (height, width, channels)} order.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code width >= 1}, {@code height >= 1}</li>
 *   <li>{@code channels} is 1 or 3, and 3 only for RGB colour modes</li>
 *   <li>{@code pixels.length() == width * height * channels}</li>
 * </ul>
 *
 * <h2>Ownership</h2>
 * The pixel buffer belongs to whoever currently holds the frame: the queue
 * after publish, the display pump after take. Transformations build new frames
 * with {@link #withPixels(int, int, int, ColorMode, NdValue)} rather than
 * writing in place.
 */
public record DecodedFrame(
        int width,
        int height,
        int channels,
        ColorMode colorMode,
        NdValue pixels,
        long uniqueId,
        Instant captureTimestamp
) {
    public DecodedFrame {
        Objects.requireNonNull(colorMode, "colorMode");
        Objects.requireNonNull(pixels, "pixels");
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("frame must be at least 1x1, got " + width + "x" + height);
        }
        if (channels != 1 && channels != 3) {
            throw new IllegalArgumentException("channels must be 1 or 3, got " + channels);
        }
        if (channels == 3 && !colorMode.isRgb()) {
            throw new IllegalArgumentException("3-channel frame requires an RGB colour mode, got " + colorMode);
        }
        long expected = (long) width * height * channels;
        if (pixels.length() != expected) {
            throw new IllegalArgumentException(
                    "pixel count " + pixels.length() + " does not match " + width + "x" + height + "x" + channels);
        }
    }

    public ScalarType dtype() {
        return pixels.type();
    }

    public boolean isColor() {
        return channels == 3;
    }

    public long byteSize() {
        return pixels.byteSize();
    }

    /** Flat index of {@code (row, col, channel)}. */
    public int index(int row, int col, int channel) {
        return (row * width + col) * channels + channel;
    }

    public double valueAt(int row, int col, int channel) {
        return pixels.getDouble(index(row, col, channel));
    }

    /** True when both frames have the same height, width and channel count. */
    public boolean sameShape(DecodedFrame other) {
        return other != null
                && other.width == width
                && other.height == height
                && other.channels == channels;
    }

    /** Same identity (uid, timestamp), new geometry and pixels. */
    public DecodedFrame withPixels(int newWidth, int newHeight, int newChannels, ColorMode newMode, NdValue newPixels) {
        return new DecodedFrame(newWidth, newHeight, newChannels, newMode, newPixels, uniqueId, captureTimestamp);
    }

    /** Same geometry, new pixels (possibly of another scalar type). */
    public DecodedFrame withPixels(NdValue newPixels) {
        return new DecodedFrame(width, height, channels, colorMode, newPixels, uniqueId, captureTimestamp);
    }
}

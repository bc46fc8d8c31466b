package com.questrail.pvstream.ntnd.codec.impl;

import com.questrail.pvstream.api.ColorMode;
import com.questrail.pvstream.model.DecodedFrame;
import com.questrail.pvstream.ntnd.codec.FrameDecodeException;
import com.questrail.pvstream.ntnd.codec.FrameDecodeException.Reason;
import com.questrail.pvstream.ntnd.codec.FrameDecoder;
import com.questrail.pvstream.ntnd.model.NdAttribute;
import com.questrail.pvstream.ntnd.model.NdDimension;
import com.questrail.pvstream.ntnd.model.NdValue;
import com.questrail.pvstream.ntnd.model.RawFrame;

import java.util.List;
import java.util.Objects;

/**
 * DefaultFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link FrameDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>ColorMode lookup (absent, non-numeric or unknown means MONO)</li>
 *   <li>Payload check ({@link Reason#EMPTY_PAYLOAD})</li>
 *   <li>Dimension count check ({@link Reason#NO_DIMENSIONS})</li>
 *   <li>Layout selection and index gather</li>
 * </ol>
 *
 * <p><strong>Layouts</strong> ({@code dN} is {@code dimension[N].size}):</p>
 * <ul>
 *   <li>2 axes, MONO or BAYER: {@code width = d0}, {@code height = d1}, one channel</li>
 *   <li>2 axes, RGB mode: unsupported</li>
 *   <li>3 axes, RGB mode with a colour axis of 3: transposed to {@code (d?, d?, 3)},
 *       see {@link AxisPermutation}</li>
 *   <li>3 axes, anything else with exactly one axis of size 1: that axis is
 *       dropped, the other two are {@code (height, width)}, MONO</li>
 *   <li>everything else: unsupported</li>
 * </ul>
 *
 * <p>The decoded frame never aliases the raw payload.</p>
 */
public final class DefaultFrameDecoder implements FrameDecoder
{
    /** Attribute carrying the areaDetector colour mode. */
    public static final String COLOR_MODE_ATTRIBUTE = "ColorMode";

    @Override
    public DecodedFrame decode(RawFrame raw)
    {
        Objects.requireNonNull(raw, "raw");

        final ColorMode mode = colorModeOf(raw);

        final NdValue value = raw.value();
        if (value == null || value.length() == 0) {
            throw new FrameDecodeException(Reason.EMPTY_PAYLOAD,
                    "frame " + raw.uniqueId() + " carries no payload");
        }

        final List<NdDimension> dims = raw.dimensions();
        return switch (dims.size()) {
            case 0 -> throw new FrameDecodeException(Reason.NO_DIMENSIONS,
                    "frame " + raw.uniqueId() + " declares no dimensions");
            case 2 -> decode2d(raw, mode, value);
            case 3 -> decode3d(raw, mode, value);
            default -> throw new FrameDecodeException(Reason.UNSUPPORTED_LAYOUT,
                    "frame " + raw.uniqueId() + " has " + dims.size() + " dimensions");
        };
    }

    /**
     * Reads the {@code ColorMode} attribute. Never fails: anything that is not
     * a known mode code is treated as MONO.
     */
    static ColorMode colorModeOf(RawFrame raw)
    {
        for (NdAttribute attribute : raw.attributes()) {
            if (COLOR_MODE_ATTRIBUTE.equals(attribute.name())) {
                return attribute.asInt()
                        .flatMap(ColorMode::fromCode)
                        .orElse(ColorMode.MONO);
            }
        }
        return ColorMode.MONO;
    }

    private DecodedFrame decode2d(RawFrame raw, ColorMode mode, NdValue value)
    {
        if (mode.isRgb()) {
            throw new FrameDecodeException(Reason.UNSUPPORTED_LAYOUT,
                    "frame " + raw.uniqueId() + " is " + mode + " but has only 2 dimensions");
        }

        int width = raw.dimensions().get(0).size();
        int height = raw.dimensions().get(1).size();

        if ((long) width * height != value.length()) {
            // Declared shape is wrong; fall back to a plausible one.
            final int[] guessed = ShapeGuesser.guess(value.length())
                    .orElseThrow(() -> sizeMismatch(raw, value));
            height = guessed[0];
            width = guessed[1];
        }

        return frame(raw, width, height, 1, mode, value.copy());
    }

    private DecodedFrame decode3d(RawFrame raw, ColorMode mode, NdValue value)
    {
        final int[] shape = {
                raw.dimensions().get(0).size(),
                raw.dimensions().get(1).size(),
                raw.dimensions().get(2).size(),
        };

        if ((long) shape[0] * shape[1] * shape[2] != value.length()) {
            throw sizeMismatch(raw, value);
        }

        if (mode.isRgb() && shape[AxisPermutation.colorAxis(mode)] == 3) {
            final int[] axes = AxisPermutation.toDisplayAxes(mode);
            final int[] out = AxisPermutation.permutedShape(shape, axes);
            final NdValue pixels = value.gather(AxisPermutation.gatherIndices(shape, axes));
            return frame(raw, out[1], out[0], 3, mode, pixels);
        }

        // Singleton-axis fallback: [1, H, W], [H, 1, W] or [H, W, 1].
        int singletonAxis = -1;
        int singletons = 0;
        for (int k = 0; k < 3; k++) {
            if (shape[k] == 1) {
                singletonAxis = k;
                singletons++;
            }
        }
        if (singletons != 1) {
            throw new FrameDecodeException(Reason.UNSUPPORTED_LAYOUT,
                    "frame " + raw.uniqueId() + " has shape " + shape[0] + "x" + shape[1] + "x" + shape[2]
                            + " with colour mode " + mode);
        }

        int height = -1;
        int width = -1;
        for (int k = 0; k < 3; k++) {
            if (k == singletonAxis) {
                continue;
            }
            if (height < 0) {
                height = shape[k];
            }
            else {
                width = shape[k];
            }
        }
        return frame(raw, width, height, 1, ColorMode.MONO, value.copy());
    }

    private static DecodedFrame frame(RawFrame raw, int width, int height, int channels, ColorMode mode, NdValue pixels)
    {
        return new DecodedFrame(width, height, channels, mode, pixels, raw.uniqueId(), raw.timeStamp());
    }

    private static FrameDecodeException sizeMismatch(RawFrame raw, NdValue value)
    {
        return new FrameDecodeException(Reason.SIZE_MISMATCH,
                "frame " + raw.uniqueId() + " declares " + raw.declaredElementCount()
                        + " elements but carries " + value.length());
    }
}

package com.questrail.pvstream.ntnd.codec.impl;

import com.questrail.pvstream.api.ColorMode;
import com.questrail.pvstream.model.DecodedFrame;
import com.questrail.pvstream.ntnd.codec.FrameEncoder;
import com.questrail.pvstream.ntnd.model.NdAttribute;
import com.questrail.pvstream.ntnd.model.NdDimension;
import com.questrail.pvstream.ntnd.model.NdValue;
import com.questrail.pvstream.ntnd.model.RawFrame;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * DefaultFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link FrameEncoder}.
 *
 * <p>1-channel frames go out as {@code [width, height]} with the pixel buffer
 * unchanged. 3-channel frames are transposed from {@code (height, width, 3)}
 * into the requested RGB wire layout using the inverse of the decoder's axis
 * permutation. A {@code ColorMode} attribute is always attached.</p>
 */
public final class DefaultFrameEncoder implements FrameEncoder
{
    @Override
    public RawFrame encode(DecodedFrame frame, ColorMode layout)
    {
        Objects.requireNonNull(frame, "frame");
        Objects.requireNonNull(layout, "layout");

        final List<NdDimension> dims = new ArrayList<>(3);
        final NdValue value;

        if (frame.channels() == 1) {
            if (layout.isRgb()) {
                throw new IllegalArgumentException("1-channel frame cannot be encoded as " + layout);
            }
            dims.add(NdDimension.of(frame.width()));
            dims.add(NdDimension.of(frame.height()));
            value = frame.pixels().copy();
        }
        else {
            if (!layout.isRgb()) {
                throw new IllegalArgumentException("3-channel frame cannot be encoded as " + layout);
            }
            final int[] displayShape = {frame.height(), frame.width(), 3};
            final int[] toWire = AxisPermutation.inverse(AxisPermutation.toDisplayAxes(layout));
            final int[] wireShape = AxisPermutation.permutedShape(displayShape, toWire);
            value = frame.pixels().gather(AxisPermutation.gatherIndices(displayShape, toWire));
            for (int size : wireShape) {
                dims.add(NdDimension.of(size));
            }
        }

        return new RawFrame(
                frame.uniqueId(),
                dims,
                value,
                List.of(NdAttribute.of(DefaultFrameDecoder.COLOR_MODE_ATTRIBUTE, layout.code())),
                frame.captureTimestamp(),
                "");
    }
}

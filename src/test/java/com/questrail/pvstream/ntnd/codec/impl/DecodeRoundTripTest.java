package com.questrail.pvstream.ntnd.codec.impl;

import com.questrail.pvstream.api.ColorMode;
import com.questrail.pvstream.api.ScalarType;
import com.questrail.pvstream.model.DecodedFrame;
import com.questrail.pvstream.model.FrameFixtures;
import com.questrail.pvstream.ntnd.model.NdValue;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DecodeRoundTripTest
 * -----------------------------------------------------------------------------
 * Every scalar kind in every layout decodes back to the exact bits that were
 * encoded, including unsigned values with the top bit set and IEEE special
 * values (signed zero, subnormals, infinities).
 */
final class DecodeRoundTripTest
{
    private static final int WIDTH = 4;
    private static final int HEIGHT = 3;

    private final DefaultFrameEncoder encoder = new DefaultFrameEncoder();
    private final DefaultFrameDecoder decoder = new DefaultFrameDecoder();

    static Stream<Arguments> kindsAndLayouts()
    {
        List<Arguments> out = new ArrayList<>();
        for (ScalarType type : ScalarType.values()) {
            for (ColorMode layout : List.of(ColorMode.MONO, ColorMode.RGB1, ColorMode.RGB2, ColorMode.RGB3)) {
                out.add(Arguments.of(type, layout));
            }
        }
        return out.stream();
    }

    @ParameterizedTest(name = "{0} {1}")
    @MethodSource("kindsAndLayouts")
    void decodeReproducesEncodedBits(ScalarType type, ColorMode layout)
    {
        int channels = layout.isRgb() ? 3 : 1;
        NdValue pixels = values(type, WIDTH * HEIGHT * channels);
        DecodedFrame frame = new DecodedFrame(WIDTH, HEIGHT, channels, layout, pixels, 42L, FrameFixtures.T0);

        DecodedFrame back = decoder.decode(encoder.encode(frame, layout));

        assertEquals(WIDTH, back.width());
        assertEquals(HEIGHT, back.height());
        assertEquals(channels, back.channels());
        assertEquals(layout, back.colorMode());
        assertEquals(type, back.dtype());
        assertEquals(42L, back.uniqueId());
        assertEquals(FrameFixtures.T0, back.captureTimestamp());
        for (int i = 0; i < pixels.length(); i++) {
            assertEquals(bits(pixels, i), bits(back.pixels(), i), "element " + i);
        }
    }

    /**
     * Distinct values per index, with the kind's awkward values placed at the
     * front so they land on different axes in the RGB layouts.
     */
    private static NdValue values(ScalarType type, int n)
    {
        switch (type) {
            case INT8:
            case UINT8: {
                byte[] d = new byte[n];
                for (int i = 0; i < n; i++) d[i] = (byte) (i * 7 + 3);
                d[0] = (byte) 0xFF;
                d[1] = (byte) 0x80;
                d[2] = 0x7F;
                return type == ScalarType.INT8 ? new NdValue.Int8Values(d) : new NdValue.UInt8Values(d);
            }
            case INT16:
            case UINT16: {
                short[] d = new short[n];
                for (int i = 0; i < n; i++) d[i] = (short) (i * 1021 + 5);
                d[0] = (short) 0xFFFF;
                d[1] = (short) 0x8000;
                d[2] = 0x7FFF;
                return type == ScalarType.INT16 ? new NdValue.Int16Values(d) : new NdValue.UInt16Values(d);
            }
            case INT32:
            case UINT32: {
                int[] d = new int[n];
                for (int i = 0; i < n; i++) d[i] = i * 65_537 + 11;
                d[0] = 0xFFFFFFFF;
                d[1] = 0x80000000;
                d[2] = 0x7FFFFFFF;
                d[3] = 0x80000001;
                return type == ScalarType.INT32 ? new NdValue.Int32Values(d) : new NdValue.UInt32Values(d);
            }
            case INT64:
            case UINT64: {
                long[] d = new long[n];
                for (int i = 0; i < n; i++) d[i] = i * 4_294_967_311L + 13;
                d[0] = 0xFFFFFFFFFFFFFFFFL;
                d[1] = 0x8000000000000000L;
                d[2] = 0x7FFFFFFFFFFFFFFFL;
                d[3] = 0x8000000000000001L;
                return type == ScalarType.INT64 ? new NdValue.Int64Values(d) : new NdValue.UInt64Values(d);
            }
            case FLOAT32: {
                float[] d = new float[n];
                for (int i = 0; i < n; i++) d[i] = i * 0.37f - 2.5f;
                d[0] = -0.0f;
                d[1] = Float.MIN_VALUE;
                d[2] = Float.MAX_VALUE;
                d[3] = Float.NEGATIVE_INFINITY;
                d[4] = 0.1f;
                return new NdValue.Float32Values(d);
            }
            case FLOAT64: {
                double[] d = new double[n];
                for (int i = 0; i < n; i++) d[i] = i * 0.37 - 2.5;
                d[0] = -0.0;
                d[1] = Double.MIN_VALUE;
                d[2] = Double.MAX_VALUE;
                d[3] = Double.POSITIVE_INFINITY;
                d[4] = 0.1;
                return new NdValue.Float64Values(d);
            }
            default:
                throw new IllegalArgumentException("unhandled " + type);
        }
    }

    /** Raw storage bits of element {@code i}, independent of signedness. */
    private static long bits(NdValue v, int i)
    {
        if (v instanceof NdValue.Int8Values x) return x.data()[i];
        if (v instanceof NdValue.UInt8Values x) return x.data()[i];
        if (v instanceof NdValue.Int16Values x) return x.data()[i];
        if (v instanceof NdValue.UInt16Values x) return x.data()[i];
        if (v instanceof NdValue.Int32Values x) return x.data()[i];
        if (v instanceof NdValue.UInt32Values x) return x.data()[i];
        if (v instanceof NdValue.Int64Values x) return x.data()[i];
        if (v instanceof NdValue.UInt64Values x) return x.data()[i];
        if (v instanceof NdValue.Float32Values x) return Float.floatToRawIntBits(x.data()[i]);
        if (v instanceof NdValue.Float64Values x) return Double.doubleToRawLongBits(x.data()[i]);
        throw new IllegalArgumentException("unhandled " + v.type());
    }
}

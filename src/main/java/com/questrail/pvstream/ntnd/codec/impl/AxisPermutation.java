package com.questrail.pvstream.ntnd.codec.impl;

import com.questrail.pvstream.api.ColorMode;

/**
 * AxisPermutation
 * -----------------------------------------------------------------------------
 * Index arithmetic for "reshape in C order, then transpose".
 *
 * <p>A flat buffer read with shape {@code (d0, d1, d2)} has strides
 * {@code (d1*d2, d2, 1)}. Transposing by {@code axes} produces an array whose
 * shape is {@code (d[axes[0]], d[axes[1]], d[axes[2]])}; output element
 * {@code (i0, i1, i2)} comes from flat source index
 * {@code i0*stride[axes[0]] + i1*stride[axes[1]] + i2*stride[axes[2]]}.</p>
 *
 * <p>Wire layouts and the axes that bring them to {@code (NY, NX, 3)}:</p>
 * <ul>
 *   <li>RGB1 {@code (3, NX, NY)}: {@code (2, 1, 0)}</li>
 *   <li>RGB2 {@code (NX, 3, NY)}: {@code (2, 0, 1)}</li>
 *   <li>RGB3 {@code (NX, NY, 3)}: {@code (1, 0, 2)}</li>
 * </ul>
 */
final class AxisPermutation
{
    private static final int[] RGB1_AXES = {2, 1, 0};
    private static final int[] RGB2_AXES = {2, 0, 1};
    private static final int[] RGB3_AXES = {1, 0, 2};

    private AxisPermutation() {}

    /** Axes that take the wire layout of {@code mode} to {@code (NY, NX, 3)}. */
    static int[] toDisplayAxes(ColorMode mode)
    {
        return switch (mode) {
            case RGB1 -> RGB1_AXES.clone();
            case RGB2 -> RGB2_AXES.clone();
            case RGB3 -> RGB3_AXES.clone();
            default -> throw new IllegalArgumentException("no axis permutation for " + mode);
        };
    }

    /** Index of the colour axis in the wire shape of {@code mode}. */
    static int colorAxis(ColorMode mode)
    {
        return switch (mode) {
            case RGB1 -> 0;
            case RGB2 -> 1;
            case RGB3 -> 2;
            default -> throw new IllegalArgumentException("no colour axis for " + mode);
        };
    }

    /** {@code inverse[axes[k]] = k}. */
    static int[] inverse(int[] axes)
    {
        final int[] inverse = new int[axes.length];
        for (int k = 0; k < axes.length; k++) {
            inverse[axes[k]] = k;
        }
        return inverse;
    }

    /** Shape after transposing {@code shape} by {@code axes}. */
    static int[] permutedShape(int[] shape, int[] axes)
    {
        final int[] out = new int[axes.length];
        for (int k = 0; k < axes.length; k++) {
            out[k] = shape[axes[k]];
        }
        return out;
    }

    /**
     * For every flat index of the transposed array, the flat index in the
     * C-ordered source it reads from.
     *
     * @param shape source shape, three axes
     * @param axes  permutation of {@code {0, 1, 2}}
     */
    static int[] gatherIndices(int[] shape, int[] axes)
    {
        if (shape.length != 3 || axes.length != 3) {
            throw new IllegalArgumentException("three axes required");
        }

        final int[] stride = {shape[1] * shape[2], shape[2], 1};
        final int[] out = permutedShape(shape, axes);

        final int s0 = stride[axes[0]];
        final int s1 = stride[axes[1]];
        final int s2 = stride[axes[2]];

        final int[] indices = new int[out[0] * out[1] * out[2]];
        int n = 0;
        for (int i0 = 0; i0 < out[0]; i0++) {
            final int base0 = i0 * s0;
            for (int i1 = 0; i1 < out[1]; i1++) {
                final int base1 = base0 + i1 * s1;
                for (int i2 = 0; i2 < out[2]; i2++) {
                    indices[n++] = base1 + i2 * s2;
                }
            }
        }
        return indices;
    }
}

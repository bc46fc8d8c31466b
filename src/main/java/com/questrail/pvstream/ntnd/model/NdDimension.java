package com.questrail.pvstream.ntnd.model;

/**
 * One entry of an NTNDArray {@code dimension[]} list.
 *
 * <p>Only {@code size} drives decoding. The remaining fields describe how the
 * detector region maps onto the full sensor and are carried through unchanged.</p>
 *
 * @param size     number of elements along this axis
 * @param offset   region offset on the full sensor
 * @param fullSize full sensor extent along this axis
 * @param binning  binning factor, at least 1
 * @param reverse  whether the detector reversed this axis
 */
public record NdDimension(int size, int offset, int fullSize, int binning, boolean reverse) {

    public NdDimension {
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0, got " + size);
        }
        if (binning < 1) {
            throw new IllegalArgumentException("binning must be >= 1, got " + binning);
        }
    }

    /** Unbinned, unreversed axis covering the whole extent. */
    public static NdDimension of(int size) {
        return new NdDimension(size, 0, size, 1, false);
    }
}

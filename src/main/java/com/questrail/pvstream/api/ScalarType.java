package com.questrail.pvstream.api;

import java.util.Optional;

/**
 * ScalarType
 * =============================================================================
 * Numeric element kinds carried by an NTNDArray {@code value} union.
 *
 * <p>Each constant knows the name of the union field it travels in
 * ({@code ubyteValue}, {@code ushortValue}, ...), its element size in bytes and
 * the representable range used when values computed in floating point are
 * written back (luminance, flat-field, processors).</p>
 *
 * <p>The 64-bit integer ranges are reported as the nearest {@code double}; they
 * are only used for clamping display values.</p>
 */
public enum ScalarType {
    INT8("byteValue", 1, true, Byte.MIN_VALUE, Byte.MAX_VALUE),
    UINT8("ubyteValue", 1, true, 0, 255),
    INT16("shortValue", 2, true, Short.MIN_VALUE, Short.MAX_VALUE),
    UINT16("ushortValue", 2, true, 0, 65535),
    INT32("intValue", 4, true, Integer.MIN_VALUE, Integer.MAX_VALUE),
    UINT32("uintValue", 4, true, 0, 4294967295.0),
    INT64("longValue", 8, true, Long.MIN_VALUE, Long.MAX_VALUE),
    UINT64("ulongValue", 8, true, 0, 18446744073709551615.0),
    FLOAT32("floatValue", 4, false, -Float.MAX_VALUE, Float.MAX_VALUE),
    FLOAT64("doubleValue", 8, false, -Double.MAX_VALUE, Double.MAX_VALUE);

    private final String unionFieldName;
    private final int elementSize;
    private final boolean integral;
    private final double minValue;
    private final double maxValue;

    ScalarType(String unionFieldName, int elementSize, boolean integral, double minValue, double maxValue) {
        this.unionFieldName = unionFieldName;
        this.elementSize = elementSize;
        this.integral = integral;
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    /** Name of the NTNDArray union field carrying this kind, e.g. {@code ushortValue}. */
    public String unionFieldName() {
        return unionFieldName;
    }

    /** Size of one element in bytes. */
    public int elementSize() {
        return elementSize;
    }

    public boolean isIntegral() {
        return integral;
    }

    public double minValue() {
        return minValue;
    }

    public double maxValue() {
        return maxValue;
    }

    /**
     * Converts a computed value back into this kind's domain: integral kinds
     * are rounded half-up and clipped to range, NaN becomes 0. Floating kinds
     * pass through unchanged.
     */
    public double coerce(double value) {
        if (!integral) {
            return value;
        }
        if (Double.isNaN(value)) {
            return 0.0;
        }
        double rounded = Math.floor(value + 0.5);
        return Math.max(minValue, Math.min(maxValue, rounded));
    }

    /**
     * Looks up a kind by its union field name.
     */
    public static Optional<ScalarType> fromUnionFieldName(String name) {
        for (ScalarType type : values()) {
            if (type.unionFieldName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}

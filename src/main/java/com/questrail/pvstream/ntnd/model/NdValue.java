package com.questrail.pvstream.ntnd.model;

import com.questrail.pvstream.api.ScalarType;

import java.util.Objects;

/**
 * NdValue
 * =============================================================================
 * The selected member of an NTNDArray {@code value} union: a flat, C-ordered
 * element buffer of one {@link ScalarType}.
 *
 * <h2>Unsigned kinds</h2>
 * Java has no unsigned primitives, so the unsigned variants reuse the signed
 * array of the same width and reinterpret the bits in {@link #getDouble(int)}.
 * The stored bits are exactly the wire bits.
 *
 * <h2>Ownership</h2>
 * Records wrap the array without copying. Producers hand the array over and do
 * not touch it afterwards; {@link #copy()} gives an independent buffer.
 */
public sealed interface NdValue
        permits NdValue.Int8Values,
                NdValue.UInt8Values,
                NdValue.Int16Values,
                NdValue.UInt16Values,
                NdValue.Int32Values,
                NdValue.UInt32Values,
                NdValue.Int64Values,
                NdValue.UInt64Values,
                NdValue.Float32Values,
                NdValue.Float64Values {

    ScalarType type();

    /** Number of elements. */
    int length();

    /** Element {@code index} widened to double, unsigned kinds interpreted as unsigned. */
    double getDouble(int index);

    /**
     * New buffer of the same kind where element {@code i} is this buffer's
     * element {@code indices[i]}.
     */
    NdValue gather(int[] indices);

    /** Deep copy. */
    NdValue copy();

    default double[] toDoubles() {
        double[] out = new double[length()];
        for (int i = 0; i < out.length; i++) {
            out[i] = getDouble(i);
        }
        return out;
    }

    default long byteSize() {
        return (long) length() * type().elementSize();
    }

    /**
     * Builds a buffer of {@code type} from computed values. Each value is
     * coerced with {@link ScalarType#coerce(double)} first.
     */
    static NdValue fromDoubles(ScalarType type, double[] values) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(values, "values");
        int n = values.length;
        switch (type) {
            case INT8: {
                byte[] d = new byte[n];
                for (int i = 0; i < n; i++) d[i] = (byte) type.coerce(values[i]);
                return new Int8Values(d);
            }
            case UINT8: {
                byte[] d = new byte[n];
                for (int i = 0; i < n; i++) d[i] = (byte) (int) type.coerce(values[i]);
                return new UInt8Values(d);
            }
            case INT16: {
                short[] d = new short[n];
                for (int i = 0; i < n; i++) d[i] = (short) type.coerce(values[i]);
                return new Int16Values(d);
            }
            case UINT16: {
                short[] d = new short[n];
                for (int i = 0; i < n; i++) d[i] = (short) (int) type.coerce(values[i]);
                return new UInt16Values(d);
            }
            case INT32: {
                int[] d = new int[n];
                for (int i = 0; i < n; i++) d[i] = (int) type.coerce(values[i]);
                return new Int32Values(d);
            }
            case UINT32: {
                int[] d = new int[n];
                for (int i = 0; i < n; i++) d[i] = (int) (long) type.coerce(values[i]);
                return new UInt32Values(d);
            }
            case INT64: {
                long[] d = new long[n];
                for (int i = 0; i < n; i++) d[i] = (long) type.coerce(values[i]);
                return new Int64Values(d);
            }
            case UINT64: {
                long[] d = new long[n];
                for (int i = 0; i < n; i++) d[i] = unsignedLongBits(type.coerce(values[i]));
                return new UInt64Values(d);
            }
            case FLOAT32: {
                float[] d = new float[n];
                for (int i = 0; i < n; i++) d[i] = (float) values[i];
                return new Float32Values(d);
            }
            case FLOAT64:
                return new Float64Values(values.clone());
            default:
                throw new IllegalArgumentException("unhandled scalar type " + type);
        }
    }

    private static long unsignedLongBits(double value) {
        if (value < 9.223372036854775807E18) {
            return (long) value;
        }
        return (long) (value - 9.223372036854775808E18) + Long.MIN_VALUE;
    }

    // ---------------------------------------------------------------------
    // Variants
    // ---------------------------------------------------------------------

    record Int8Values(byte[] data) implements NdValue {
        public Int8Values {
            Objects.requireNonNull(data, "data");
        }

        @Override public ScalarType type() { return ScalarType.INT8; }
        @Override public int length() { return data.length; }
        @Override public double getDouble(int index) { return data[index]; }

        @Override
        public NdValue gather(int[] indices) {
            byte[] out = new byte[indices.length];
            for (int i = 0; i < indices.length; i++) out[i] = data[indices[i]];
            return new Int8Values(out);
        }

        @Override public NdValue copy() { return new Int8Values(data.clone()); }
    }

    record UInt8Values(byte[] data) implements NdValue {
        public UInt8Values {
            Objects.requireNonNull(data, "data");
        }

        @Override public ScalarType type() { return ScalarType.UINT8; }
        @Override public int length() { return data.length; }
        @Override public double getDouble(int index) { return data[index] & 0xFF; }

        @Override
        public NdValue gather(int[] indices) {
            byte[] out = new byte[indices.length];
            for (int i = 0; i < indices.length; i++) out[i] = data[indices[i]];
            return new UInt8Values(out);
        }

        @Override public NdValue copy() { return new UInt8Values(data.clone()); }
    }

    record Int16Values(short[] data) implements NdValue {
        public Int16Values {
            Objects.requireNonNull(data, "data");
        }

        @Override public ScalarType type() { return ScalarType.INT16; }
        @Override public int length() { return data.length; }
        @Override public double getDouble(int index) { return data[index]; }

        @Override
        public NdValue gather(int[] indices) {
            short[] out = new short[indices.length];
            for (int i = 0; i < indices.length; i++) out[i] = data[indices[i]];
            return new Int16Values(out);
        }

        @Override public NdValue copy() { return new Int16Values(data.clone()); }
    }

    record UInt16Values(short[] data) implements NdValue {
        public UInt16Values {
            Objects.requireNonNull(data, "data");
        }

        @Override public ScalarType type() { return ScalarType.UINT16; }
        @Override public int length() { return data.length; }
        @Override public double getDouble(int index) { return data[index] & 0xFFFF; }

        @Override
        public NdValue gather(int[] indices) {
            short[] out = new short[indices.length];
            for (int i = 0; i < indices.length; i++) out[i] = data[indices[i]];
            return new UInt16Values(out);
        }

        @Override public NdValue copy() { return new UInt16Values(data.clone()); }
    }

    record Int32Values(int[] data) implements NdValue {
        public Int32Values {
            Objects.requireNonNull(data, "data");
        }

        @Override public ScalarType type() { return ScalarType.INT32; }
        @Override public int length() { return data.length; }
        @Override public double getDouble(int index) { return data[index]; }

        @Override
        public NdValue gather(int[] indices) {
            int[] out = new int[indices.length];
            for (int i = 0; i < indices.length; i++) out[i] = data[indices[i]];
            return new Int32Values(out);
        }

        @Override public NdValue copy() { return new Int32Values(data.clone()); }
    }

    record UInt32Values(int[] data) implements NdValue {
        public UInt32Values {
            Objects.requireNonNull(data, "data");
        }

        @Override public ScalarType type() { return ScalarType.UINT32; }
        @Override public int length() { return data.length; }
        @Override public double getDouble(int index) { return Integer.toUnsignedLong(data[index]); }

        @Override
        public NdValue gather(int[] indices) {
            int[] out = new int[indices.length];
            for (int i = 0; i < indices.length; i++) out[i] = data[indices[i]];
            return new UInt32Values(out);
        }

        @Override public NdValue copy() { return new UInt32Values(data.clone()); }
    }

    record Int64Values(long[] data) implements NdValue {
        public Int64Values {
            Objects.requireNonNull(data, "data");
        }

        @Override public ScalarType type() { return ScalarType.INT64; }
        @Override public int length() { return data.length; }
        @Override public double getDouble(int index) { return data[index]; }

        @Override
        public NdValue gather(int[] indices) {
            long[] out = new long[indices.length];
            for (int i = 0; i < indices.length; i++) out[i] = data[indices[i]];
            return new Int64Values(out);
        }

        @Override public NdValue copy() { return new Int64Values(data.clone()); }
    }

    record UInt64Values(long[] data) implements NdValue {
        public UInt64Values {
            Objects.requireNonNull(data, "data");
        }

        @Override public ScalarType type() { return ScalarType.UINT64; }
        @Override public int length() { return data.length; }

        @Override
        public double getDouble(int index) {
            long v = data[index];
            if (v >= 0) {
                return v;
            }
            return (double) (v >>> 1) * 2.0 + (v & 1L);
        }

        @Override
        public NdValue gather(int[] indices) {
            long[] out = new long[indices.length];
            for (int i = 0; i < indices.length; i++) out[i] = data[indices[i]];
            return new UInt64Values(out);
        }

        @Override public NdValue copy() { return new UInt64Values(data.clone()); }
    }

    record Float32Values(float[] data) implements NdValue {
        public Float32Values {
            Objects.requireNonNull(data, "data");
        }

        @Override public ScalarType type() { return ScalarType.FLOAT32; }
        @Override public int length() { return data.length; }
        @Override public double getDouble(int index) { return data[index]; }

        @Override
        public NdValue gather(int[] indices) {
            float[] out = new float[indices.length];
            for (int i = 0; i < indices.length; i++) out[i] = data[indices[i]];
            return new Float32Values(out);
        }

        @Override public NdValue copy() { return new Float32Values(data.clone()); }
    }

    record Float64Values(double[] data) implements NdValue {
        public Float64Values {
            Objects.requireNonNull(data, "data");
        }

        @Override public ScalarType type() { return ScalarType.FLOAT64; }
        @Override public int length() { return data.length; }
        @Override public double getDouble(int index) { return data[index]; }

        @Override
        public NdValue gather(int[] indices) {
            double[] out = new double[indices.length];
            for (int i = 0; i < indices.length; i++) out[i] = data[indices[i]];
            return new Float64Values(out);
        }

        @Override public NdValue copy() { return new Float64Values(data.clone()); }
    }
}

package com.questrail.pvstream.transport.tcp.netty;

import com.questrail.pvstream.api.ScalarType;
import com.questrail.pvstream.ntnd.model.NdAttribute;
import com.questrail.pvstream.ntnd.model.NdDimension;
import com.questrail.pvstream.ntnd.model.NdValue;
import com.questrail.pvstream.ntnd.model.RawFrame;

import io.netty.buffer.ByteBuf;
import io.netty.handler.codec.CorruptedFrameException;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * NdWireCodec
 * -----------------------------------------------------------------------------
 * Binary body of one length-delimited message. All integers are big-endian.
 *
 * <pre>
 *   message   := type:u8 channel:str body
 *   SUBSCRIBE / UNSUBSCRIBE : no body
 *   FRAME     := uniqueId:i64
 *                hasTs:u8 [epochSecond:i64 nano:i32]
 *                descriptor:str
 *                ndims:u8 { size:i32 offset:i32 fullSize:i32 binning:i32 reverse:u8 }*
 *                nattrs:u16 { name:str kind:u8 value descriptor:str }*
 *                valueType:u8 (0xFF = no payload) [count:i32 element*]
 *   str       := length:u16 utf8-bytes
 * </pre>
 *
 * <p>Attribute value kinds: 0 null, 1 i64, 2 f64, 3 str, 4 bool. Other value
 * objects are sent as their string form. Value types are {@link ScalarType}
 * ordinals.</p>
 *
 * <p>Decoding rejects truncated input, trailing bytes, unknown codes and
 * element counts larger than the remaining bytes with
 * {@link CorruptedFrameException}.</p>
 */
final class NdWireCodec
{
    static final int NO_VALUE = 0xFF;
    static final int MAX_DIMENSIONS = 16;

    private static final int ATTR_NULL = 0;
    private static final int ATTR_LONG = 1;
    private static final int ATTR_DOUBLE = 2;
    private static final int ATTR_STRING = 3;
    private static final int ATTR_BOOLEAN = 4;

    private NdWireCodec() {}

    // ---------------------------------------------------------------------
    // Encode
    // ---------------------------------------------------------------------

    static void encode(NdWireMessage message, ByteBuf out)
    {
        if (message instanceof NdWireMessage.Subscribe s) {
            out.writeByte(NdWireMessage.SUBSCRIBE);
            writeString(out, s.channelName());
        }
        else if (message instanceof NdWireMessage.Unsubscribe u) {
            out.writeByte(NdWireMessage.UNSUBSCRIBE);
            writeString(out, u.channelName());
        }
        else if (message instanceof NdWireMessage.FrameUpdate f) {
            out.writeByte(NdWireMessage.FRAME);
            writeString(out, f.channelName());
            writeFrame(out, f.frame());
        }
        else {
            throw new IllegalArgumentException("unknown message " + message);
        }
    }

    private static void writeFrame(ByteBuf out, RawFrame frame)
    {
        out.writeLong(frame.uniqueId());

        final Instant ts = frame.timeStamp();
        if (ts == null) {
            out.writeByte(0);
        }
        else {
            out.writeByte(1);
            out.writeLong(ts.getEpochSecond());
            out.writeInt(ts.getNano());
        }

        writeString(out, frame.descriptor());

        out.writeByte(frame.dimensions().size());
        for (NdDimension d : frame.dimensions()) {
            out.writeInt(d.size());
            out.writeInt(d.offset());
            out.writeInt(d.fullSize());
            out.writeInt(d.binning());
            out.writeByte(d.reverse() ? 1 : 0);
        }

        out.writeShort(frame.attributes().size());
        for (NdAttribute a : frame.attributes()) {
            writeString(out, a.name());
            writeAttributeValue(out, a.value());
            writeString(out, a.descriptor());
        }

        writeValue(out, frame.value());
    }

    private static void writeAttributeValue(ByteBuf out, Object value)
    {
        if (value == null) {
            out.writeByte(ATTR_NULL);
        }
        else if (value instanceof Double || value instanceof Float) {
            out.writeByte(ATTR_DOUBLE);
            out.writeDouble(((Number) value).doubleValue());
        }
        else if (value instanceof Number n) {
            out.writeByte(ATTR_LONG);
            out.writeLong(n.longValue());
        }
        else if (value instanceof Boolean b) {
            out.writeByte(ATTR_BOOLEAN);
            out.writeByte(b ? 1 : 0);
        }
        else {
            out.writeByte(ATTR_STRING);
            writeString(out, value.toString());
        }
    }

    private static void writeValue(ByteBuf out, NdValue value)
    {
        if (value == null) {
            out.writeByte(NO_VALUE);
            return;
        }
        out.writeByte(value.type().ordinal());
        out.writeInt(value.length());

        if (value instanceof NdValue.Int8Values v) {
            out.writeBytes(v.data());
        }
        else if (value instanceof NdValue.UInt8Values v) {
            out.writeBytes(v.data());
        }
        else if (value instanceof NdValue.Int16Values v) {
            for (short s : v.data()) out.writeShort(s);
        }
        else if (value instanceof NdValue.UInt16Values v) {
            for (short s : v.data()) out.writeShort(s);
        }
        else if (value instanceof NdValue.Int32Values v) {
            for (int i : v.data()) out.writeInt(i);
        }
        else if (value instanceof NdValue.UInt32Values v) {
            for (int i : v.data()) out.writeInt(i);
        }
        else if (value instanceof NdValue.Int64Values v) {
            for (long l : v.data()) out.writeLong(l);
        }
        else if (value instanceof NdValue.UInt64Values v) {
            for (long l : v.data()) out.writeLong(l);
        }
        else if (value instanceof NdValue.Float32Values v) {
            for (float f : v.data()) out.writeFloat(f);
        }
        else if (value instanceof NdValue.Float64Values v) {
            for (double d : v.data()) out.writeDouble(d);
        }
    }

    private static void writeString(ByteBuf out, String s)
    {
        final byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > 0xFFFF) {
            throw new IllegalArgumentException("string too long for wire: " + bytes.length + " bytes");
        }
        out.writeShort(bytes.length);
        out.writeBytes(bytes);
    }

    // ---------------------------------------------------------------------
    // Decode
    // ---------------------------------------------------------------------

    /**
     * Decode one complete message body.
     *
     * @throws CorruptedFrameException if the body is malformed
     */
    static NdWireMessage decode(ByteBuf in)
    {
        try {
            final int type = in.readUnsignedByte();
            final String channel = readString(in);
            final NdWireMessage message = switch (type) {
                case NdWireMessage.SUBSCRIBE -> new NdWireMessage.Subscribe(channel);
                case NdWireMessage.UNSUBSCRIBE -> new NdWireMessage.Unsubscribe(channel);
                case NdWireMessage.FRAME -> new NdWireMessage.FrameUpdate(channel, readFrame(in));
                default -> throw new CorruptedFrameException("unknown message type " + type);
            };
            if (in.isReadable()) {
                throw new CorruptedFrameException(in.readableBytes() + " trailing bytes");
            }
            return message;
        }
        catch (IndexOutOfBoundsException e) {
            throw new CorruptedFrameException("truncated message", e);
        }
        catch (IllegalArgumentException e) {
            throw new CorruptedFrameException("invalid field: " + e.getMessage(), e);
        }
    }

    private static RawFrame readFrame(ByteBuf in)
    {
        final long uniqueId = in.readLong();

        Instant ts = null;
        if (in.readUnsignedByte() != 0) {
            final long seconds = in.readLong();
            final int nanos = in.readInt();
            ts = Instant.ofEpochSecond(seconds, nanos);
        }

        final String descriptor = readString(in);

        final int ndims = in.readUnsignedByte();
        if (ndims > MAX_DIMENSIONS) {
            throw new CorruptedFrameException("too many dimensions: " + ndims);
        }
        final List<NdDimension> dims = new ArrayList<>(ndims);
        for (int i = 0; i < ndims; i++) {
            dims.add(new NdDimension(in.readInt(), in.readInt(), in.readInt(), in.readInt(), in.readUnsignedByte() != 0));
        }

        final int nattrs = in.readUnsignedShort();
        final List<NdAttribute> attrs = new ArrayList<>(Math.min(nattrs, 64));
        for (int i = 0; i < nattrs; i++) {
            final String name = readString(in);
            final Object value = readAttributeValue(in);
            final String attrDescriptor = readString(in);
            attrs.add(new NdAttribute(name, value, attrDescriptor));
        }

        final NdValue value = readValue(in);
        return new RawFrame(uniqueId, dims, value, attrs, ts, descriptor);
    }

    private static Object readAttributeValue(ByteBuf in)
    {
        final int kind = in.readUnsignedByte();
        return switch (kind) {
            case ATTR_NULL -> null;
            case ATTR_LONG -> in.readLong();
            case ATTR_DOUBLE -> in.readDouble();
            case ATTR_STRING -> readString(in);
            case ATTR_BOOLEAN -> in.readUnsignedByte() != 0;
            default -> throw new CorruptedFrameException("unknown attribute kind " + kind);
        };
    }

    private static NdValue readValue(ByteBuf in)
    {
        final int code = in.readUnsignedByte();
        if (code == NO_VALUE) {
            return null;
        }
        final ScalarType[] types = ScalarType.values();
        if (code >= types.length) {
            throw new CorruptedFrameException("unknown value type " + code);
        }
        final ScalarType type = types[code];

        final int count = in.readInt();
        if (count < 0 || (long) count * type.elementSize() > in.readableBytes()) {
            throw new CorruptedFrameException("element count " + count + " exceeds message body");
        }

        switch (type) {
            case INT8:
            case UINT8: {
                final byte[] d = new byte[count];
                in.readBytes(d);
                return type == ScalarType.INT8 ? new NdValue.Int8Values(d) : new NdValue.UInt8Values(d);
            }
            case INT16:
            case UINT16: {
                final short[] d = new short[count];
                for (int i = 0; i < count; i++) d[i] = in.readShort();
                return type == ScalarType.INT16 ? new NdValue.Int16Values(d) : new NdValue.UInt16Values(d);
            }
            case INT32:
            case UINT32: {
                final int[] d = new int[count];
                for (int i = 0; i < count; i++) d[i] = in.readInt();
                return type == ScalarType.INT32 ? new NdValue.Int32Values(d) : new NdValue.UInt32Values(d);
            }
            case INT64:
            case UINT64: {
                final long[] d = new long[count];
                for (int i = 0; i < count; i++) d[i] = in.readLong();
                return type == ScalarType.INT64 ? new NdValue.Int64Values(d) : new NdValue.UInt64Values(d);
            }
            case FLOAT32: {
                final float[] d = new float[count];
                for (int i = 0; i < count; i++) d[i] = in.readFloat();
                return new NdValue.Float32Values(d);
            }
            case FLOAT64: {
                final double[] d = new double[count];
                for (int i = 0; i < count; i++) d[i] = in.readDouble();
                return new NdValue.Float64Values(d);
            }
            default:
                throw new CorruptedFrameException("unhandled value type " + type);
        }
    }

    private static String readString(ByteBuf in)
    {
        final int length = in.readUnsignedShort();
        if (length > in.readableBytes()) {
            throw new CorruptedFrameException("string length " + length + " exceeds message body");
        }
        final String s = in.toString(in.readerIndex(), length, StandardCharsets.UTF_8);
        in.skipBytes(length);
        return s;
    }
}

package com.routemq.amqp;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * AMQP 0-9-1 data type codec shared by the wire layer and the metadata store.
 * Strings and field tables are written exactly as they appear on the wire so
 * persisted records can be read back with the same decoder.
 */
public final class AmqpCodec {

    public static final int MAX_SHORT_STRING_LENGTH = 255;
    public static final int MAX_LONG_STRING_LENGTH = 256 * 1024;

    private AmqpCodec() {
    }

    public static ByteBuf encodeShortString(ByteBuf buf, String value) {
        if (value == null) value = "";
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > MAX_SHORT_STRING_LENGTH) {
            throw new IllegalArgumentException(
                "Short string too long: " + bytes.length + " bytes (max: " + MAX_SHORT_STRING_LENGTH + ")");
        }
        buf.writeByte(bytes.length);
        buf.writeBytes(bytes);
        return buf;
    }

    public static String decodeShortString(ByteBuf buf) {
        int length = buf.readUnsignedByte();
        if (buf.readableBytes() < length) {
            throw new IllegalArgumentException(
                "Buffer underflow: need " + length + " bytes but only " + buf.readableBytes() + " available");
        }
        byte[] bytes = new byte[length];
        buf.readBytes(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public static ByteBuf encodeLongString(ByteBuf buf, String value) {
        if (value == null) value = "";
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        buf.writeInt(bytes.length);
        buf.writeBytes(bytes);
        return buf;
    }

    public static String decodeLongString(ByteBuf buf) {
        int length = buf.readInt();
        if (length < 0 || length > MAX_LONG_STRING_LENGTH) {
            throw new IllegalArgumentException(
                "Invalid long string length: " + length + " (max: " + MAX_LONG_STRING_LENGTH + ")");
        }
        if (buf.readableBytes() < length) {
            throw new IllegalArgumentException(
                "Buffer underflow: need " + length + " bytes but only " + buf.readableBytes() + " available");
        }
        byte[] bytes = new byte[length];
        buf.readBytes(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Encode an AMQP field table. Entries are written in key order so that equal
     * tables always produce identical bytes.
     */
    public static void encodeTable(ByteBuf buf, Map<String, Object> table) {
        if (table == null || table.isEmpty()) {
            buf.writeInt(0);
            return;
        }

        ByteBuf tempBuf = Unpooled.buffer();
        try {
            for (Map.Entry<String, Object> entry : new TreeMap<>(table).entrySet()) {
                encodeShortString(tempBuf, entry.getKey());
                encodeFieldValue(tempBuf, entry.getValue());
            }
            buf.writeInt(tempBuf.readableBytes());
            buf.writeBytes(tempBuf);
        } finally {
            tempBuf.release();
        }
    }

    /**
     * Decode an AMQP field table: 4-byte length followed by entries.
     */
    public static Map<String, Object> decodeTable(ByteBuf buf) {
        Map<String, Object> table = new LinkedHashMap<>();

        int tableLength = buf.readInt();
        if (tableLength <= 0) {
            return table;
        }
        if (tableLength > buf.readableBytes()) {
            throw new IllegalArgumentException(
                "Table length exceeds available bytes: " + tableLength + " > " + buf.readableBytes());
        }

        int endIndex = buf.readerIndex() + tableLength;
        while (buf.readerIndex() < endIndex) {
            String key = decodeShortString(buf);
            table.put(key, decodeFieldValue(buf));
        }
        return table;
    }

    public static void encodeFieldValue(ByteBuf buf, Object value) {
        if (value == null) {
            buf.writeByte('V');
        } else if (value instanceof Boolean) {
            buf.writeByte('t');
            buf.writeByte((Boolean) value ? 1 : 0);
        } else if (value instanceof Byte) {
            buf.writeByte('b');
            buf.writeByte((Byte) value);
        } else if (value instanceof Short) {
            buf.writeByte('s');
            buf.writeShort((Short) value);
        } else if (value instanceof Integer) {
            buf.writeByte('I');
            buf.writeInt((Integer) value);
        } else if (value instanceof Long) {
            buf.writeByte('l');
            buf.writeLong((Long) value);
        } else if (value instanceof Float) {
            buf.writeByte('f');
            buf.writeFloat((Float) value);
        } else if (value instanceof Double) {
            buf.writeByte('d');
            buf.writeDouble((Double) value);
        } else if (value instanceof String) {
            buf.writeByte('S');
            encodeLongString(buf, (String) value);
        } else if (value instanceof byte[]) {
            byte[] bytes = (byte[]) value;
            buf.writeByte('x');
            buf.writeInt(bytes.length);
            buf.writeBytes(bytes);
        } else if (value instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> nested = (Map<String, Object>) value;
            buf.writeByte('F');
            encodeTable(buf, nested);
        } else if (value instanceof List) {
            @SuppressWarnings("unchecked")
            List<Object> list = (List<Object>) value;
            buf.writeByte('A');
            encodeFieldArray(buf, list);
        } else if (value instanceof Date) {
            buf.writeByte('T');
            buf.writeLong(((Date) value).getTime() / 1000);
        } else if (value instanceof BigDecimal) {
            BigDecimal decimal = (BigDecimal) value;
            buf.writeByte('D');
            buf.writeByte(decimal.scale());
            buf.writeInt(decimal.unscaledValue().intValue());
        } else {
            buf.writeByte('S');
            encodeLongString(buf, value.toString());
        }
    }

    public static Object decodeFieldValue(ByteBuf buf) {
        byte type = buf.readByte();

        switch (type) {
            case 't':
                return buf.readByte() != 0;
            case 'b':
                return buf.readByte();
            case 'B':
                return buf.readUnsignedByte();
            case 's':
                return buf.readShort();
            case 'u':
                return buf.readUnsignedShort();
            case 'I':
                return buf.readInt();
            case 'i':
                return buf.readUnsignedInt();
            case 'l':
                return buf.readLong();
            case 'f':
                return buf.readFloat();
            case 'd':
                return buf.readDouble();
            case 'D':
                byte scale = buf.readByte();
                int unscaled = buf.readInt();
                return BigDecimal.valueOf(unscaled, scale);
            case 'S':
                return decodeLongString(buf);
            case 'A':
                return decodeFieldArray(buf);
            case 'T':
                return new Date(buf.readLong() * 1000);
            case 'F':
                return decodeTable(buf);
            case 'V':
                return null;
            case 'x':
                byte[] bytes = new byte[buf.readInt()];
                buf.readBytes(bytes);
                return bytes;
            default:
                throw new IllegalArgumentException("Unknown field type: " + (char) type);
        }
    }

    public static void encodeFieldArray(ByteBuf buf, List<Object> array) {
        if (array == null || array.isEmpty()) {
            buf.writeInt(0);
            return;
        }

        ByteBuf tempBuf = Unpooled.buffer();
        try {
            for (Object item : array) {
                encodeFieldValue(tempBuf, item);
            }
            buf.writeInt(tempBuf.readableBytes());
            buf.writeBytes(tempBuf);
        } finally {
            tempBuf.release();
        }
    }

    public static List<Object> decodeFieldArray(ByteBuf buf) {
        List<Object> array = new ArrayList<>();
        int arrayLength = buf.readInt();
        if (arrayLength <= 0) {
            return array;
        }

        int endIndex = buf.readerIndex() + arrayLength;
        while (buf.readerIndex() < endIndex) {
            array.add(decodeFieldValue(buf));
        }
        return array;
    }

    /**
     * Copy the readable bytes of a buffer into a new array and release the buffer.
     */
    public static byte[] toByteArray(ByteBuf buf) {
        try {
            byte[] bytes = new byte[buf.readableBytes()];
            buf.readBytes(bytes);
            return bytes;
        } finally {
            buf.release();
        }
    }
}

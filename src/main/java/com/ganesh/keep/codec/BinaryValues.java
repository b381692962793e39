package com.ganesh.keep.codec;

import com.ganesh.keep.error.CodecException;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tagged binary encoding of dynamically typed values, used as the v2 payload.
 *
 * <p>Each value is a one-byte tag followed by its body (big-endian):
 * <ul>
 * <li>{@code NULL}, {@code TRUE}, {@code FALSE}: no body</li>
 * <li>{@code INT32}: 4 bytes; {@code INT64}: 8 bytes; {@code DOUBLE}: 8 bytes</li>
 * <li>{@code STRING}, {@code BYTES}: int32 length + bytes (strings as UTF-8)</li>
 * <li>{@code LIST}: int32 count + values; {@code MAP}: int32 count + key/value pairs</li>
 * </ul>
 * 32-bit and 64-bit integers keep separate tags so that {@link Integer} and {@link Long}
 * come back as the type that was written.
 */
final class BinaryValues {
    static final int NULL = 0;
    static final int TRUE = 1;
    static final int FALSE = 2;
    static final int INT32 = 3;
    static final int INT64 = 4;
    static final int DOUBLE = 5;
    static final int STRING = 6;
    static final int BYTES = 7;
    static final int LIST = 8;
    static final int MAP = 9;

    private BinaryValues() {
    }

    static byte[] encode(Object value) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(buffer)) {
            write(out, value);
        } catch (IOException e) {
            throw new CodecException("Failed to encode value", e);
        }
        return buffer.toByteArray();
    }

    /**
     * @return The decoded value, or {@code null} if the bytes are malformed or carry trailing garbage.
     */
    static Object decode(byte[] data, int offset, int length) {
        ByteBuffer in = ByteBuffer.wrap(data, offset, length);
        try {
            Object value = read(in);
            return in.hasRemaining() ? null : value;
        } catch (BufferUnderflowException | IllegalArgumentException | NegativeArraySizeException e) {
            return null;
        }
    }

    private static void write(DataOutputStream out, Object value) throws IOException {
        if (value == null) {
            out.writeByte(NULL);
        } else if (value instanceof Boolean) {
            out.writeByte((Boolean) value ? TRUE : FALSE);
        } else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            out.writeByte(INT32);
            out.writeInt(((Number) value).intValue());
        } else if (value instanceof Long) {
            out.writeByte(INT64);
            out.writeLong((Long) value);
        } else if (value instanceof Double || value instanceof Float) {
            out.writeByte(DOUBLE);
            out.writeDouble(((Number) value).doubleValue());
        } else if (value instanceof CharSequence) {
            byte[] bytes = value.toString().getBytes(StandardCharsets.UTF_8);
            out.writeByte(STRING);
            out.writeInt(bytes.length);
            out.write(bytes);
        } else if (value instanceof byte[]) {
            byte[] bytes = (byte[]) value;
            out.writeByte(BYTES);
            out.writeInt(bytes.length);
            out.write(bytes);
        } else if (value instanceof List) {
            List<?> list = (List<?>) value;
            out.writeByte(LIST);
            out.writeInt(list.size());
            for (Object item : list) {
                write(out, item);
            }
        } else if (value instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) value;
            out.writeByte(MAP);
            out.writeInt(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                write(out, entry.getKey());
                write(out, entry.getValue());
            }
        } else {
            throw new CodecException("Unsupported value type: " + value.getClass().getName());
        }
    }

    private static Object read(ByteBuffer in) {
        int tag = in.get() & 0xFF;
        switch (tag) {
            case NULL:
                return null;
            case TRUE:
                return Boolean.TRUE;
            case FALSE:
                return Boolean.FALSE;
            case INT32:
                return in.getInt();
            case INT64:
                return in.getLong();
            case DOUBLE:
                return in.getDouble();
            case STRING:
                return new String(readBytes(in), StandardCharsets.UTF_8);
            case BYTES:
                return readBytes(in);
            case LIST: {
                int count = readCount(in);
                List<Object> list = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    list.add(read(in));
                }
                return list;
            }
            case MAP: {
                int count = readCount(in);
                Map<Object, Object> map = new LinkedHashMap<>();
                for (int i = 0; i < count; i++) {
                    Object key = read(in);
                    map.put(key, read(in));
                }
                return map;
            }
            default:
                throw new IllegalArgumentException("Unknown value tag " + tag);
        }
    }

    private static byte[] readBytes(ByteBuffer in) {
        int length = readCount(in);
        byte[] bytes = new byte[length];
        in.get(bytes);
        return bytes;
    }

    // Every element takes at least one byte, so a count larger than what is left is corrupt.
    private static int readCount(ByteBuffer in) {
        int count = in.getInt();
        if (count < 0 || count > in.remaining()) {
            throw new IllegalArgumentException("Invalid length " + count);
        }
        return count;
    }
}

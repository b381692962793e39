package com.ganesh.keep.codec;

import java.util.List;
import java.util.Map;

/**
 * Type tag written into every record header so that a reader can tell what a payload holds
 * without decoding it.
 */
public enum ValueType {
    NULL(0),
    INT(1),
    DOUBLE(2),
    BOOL(3),
    STRING(4),
    BYTES(5),
    LIST(6),
    MAP(7);

    private final byte tag;

    ValueType(int tag) {
        this.tag = (byte) tag;
    }

    public byte tag() { return tag; }

    /**
     * Maps a header byte back to its type. Unknown tags resolve to {@link #NULL} so that a header
     * written by a newer release can still be listed.
     */
    public static ValueType fromTag(int tag) {
        for (ValueType type : values()) {
            if (type.tag == tag) {
                return type;
            }
        }
        return NULL;
    }

    public static ValueType infer(Object value) {
        if (value == null) return NULL;
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) return INT;
        if (value instanceof Double || value instanceof Float) return DOUBLE;
        if (value instanceof Boolean) return BOOL;
        if (value instanceof CharSequence) return STRING;
        if (value instanceof byte[]) return BYTES;
        if (value instanceof List) return LIST;
        if (value instanceof Map) return MAP;
        return NULL;
    }
}

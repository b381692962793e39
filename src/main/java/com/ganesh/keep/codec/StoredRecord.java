package com.ganesh.keep.codec;

/**
 * The persisted unit: a header plus the decoded value. At most one record exists per physical id
 * in a store, and a record never holds a {@code null} value because writing {@code null} deletes it.
 */
public class StoredRecord extends RecordHeader {
    private final Object value;

    public StoredRecord(String physicalId, String logicalName, int flags, int codecVersion, Object value) {
        this(physicalId, logicalName, flags, codecVersion, ValueType.infer(value), value);
    }

    public StoredRecord(String physicalId, String logicalName, int flags, int codecVersion,
                        ValueType valueType, Object value) {
        super(physicalId, logicalName, flags, codecVersion, valueType);
        this.value = value;
    }

    /**
     * Creates a record stamped with the current codec version.
     */
    public static StoredRecord of(String physicalId, String logicalName, int flags, Object value) {
        return new StoredRecord(physicalId, logicalName, flags, KeepCodec.current().version(), value);
    }

    public Object getValue() { return value; }
}

package com.ganesh.keep.codec;

import com.google.common.base.MoreObjects;

import java.util.Objects;

/**
 * Metadata carried in the fixed prefix of every encoded record. It can be parsed without touching
 * the payload, which is what makes directory scans and sub-key discovery cheap.
 */
public class RecordHeader {
    private final String physicalId;
    private final String logicalName;
    private final int flags;
    private final int codecVersion;
    private final ValueType valueType;

    public RecordHeader(String physicalId, String logicalName, int flags, int codecVersion, ValueType valueType) {
        this.physicalId = Objects.requireNonNull(physicalId, "physicalId");
        this.logicalName = Objects.requireNonNull(logicalName, "logicalName");
        this.flags = flags;
        this.codecVersion = codecVersion;
        this.valueType = valueType;
    }

    public String getPhysicalId() { return physicalId; }
    public String getLogicalName() { return logicalName; }
    public int getFlags() { return flags; }
    public int getCodecVersion() { return codecVersion; }
    public ValueType getValueType() { return valueType; }

    public boolean isRemovable() { return (flags & KeepCodec.FLAG_REMOVABLE) != 0; }
    public boolean isSecure() { return (flags & KeepCodec.FLAG_SECURE) != 0; }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("physicalId", physicalId)
                .add("logicalName", logicalName)
                .add("flags", flags)
                .add("codecVersion", codecVersion)
                .add("valueType", valueType)
                .toString();
    }
}

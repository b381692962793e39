package com.ganesh.keep.codec;

import com.ganesh.keep.error.CodecException;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Shared header handling for every codec version.
 *
 * <pre>
 * [version:1][flags:1][valueType:1][physicalIdLen:1][logicalNameLen:1]
 * [physicalId:physicalIdLen][logicalName:logicalNameLen][payload:rest]
 * </pre>
 *
 * Subclasses only decide how the payload is written.
 */
abstract class AbstractRecordCodec implements RecordCodec {

    protected abstract byte[] encodePayload(Object value);

    /**
     * @return The decoded value, or {@code null} if the payload is empty or malformed.
     */
    protected abstract Object decodePayload(byte[] data, int offset, int length);

    @Override
    public byte[] encode(String physicalId, String logicalName, Object value, int flags) {
        byte[] idBytes = nameBytes(physicalId, "Physical id");
        byte[] nameBytes = nameBytes(logicalName, "Logical name");
        byte[] payload = encodePayload(value);

        ByteArrayOutputStream out = new ByteArrayOutputStream(KeepCodec.FIXED_HEADER_BYTES
                + idBytes.length + nameBytes.length + payload.length);
        out.write(version());
        out.write(flags);
        out.write(ValueType.infer(value).tag());
        out.write(idBytes.length);
        out.write(nameBytes.length);
        out.writeBytes(idBytes);
        out.writeBytes(nameBytes);
        out.writeBytes(payload);
        return out.toByteArray();
    }

    @Override
    public StoredRecord decode(byte[] data) {
        RecordHeader header = header(data);
        if (header == null) {
            return null;
        }
        int payloadOffset = payloadOffset(data);
        Object value = decodePayload(data, payloadOffset, data.length - payloadOffset);
        if (value == null) {
            return null;
        }
        return new StoredRecord(header.getPhysicalId(), header.getLogicalName(), header.getFlags(),
                header.getCodecVersion(), header.getValueType(), value);
    }

    @Override
    public RecordHeader header(byte[] data) {
        if (data == null || data.length < KeepCodec.FIXED_HEADER_BYTES) {
            return null;
        }
        int version = data[0] & 0xFF;
        int flags = data[1] & 0xFF;
        int typeTag = data[2] & 0xFF;
        int idLen = data[3] & 0xFF;
        int nameLen = data[4] & 0xFF;

        int offset = KeepCodec.FIXED_HEADER_BYTES;
        if (idLen == 0 || offset + idLen + nameLen > data.length) {
            return null;
        }
        String physicalId = new String(data, offset, idLen, StandardCharsets.UTF_8);
        offset += idLen;
        String logicalName = new String(data, offset, nameLen, StandardCharsets.UTF_8);
        return new RecordHeader(physicalId, logicalName, flags, version, ValueType.fromTag(typeTag));
    }

    private static int payloadOffset(byte[] data) {
        return KeepCodec.FIXED_HEADER_BYTES + (data[3] & 0xFF) + (data[4] & 0xFF);
    }

    private static byte[] nameBytes(String name, String what) {
        byte[] bytes = name.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > KeepCodec.MAX_NAME_BYTES) {
            throw new CodecException(what + " too long (" + bytes.length + " bytes): " + name);
        }
        return bytes;
    }
}

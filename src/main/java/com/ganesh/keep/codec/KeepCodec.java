package com.ganesh.keep.codec;

import com.ganesh.keep.error.CodecException;
import com.google.common.primitives.Ints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for turning records into bytes and back.
 *
 * <p>Every byte that reaches disk is obfuscated with a one-bit left rotation. This only defeats
 * casual inspection of the files; confidentiality of secure keys comes from the encryptor.
 *
 * <p>Decoding never throws for bad input: an unknown version, a truncated buffer or a malformed
 * payload all yield {@code null}, which callers treat as "absent or corrupt".
 */
public final class KeepCodec {
    private static final Logger logger = LoggerFactory.getLogger(KeepCodec.class);

    /** Bit 0: the record is cleared by {@code clearRemovable()}. */
    public static final int FLAG_REMOVABLE = 1;
    /** Bit 1: the payload is encrypted. */
    public static final int FLAG_SECURE = 2;

    /** version, flags, valueType, physicalIdLen, logicalNameLen. */
    public static final int FIXED_HEADER_BYTES = 5;
    public static final int MAX_NAME_BYTES = 255;
    /** Enough bytes to hold any header: the fixed part plus two maximum-length names. */
    public static final int MAX_HEADER_BYTES = FIXED_HEADER_BYTES + 2 * MAX_NAME_BYTES;

    private static final int FRAME_LENGTH_BYTES = 4;

    private KeepCodec() {
    }

    public static RecordCodec current() {
        return CodecV2.INSTANCE;
    }

    /**
     * @throws CodecException if no codec understands {@code version}.
     */
    public static RecordCodec forVersion(int version) {
        switch (version) {
            case 1:
                return CodecV1.INSTANCE;
            case 2:
                return CodecV2.INSTANCE;
            default:
                throw new CodecException("Unsupported codec version: " + version);
        }
    }

    public static int flags(boolean removable, boolean secure) {
        return (removable ? FLAG_REMOVABLE : 0) | (secure ? FLAG_SECURE : 0);
    }

    /**
     * Encodes one record with the current codec and rotates the result, ready to be written
     * as a per-record file.
     */
    public static byte[] encode(String physicalId, String logicalName, Object value, int flags) {
        return rotate(current().encode(physicalId, logicalName, value, flags));
    }

    /**
     * Decodes rotated record bytes, as read from a per-record file.
     */
    public static StoredRecord decode(byte[] rotated) {
        if (rotated == null || rotated.length == 0) {
            return null;
        }
        return decodeRecord(unrotate(rotated));
    }

    /**
     * Parses the header from rotated bytes. {@code rotatedPrefix} may be just the first
     * {@link #MAX_HEADER_BYTES} bytes of a file.
     */
    public static RecordHeader header(byte[] rotatedPrefix) {
        if (rotatedPrefix == null || rotatedPrefix.length == 0) {
            return null;
        }
        byte[] data = unrotate(rotatedPrefix);
        RecordCodec codec = codecFor(data);
        return codec == null ? null : codec.header(data);
    }

    /**
     * Encodes every record into one block of {@code [length:4][record]} frames and rotates the
     * whole block. This is the consolidated file format.
     */
    public static byte[] encodeAll(Collection<StoredRecord> records) {
        List<byte[]> frames = new ArrayList<>(records.size());
        for (StoredRecord record : records) {
            frames.add(encodeFrame(record.getPhysicalId(), record.getLogicalName(),
                    record.getValue(), record.getFlags()));
        }
        return encodeBlock(frames);
    }

    /**
     * Joins frames produced by {@link #encodeFrame} into a rotated consolidated block.
     */
    public static byte[] encodeBlock(Collection<byte[]> frames) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] frame : frames) {
            out.writeBytes(Ints.toByteArray(frame.length));
            out.writeBytes(frame);
        }
        return rotate(out.toByteArray());
    }

    /**
     * Encodes one record with the current codec, without rotation.
     */
    public static byte[] encodeFrame(String physicalId, String logicalName, Object value, int flags) {
        return current().encode(physicalId, logicalName, value, flags);
    }

    /**
     * Decodes an unrotated frame produced by {@link #encodeFrame}.
     *
     * @return The record, or {@code null} if the frame is unreadable.
     */
    public static StoredRecord decodeFrame(byte[] frame) {
        return frame == null || frame.length == 0 ? null : decodeRecord(frame);
    }

    /**
     * Decodes a consolidated block. Frames that fail to decode are skipped; a truncated trailing
     * frame ends the scan.
     *
     * @return The records keyed by physical id, in file order.
     */
    public static Map<String, StoredRecord> decodeAll(byte[] rotated) {
        Map<String, StoredRecord> records = new LinkedHashMap<>();
        if (rotated == null || rotated.length == 0) {
            return records;
        }
        byte[] data = unrotate(rotated);
        int offset = 0;
        int skipped = 0;
        while (offset + FRAME_LENGTH_BYTES <= data.length) {
            int length = Ints.fromBytes(data[offset], data[offset + 1], data[offset + 2], data[offset + 3]);
            offset += FRAME_LENGTH_BYTES;
            if (length < 0 || offset + length > data.length) {
                logger.warn("Truncated frame at offset {} ({} bytes declared, {} available); ignoring the rest.",
                        offset - FRAME_LENGTH_BYTES, length, data.length - offset);
                break;
            }
            byte[] frame = new byte[length];
            System.arraycopy(data, offset, frame, 0, length);
            offset += length;

            StoredRecord record = decodeRecord(frame);
            if (record == null) {
                skipped++;
                continue;
            }
            records.put(record.getPhysicalId(), record);
        }
        if (skipped > 0) {
            logger.warn("Skipped {} undecodable frame(s) in consolidated block.", skipped);
        }
        return records;
    }

    /**
     * Non-reversible DJB2 hash of the UTF-8 bytes of {@code name}, rendered as an unsigned
     * 64-bit base-36 string.
     */
    public static String hash(String name) {
        long hash = 5381;
        for (byte b : name.getBytes(StandardCharsets.UTF_8)) {
            hash = ((hash << 5) + hash) + (b & 0xFF);
        }
        return Long.toUnsignedString(hash, 36);
    }

    /** Rotates every byte one bit to the left. Returns a new array. */
    public static byte[] rotate(byte[] bytes) {
        byte[] out = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xFF;
            out[i] = (byte) ((b << 1) | (b >>> 7));
        }
        return out;
    }

    /** Inverse of {@link #rotate(byte[])}. Returns a new array. */
    public static byte[] unrotate(byte[] bytes) {
        byte[] out = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xFF;
            out[i] = (byte) ((b >>> 1) | (b << 7));
        }
        return out;
    }

    static StoredRecord decodeRecord(byte[] data) {
        RecordCodec codec = codecFor(data);
        return codec == null ? null : codec.decode(data);
    }

    private static RecordCodec codecFor(byte[] data) {
        if (data.length == 0) {
            return null;
        }
        try {
            return forVersion(data[0] & 0xFF);
        } catch (CodecException e) {
            logger.debug("Ignoring record: {}", e.getMessage());
            return null;
        }
    }
}

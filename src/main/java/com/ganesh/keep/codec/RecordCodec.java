package com.ganesh.keep.codec;

/**
 * One on-disk record format version.
 *
 * <p>Implementations work on un-rotated bytes; {@link KeepCodec} applies and removes the
 * obfuscating rotation around them. Several versions may decode side by side, but only
 * {@link KeepCodec#current()} is used for encoding.
 */
public interface RecordCodec {

    /**
     * @return The version byte this codec writes and understands.
     */
    int version();

    /**
     * Encodes a single record.
     *
     * @return The un-rotated record bytes.
     * @throws com.ganesh.keep.error.CodecException if a name is too long or the value has no encoding.
     */
    byte[] encode(String physicalId, String logicalName, Object value, int flags);

    /**
     * Decodes a full record.
     *
     * @return The record, or {@code null} if the bytes are truncated, malformed, or hold a null value.
     */
    StoredRecord decode(byte[] data);

    /**
     * Parses only the fixed prefix; {@code data} may be a truncated read of the record.
     *
     * @return The header, or {@code null} if the prefix is malformed.
     */
    RecordHeader header(byte[] data);
}

package com.ganesh.keep.codec;

/**
 * Version 2: the payload is a compact tagged binary encoding produced by {@link BinaryValues}.
 * This is the version every write emits.
 */
final class CodecV2 extends AbstractRecordCodec {
    static final CodecV2 INSTANCE = new CodecV2();

    private CodecV2() {
    }

    @Override
    public int version() {
        return 2;
    }

    @Override
    protected byte[] encodePayload(Object value) {
        return BinaryValues.encode(value);
    }

    @Override
    protected Object decodePayload(byte[] data, int offset, int length) {
        if (length <= 0) {
            return null;
        }
        return BinaryValues.decode(data, offset, length);
    }
}

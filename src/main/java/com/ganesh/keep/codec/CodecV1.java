package com.ganesh.keep.codec;

import com.ganesh.keep.error.CodecException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Version 1: the payload is the UTF-8 JSON rendering of the value.
 *
 * <p>Only read by current releases. The encoder is kept so that migration from v1 files can be
 * exercised.
 */
final class CodecV1 extends AbstractRecordCodec {
    static final CodecV1 INSTANCE = new CodecV1();

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CodecV1() {
    }

    @Override
    public int version() {
        return 1;
    }

    @Override
    protected byte[] encodePayload(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new CodecException("Failed to encode JSON payload", e);
        }
    }

    @Override
    protected Object decodePayload(byte[] data, int offset, int length) {
        if (length <= 0) {
            return null;
        }
        try {
            return MAPPER.readValue(data, offset, length, Object.class);
        } catch (IOException e) {
            return null;
        }
    }
}

package com.ganesh.keep.codec;

import com.ganesh.keep.error.CodecException;
import com.google.common.primitives.Ints;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class KeepCodecTest {

    @Test
    void testRoundTripPreservesValueAndFlags() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", "Ann");
        map.put("age", 31);
        map.put("tags", Arrays.asList("a", "b"));
        List<Object> values = Arrays.asList(42, 9_000_000_000L, 3.5, true, false, "héllo", map,
                Arrays.asList(1, "two", 3.0));

        int flags = KeepCodec.flags(true, false);
        for (Object value : values) {
            byte[] bytes = KeepCodec.encode("id", "name", value, flags);
            StoredRecord record = KeepCodec.decode(bytes);
            assertNotNull(record, "Failed to decode " + value);
            assertEquals(value, record.getValue());
            assertEquals(flags, record.getFlags());
            assertTrue(record.isRemovable());
            assertFalse(record.isSecure());
            assertEquals(ValueType.infer(value), record.getValueType());
        }
    }

    @Test
    void testIntegerAndLongKeepTheirType() {
        assertEquals(Integer.class, KeepCodec.decode(KeepCodec.encode("i", "i", 7, 0)).getValue().getClass());
        assertEquals(Long.class, KeepCodec.decode(KeepCodec.encode("l", "l", 7L, 0)).getValue().getClass());
    }

    @Test
    void testBytesRoundTrip() {
        byte[] payload = {0, 1, 2, (byte) 0xFF, 127};
        StoredRecord record = KeepCodec.decode(KeepCodec.encode("blob", "blob", payload, 0));
        assertNotNull(record);
        assertArrayEquals(payload, (byte[]) record.getValue());
        assertEquals(ValueType.BYTES, record.getValueType());
    }

    @Test
    void testRotationIsAnInvolution() {
        assertArrayEquals(new byte[0], KeepCodec.unrotate(KeepCodec.rotate(new byte[0])));

        byte[] bytes = new byte[4096];
        new Random(7).nextBytes(bytes);
        assertArrayEquals(bytes, KeepCodec.unrotate(KeepCodec.rotate(bytes)));
        assertFalse(Arrays.equals(bytes, KeepCodec.rotate(bytes)));
    }

    @Test
    void testEncodedBytesHideText() {
        byte[] bytes = KeepCodec.encode("greeting", "greeting", "plaintext-value", 0);
        String raw = new String(bytes, StandardCharsets.ISO_8859_1);
        assertFalse(raw.contains("plaintext-value"));
        assertFalse(raw.contains("greeting"));
    }

    @Test
    void testHeaderParsesFromPrefix() {
        String big = "x".repeat(10_000);
        byte[] bytes = KeepCodec.encode("big-id", "big.name", big, KeepCodec.FLAG_SECURE);
        byte[] prefix = Arrays.copyOf(bytes, KeepCodec.MAX_HEADER_BYTES);

        RecordHeader header = KeepCodec.header(prefix);
        assertNotNull(header);
        assertEquals("big-id", header.getPhysicalId());
        assertEquals("big.name", header.getLogicalName());
        assertTrue(header.isSecure());
        assertEquals(ValueType.STRING, header.getValueType());
        assertEquals(2, header.getCodecVersion());

        // The payload is cut off, so a full decode must refuse the same prefix.
        assertNull(KeepCodec.decode(prefix));
    }

    @Test
    void testUnknownVersionDecodesToNull() {
        byte[] plain = KeepCodec.unrotate(KeepCodec.encode("id", "id", "v", 0));
        plain[0] = 99;
        assertNull(KeepCodec.decode(KeepCodec.rotate(plain)));
        assertNull(KeepCodec.header(KeepCodec.rotate(plain)));
        assertThrows(CodecException.class, () -> KeepCodec.forVersion(99));
    }

    @Test
    void testTruncatedInputDecodesToNull() {
        byte[] bytes = KeepCodec.encode("id", "name", "some longer value", 0);
        assertNull(KeepCodec.decode(Arrays.copyOf(bytes, bytes.length - 3)));
        assertNull(KeepCodec.decode(Arrays.copyOf(bytes, 3)));
        assertNull(KeepCodec.decode(new byte[0]));
        assertNull(KeepCodec.decode(null));
    }

    @Test
    void testOverlongNamesAreRejected() {
        String longName = "n".repeat(KeepCodec.MAX_NAME_BYTES + 1);
        assertThrows(CodecException.class, () -> KeepCodec.encode(longName, "ok", 1, 0));
        assertThrows(CodecException.class, () -> KeepCodec.encode("ok", longName, 1, 0));
        assertNotNull(KeepCodec.encode("n".repeat(KeepCodec.MAX_NAME_BYTES), "ok", 1, 0));
    }

    @Test
    void testUnsupportedValueIsRejected() {
        assertThrows(CodecException.class, () -> KeepCodec.encode("id", "id", new Object(), 0));
    }

    @Test
    void testVersionOneRecordIsReadAndRewrittenAsVersionTwo() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("theme", "dark");
        value.put("size", 12);
        byte[] v1 = KeepCodec.rotate(CodecV1.INSTANCE.encode("settings", "settings", value, 0));

        StoredRecord record = KeepCodec.decode(v1);
        assertNotNull(record);
        assertEquals(1, record.getCodecVersion());
        assertEquals(value, record.getValue());

        byte[] migrated = KeepCodec.encode(record.getPhysicalId(), record.getLogicalName(), record.getValue(),
                record.getFlags());
        assertEquals(2, KeepCodec.unrotate(migrated)[0]);
        assertEquals(value, KeepCodec.decode(migrated).getValue());
    }

    @Test
    void testHashIsDjb2InBase36() {
        // 5381 * 33 + 'a'
        assertEquals(Long.toString(177670L, 36), KeepCodec.hash("a"));
        assertEquals("3t3a", KeepCodec.hash("a"));
        assertEquals(KeepCodec.hash("users$u1"), KeepCodec.hash("users$u1"));
        assertNotEquals(KeepCodec.hash("users$u1"), KeepCodec.hash("users$u2"));
        assertTrue(KeepCodec.hash("a fairly long name that overflows 64 bits").matches("[0-9a-z]+"));
    }

    @Test
    void testConsolidatedBlockRoundTrip() {
        List<StoredRecord> records = new ArrayList<>();
        records.add(StoredRecord.of("a", "a", 0, 1));
        records.add(StoredRecord.of("b", "b", KeepCodec.FLAG_REMOVABLE, "two"));
        records.add(StoredRecord.of("c", "c", 0, Arrays.asList(3, 4)));

        Map<String, StoredRecord> decoded = KeepCodec.decodeAll(KeepCodec.encodeAll(records));
        assertEquals(Arrays.asList("a", "b", "c"), new ArrayList<>(decoded.keySet()));
        assertEquals("two", decoded.get("b").getValue());
        assertTrue(decoded.get("b").isRemovable());
        assertTrue(KeepCodec.decodeAll(KeepCodec.encodeAll(new ArrayList<>())).isEmpty());
    }

    @Test
    void testConsolidatedBlockSkipsCorruptFramesAndStopsAtTruncation() {
        byte[] good1 = CodecV2.INSTANCE.encode("a", "a", 1, 0);
        byte[] bad = CodecV2.INSTANCE.encode("b", "b", 2, 0);
        bad[0] = 42;
        byte[] good2 = CodecV2.INSTANCE.encode("c", "c", 3, 0);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] frame : Arrays.asList(good1, bad, good2)) {
            out.writeBytes(Ints.toByteArray(frame.length));
            out.writeBytes(frame);
        }
        // A trailing frame that claims more bytes than remain.
        out.writeBytes(Ints.toByteArray(1000));
        out.writeBytes(new byte[]{2, 0, 1});

        Map<String, StoredRecord> decoded = KeepCodec.decodeAll(KeepCodec.rotate(out.toByteArray()));
        assertEquals(2, decoded.size());
        assertEquals(1, decoded.get("a").getValue());
        assertEquals(3, decoded.get("c").getValue());
        assertFalse(decoded.containsKey("b"));
    }

    @Test
    void testUnknownTypeTagReadsAsNull() {
        assertEquals(ValueType.NULL, ValueType.fromTag(200));
        assertEquals(ValueType.MAP, ValueType.fromTag(7));
    }
}

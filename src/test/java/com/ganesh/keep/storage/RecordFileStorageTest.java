package com.ganesh.keep.storage;

import com.ganesh.keep.Keep;
import com.ganesh.keep.KeepConfig;
import com.ganesh.keep.codec.KeepCodec;
import com.ganesh.keep.codec.RecordHeader;
import com.ganesh.keep.codec.ValueType;
import com.ganesh.keep.error.CodecException;
import com.ganesh.keep.error.KeepException;
import com.ganesh.keep.key.KeyDescriptor;
import com.ganesh.keep.key.KeyKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class RecordFileStorageTest {

    @TempDir
    Path tempDir;

    private Keep keep;
    private final List<KeepException> reported = new CopyOnWriteArrayList<>();

    private RecordFileStorage open() {
        keep = new Keep(new KeepConfig.Builder().withErrorSink(reported::add).build());
        keep.init(tempDir).join();
        return (RecordFileStorage) keep.getExternalStorage();
    }

    @AfterEach
    void tearDown() {
        if (keep != null) {
            keep.close();
        }
    }

    private Path externalDir() {
        return tempDir.resolve("keep").resolve("external");
    }

    private static KeyDescriptor external(String name, boolean removable) {
        return KeyDescriptor.root(name, KeyKind.PLAIN, removable, true, null);
    }

    @Test
    void testWriteCreatesOneFilePerRecord() {
        RecordFileStorage storage = open();
        storage.write(external("avatar", false), new byte[]{1, 2, 3}).join();
        storage.write(external("history", false), "long text").join();

        assertTrue(Files.exists(externalDir().resolve("avatar")));
        assertTrue(Files.exists(externalDir().resolve("history")));
        assertArrayEquals(new byte[]{1, 2, 3}, (byte[]) storage.read("avatar").join());
        assertEquals("long text", storage.readSync("history"));
        assertTrue(storage.existsSync("history"));
        assertEquals(2, keep.getMetrics().recordFileWrites.sum());
    }

    @Test
    void testNullWriteDeletesFile() {
        RecordFileStorage storage = open();
        KeyDescriptor key = external("temp", false);
        storage.write(key, "value").join();
        storage.write(key, null).join();

        assertFalse(Files.exists(externalDir().resolve("temp")));
        assertFalse(storage.exists("temp").join());
        assertNull(storage.read("temp").join());
    }

    @Test
    void testHeadersAreIndexedAtStartup() {
        RecordFileStorage storage = open();
        storage.write(external("big", true), "x".repeat(100_000)).join();
        keep.close();

        RecordFileStorage reopened = open();
        assertTrue(reopened.cachedIds().contains("big"));
        RecordHeader header = reopened.header("big").join();
        assertEquals("big", header.getLogicalName());
        assertEquals(ValueType.STRING, header.getValueType());
        assertTrue(header.isRemovable());
        assertTrue(reopened.existsSync("big"));
    }

    @Test
    void testHeaderProbesFilesMissingFromCache() throws IOException {
        RecordFileStorage storage = open();
        Files.write(externalDir().resolve("late"), KeepCodec.encode("late", "late", 5, 0));

        assertFalse(storage.existsSync("late"));
        assertEquals("late", storage.header("late").join().getLogicalName());
        assertTrue(storage.existsSync("late"));
        assertNull(storage.header("never-written").join());
    }

    @Test
    void testLeftoverTempFilesAreDeletedAtStartup() throws IOException {
        Files.createDirectories(externalDir());
        Path stale = externalDir().resolve("avatar.12345-1" + AtomicFileWriter.TEMP_SUFFIX);
        Files.write(stale, new byte[]{9, 9, 9});

        RecordFileStorage storage = open();
        assertFalse(Files.exists(stale));
        assertTrue(storage.getKeys().join().isEmpty());
    }

    @Test
    void testCorruptRecordReadsAsNullAndIsDeleted() throws IOException {
        Files.createDirectories(externalDir());
        Path broken = externalDir().resolve("broken");
        Files.write(broken, "garbage".getBytes(StandardCharsets.UTF_8));

        RecordFileStorage storage = open();
        assertNull(storage.read("broken").join());
        assertFalse(Files.exists(broken));
        assertEquals(1, keep.getMetrics().corruptRecordsDropped.sum());
        assertTrue(reported.stream().anyMatch(e -> e instanceof CodecException));
    }

    @Test
    void testClearRemovableDeletesOnlyRemovableFiles() {
        RecordFileStorage storage = open();
        storage.write(external("cache", true), "c").join();
        storage.write(external("profile", false), "p").join();

        storage.clearRemovable().join();

        assertFalse(Files.exists(externalDir().resolve("cache")));
        assertEquals("p", storage.readSync("profile"));
        assertEquals(List.of("profile"), storage.getKeys().join());
    }

    @Test
    void testClearDeletesEverything() {
        RecordFileStorage storage = open();
        storage.write(external("a", false), 1).join();
        storage.write(external("b", true), 2).join();

        storage.clear().join();

        assertTrue(storage.getKeys().join().isEmpty());
        assertTrue(storage.cachedIds().isEmpty());
    }
}

package com.ganesh.keep.storage;

import com.ganesh.keep.Keep;
import com.ganesh.keep.KeepConfig;
import com.ganesh.keep.codec.KeepCodec;
import com.ganesh.keep.error.CodecException;
import com.ganesh.keep.error.InitializationException;
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
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class ConsolidatedStorageTest {

    @TempDir
    Path tempDir;

    private Keep keep;
    private final List<KeepException> reported = new CopyOnWriteArrayList<>();

    private ConsolidatedStorage open(Duration debounce) {
        keep = new Keep(new KeepConfig.Builder()
                .withSaveDebounce(debounce)
                .withErrorSink(reported::add)
                .build());
        keep.init(tempDir).join();
        return keep.getInternalStorage();
    }

    @AfterEach
    void tearDown() {
        if (keep != null) {
            keep.close();
        }
    }

    private static KeyDescriptor plain(String name, boolean removable) {
        return KeyDescriptor.root(name, KeyKind.PLAIN, removable, false, null);
    }

    private Path consolidatedFile() {
        return tempDir.resolve("keep").resolve("main.keep");
    }

    @Test
    void testInitCreatesEmptyFile() {
        ConsolidatedStorage storage = open(Duration.ofMillis(50));
        assertTrue(Files.exists(consolidatedFile()));
        assertTrue(storage.getKeys().join().isEmpty());
    }

    @Test
    void testWriteIsVisibleBeforeItIsSaved() {
        ConsolidatedStorage storage = open(Duration.ofSeconds(30));
        storage.write(plain("counter", false), 42).join();

        assertEquals(42, storage.readSync("counter"));
        assertEquals(42, storage.read("counter").join());
        assertTrue(storage.existsSync("counter"));
        assertEquals("counter", storage.header("counter").join().getLogicalName());
        assertEquals(0, keep.getMetrics().consolidatedFlushes.sum(), "Save should still be waiting");
    }

    @Test
    void testBurstOfWritesIsSavedOnce() throws InterruptedException {
        ConsolidatedStorage storage = open(Duration.ofMillis(200));
        for (int i = 0; i < 50; i++) {
            storage.write(plain("counter", false), i).join();
        }
        Thread.sleep(800);

        assertEquals(1, keep.getMetrics().consolidatedFlushes.sum());
        assertEquals(49, KeepCodec.decodeAll(readFile()).get("counter").getValue());
    }

    @Test
    void testRecordsSurviveRestart() {
        ConsolidatedStorage storage = open(Duration.ofMillis(50));
        storage.write(plain("a", false), "alpha").join();
        storage.write(plain("b", true), Arrays.asList(1, 2, 3)).join();
        storage.write(plain("c", false), 1.5).join();
        storage.removeKey("c").join();
        keep.close();

        ConsolidatedStorage reopened = open(Duration.ofMillis(50));
        assertEquals("alpha", reopened.readSync("a"));
        assertEquals(Arrays.asList(1, 2, 3), reopened.readSync("b"));
        assertTrue(reopened.header("b").join().isRemovable());
        assertNull(reopened.readSync("c"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testStoredValuesAreNotSharedWithCallers() {
        ConsolidatedStorage storage = open(Duration.ofMillis(20));
        List<Integer> written = new ArrayList<>(List.of(1, 2));
        byte[] bytes = {1, 2};
        storage.write(plain("list", false), written).join();
        storage.write(plain("bytes", false), bytes).join();

        written.add(3);
        bytes[0] = 9;
        assertEquals(List.of(1, 2), storage.readSync("list"));
        assertArrayEquals(new byte[]{1, 2}, (byte[]) storage.readSync("bytes"));

        ((List<Integer>) storage.readSync("list")).add(4);
        assertEquals(List.of(1, 2), storage.read("list").join());

        storage.flush().join();
        assertEquals(List.of(1, 2), KeepCodec.decodeAll(readFile()).get("list").getValue());
    }

    @Test
    void testNullWriteRemoves() {
        ConsolidatedStorage storage = open(Duration.ofMillis(50));
        storage.write(plain("a", false), "alpha").join();
        storage.write(plain("a", false), null).join();
        assertFalse(storage.existsSync("a"));
    }

    @Test
    void testUnencodableWriteFailsWithoutChangingState() {
        ConsolidatedStorage storage = open(Duration.ofMillis(50));
        storage.write(plain("a", false), "alpha").join();

        assertThrows(CodecException.class, () -> storage.write(plain("a", false), new Object()));
        assertEquals("alpha", storage.readSync("a"));
    }

    @Test
    void testClearRemovableKeepsOtherRecords() {
        ConsolidatedStorage storage = open(Duration.ofMillis(50));
        storage.write(plain("session", true), "s").join();
        storage.write(plain("settings", false), "x").join();

        storage.clearRemovable().join();
        assertFalse(storage.existsSync("session"));
        assertEquals("x", storage.readSync("settings"));
        keep.close();

        ConsolidatedStorage reopened = open(Duration.ofMillis(50));
        assertFalse(reopened.existsSync("session"));
        assertEquals("x", reopened.readSync("settings"));
    }

    @Test
    void testClearRemovableWithNothingRemovableDoesNotSave() throws InterruptedException {
        ConsolidatedStorage storage = open(Duration.ofMillis(20));
        storage.write(plain("settings", false), "x").join();
        Thread.sleep(300);
        long flushes = keep.getMetrics().consolidatedFlushes.sum();

        storage.clearRemovable().join();
        Thread.sleep(300);
        assertEquals(flushes, keep.getMetrics().consolidatedFlushes.sum());
    }

    @Test
    void testCorruptFileIsDiscardedAndStoreStartsEmpty() throws IOException {
        Files.createDirectories(consolidatedFile().getParent());
        Files.write(consolidatedFile(), "not a keep file".getBytes(StandardCharsets.UTF_8));

        ConsolidatedStorage storage = open(Duration.ofMillis(50));

        assertTrue(storage.getKeys().join().isEmpty());
        assertEquals(1, reported.size());
        assertTrue(reported.get(0) instanceof InitializationException);

        // The store stays usable.
        storage.write(plain("fresh", false), "start").join();
        storage.flush().join();
        assertEquals("start", KeepCodec.decodeAll(readFile()).get("fresh").getValue());
    }

    @Test
    void testFailedSaveIsReported() {
        keep = new Keep(new KeepConfig.Builder()
                .withSaveDebounce(Duration.ofMillis(50))
                .withErrorSink(reported::add)
                .withFileWriter(new AtomicFileWriterTest.CrashingWriter())
                .build());
        keep.init(tempDir).join();
        ConsolidatedStorage storage = keep.getInternalStorage();

        storage.write(plain("a", false), "alpha").join();
        CompletionException error = assertThrows(CompletionException.class, () -> storage.flush().join());
        assertTrue(error.getCause() instanceof KeepException);
        assertFalse(reported.isEmpty());
        assertEquals("alpha", storage.readSync("a"));
    }

    private byte[] readFile() {
        try {
            return Files.readAllBytes(consolidatedFile());
        } catch (IOException e) {
            throw new AssertionError(e);
        }
    }
}

package com.ganesh.keep.storage;

import com.ganesh.keep.Keep;
import com.ganesh.keep.KeepMetrics;
import com.ganesh.keep.codec.KeepCodec;
import com.ganesh.keep.codec.RecordHeader;
import com.ganesh.keep.codec.StoredRecord;
import com.ganesh.keep.codec.ValueType;
import com.ganesh.keep.error.CodecException;
import com.ganesh.keep.error.InitializationException;
import com.ganesh.keep.key.KeyDescriptor;
import com.ganesh.keep.queue.WriteQueue;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps every small record in memory and mirrors the whole map to a single file.
 *
 * <p>Reads are plain map lookups. Writes update the map immediately, so a read right after a write
 * sees it, and then schedule a save. Saves are debounced under one shared id, so a burst of writes
 * becomes one disk flush, and each save replaces the file atomically.
 *
 * <p>Each record is held as its encoded frame, and a read decodes a fresh value. Callers never share
 * a mutable value with the store, and a save only joins frames.
 *
 * <p>The file is a sequence of {@code [length:4][record]} frames, rotated as a whole
 * (see {@link KeepCodec#encodeBlock}).
 */
public class ConsolidatedStorage implements KeepStorage {
    private static final Logger logger = LoggerFactory.getLogger(ConsolidatedStorage.class);

    static final String SAVE_ID = "main";

    private final Map<String, Entry> memory = new ConcurrentHashMap<>();
    /** Held while mutating {@link #memory} and while snapshotting it for a save. */
    private final Object mutationLock = new Object();

    private Keep keep;
    private Path file;
    private WriteQueue queue;
    private Duration saveDebounce;
    private AtomicFileWriter fileWriter;
    private KeepMetrics metrics;

    /**
     * Loads the backing file on a worker thread. A file that cannot be decoded is deleted, the error
     * is reported, and the store starts empty rather than blocking startup.
     */
    @Override
    public CompletableFuture<Void> init(Keep keep) {
        this.keep = keep;
        this.file = keep.getRoot().resolve(keep.getConfig().getConsolidatedFileName());
        this.saveDebounce = keep.getConfig().getSaveDebounce();
        this.fileWriter = keep.getConfig().getFileWriter();
        this.metrics = keep.getMetrics();
        this.queue = new WriteQueue("consolidated", keep.getScheduler(), keep.getExecutor(),
                keep::reportError, metrics);
        return CompletableFuture.runAsync(this::load, keep.getExecutor());
    }

    private void load() {
        try {
            if (!Files.exists(file)) {
                Files.createDirectories(file.getParent());
                Files.write(file, new byte[0]);
                logger.info("Created empty consolidated file {}", file);
                return;
            }
            byte[] bytes = Files.readAllBytes(file);
            Map<String, StoredRecord> loaded = KeepCodec.decodeAll(bytes);
            if (bytes.length > 0 && loaded.isEmpty()) {
                throw new CodecException("No readable records in " + file);
            }
            for (StoredRecord record : loaded.values()) {
                memory.put(record.getPhysicalId(), Entry.of(record.getPhysicalId(), record.getLogicalName(),
                        record.getFlags(), record.getValue()));
            }
            logger.info("Loaded {} record(s) from {}", loaded.size(), file);
        } catch (IOException | RuntimeException e) {
            keep.reportError(new InitializationException("Failed to load consolidated file " + file, e));
            discardCorruptFile();
            memory.clear();
        }
    }

    private void discardCorruptFile() {
        try {
            Files.deleteIfExists(file);
            logger.warn("Deleted unreadable consolidated file {}; starting empty.", file);
        } catch (IOException e) {
            logger.error("Could not delete unreadable consolidated file {}", file, e);
        }
    }

    @Override
    public CompletableFuture<Object> read(String physicalId) {
        return CompletableFuture.completedFuture(readSync(physicalId));
    }

    @Override
    public Object readSync(String physicalId) {
        Entry entry = memory.get(physicalId);
        if (entry == null) {
            return null;
        }
        StoredRecord record = KeepCodec.decodeFrame(entry.frame);
        return record == null ? null : record.getValue();
    }

    /**
     * Encodes the record in the calling thread, so an unsupported value or an over-long name fails
     * this call instead of the later background save.
     */
    @Override
    public CompletableFuture<Void> write(KeyDescriptor key, Object value) {
        if (value == null) {
            return remove(key);
        }
        Entry entry = Entry.of(key.getPhysicalId(), key.getStoredName(), key.flags(), value);
        synchronized (mutationLock) {
            memory.put(key.getPhysicalId(), entry);
        }
        scheduleSave();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> remove(KeyDescriptor key) {
        return removeKey(key.getPhysicalId());
    }

    @Override
    public CompletableFuture<Void> removeKey(String physicalId) {
        Entry removed;
        synchronized (mutationLock) {
            removed = memory.remove(physicalId);
        }
        if (removed != null) {
            scheduleSave();
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Boolean> exists(String physicalId) {
        return CompletableFuture.completedFuture(existsSync(physicalId));
    }

    @Override
    public boolean existsSync(String physicalId) {
        return memory.containsKey(physicalId);
    }

    @Override
    public CompletableFuture<List<String>> getKeys() {
        return CompletableFuture.completedFuture(ImmutableList.copyOf(memory.keySet()));
    }

    @Override
    public CompletableFuture<Void> clear() {
        synchronized (mutationLock) {
            memory.clear();
        }
        logger.info("Cleared consolidated store.");
        scheduleSave();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> clearRemovable() {
        boolean changed;
        synchronized (mutationLock) {
            changed = memory.values().removeIf(entry -> entry.header.isRemovable());
        }
        if (changed) {
            logger.info("Removed removable records from consolidated store.");
            scheduleSave();
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<RecordHeader> header(String physicalId) {
        Entry entry = memory.get(physicalId);
        return CompletableFuture.completedFuture(entry == null ? null : entry.header);
    }

    /**
     * Saves immediately, replacing any debounced save that is still waiting.
     */
    public CompletableFuture<Void> flush() {
        return queue.run(SAVE_ID, this::save);
    }

    private void scheduleSave() {
        queue.run(SAVE_ID, this::save, saveDebounce);
    }

    private Void save() {
        long start = System.nanoTime();
        List<byte[]> snapshot = new ArrayList<>();
        synchronized (mutationLock) {
            memory.values().forEach(entry -> snapshot.add(entry.frame));
        }
        byte[] bytes = KeepCodec.encodeBlock(snapshot);
        fileWriter.write(file, bytes);
        metrics.recordFlushLatency(System.nanoTime() - start);
        logger.debug("Saved {} record(s) ({} bytes) to {}", snapshot.size(), bytes.length, file);
        return null;
    }

    @Override
    public void dispose() {
        if (queue != null) {
            queue.dispose();
        }
    }

    /** A record's header and its unrotated frame. The frame is never modified. */
    private static final class Entry {
        final RecordHeader header;
        final byte[] frame;

        private Entry(RecordHeader header, byte[] frame) {
            this.header = header;
            this.frame = frame;
        }

        static Entry of(String physicalId, String logicalName, int flags, Object value) {
            byte[] frame = KeepCodec.encodeFrame(physicalId, logicalName, value, flags);
            return new Entry(new RecordHeader(physicalId, logicalName, flags, KeepCodec.current().version(),
                    ValueType.infer(value)), frame);
        }
    }
}

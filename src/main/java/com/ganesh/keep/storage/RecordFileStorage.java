package com.ganesh.keep.storage;

import com.ganesh.keep.Keep;
import com.ganesh.keep.KeepMetrics;
import com.ganesh.keep.codec.KeepCodec;
import com.ganesh.keep.codec.RecordHeader;
import com.ganesh.keep.codec.StoredRecord;
import com.ganesh.keep.codec.ValueType;
import com.ganesh.keep.error.CodecException;
import com.ganesh.keep.error.InitializationException;
import com.ganesh.keep.error.StorageIOException;
import com.ganesh.keep.key.KeyDescriptor;
import com.ganesh.keep.queue.WriteQueue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores each record in its own file under {@code root/external}, named by physical id.
 *
 * <p>At startup only the first few hundred bytes of every file are read, enough to parse the
 * header, and kept in a cache. Existence checks, removable cleanup and sub-key discovery run
 * against that cache instead of the directory.
 *
 * <p>Every read, write and delete of a given file goes through the write queue under that file's id,
 * so operations on one record never overlap while different records proceed in parallel.
 */
public class RecordFileStorage implements KeepStorage {
    private static final Logger logger = LoggerFactory.getLogger(RecordFileStorage.class);

    private final Map<String, RecordHeader> headers = new ConcurrentHashMap<>();

    private Keep keep;
    private Path directory;
    private WriteQueue queue;
    private AtomicFileWriter fileWriter;
    private KeepMetrics metrics;
    private int headerProbeBytes;

    @Override
    public CompletableFuture<Void> init(Keep keep) {
        this.keep = keep;
        this.directory = keep.getRoot().resolve(keep.getConfig().getExternalDirectoryName());
        this.fileWriter = keep.getConfig().getFileWriter();
        this.headerProbeBytes = keep.getConfig().getHeaderProbeBytes();
        this.metrics = keep.getMetrics();
        this.queue = new WriteQueue("record-files", keep.getScheduler(), keep.getExecutor(),
                keep::reportError, metrics);
        return CompletableFuture.runAsync(this::scan, keep.getExecutor());
    }

    private void scan() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new InitializationException("Failed to create record directory " + directory, e);
        }
        int stale = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                if (name.endsWith(AtomicFileWriter.TEMP_SUFFIX)) {
                    Files.deleteIfExists(file);
                    stale++;
                    continue;
                }
                RecordHeader header = probe(file);
                if (header != null) {
                    headers.put(name, header);
                }
            }
        } catch (IOException e) {
            throw new InitializationException("Failed to scan record directory " + directory, e);
        }
        if (stale > 0) {
            logger.warn("Deleted {} leftover temporary file(s) in {}", stale, directory);
        }
        logger.info("Indexed {} record file(s) in {}", headers.size(), directory);
    }

    /**
     * Reads the bounded header prefix of {@code file}.
     *
     * @return The header, or {@code null} if the file is missing or its prefix does not parse.
     */
    private RecordHeader probe(Path file) throws IOException {
        byte[] prefix;
        try (InputStream in = Files.newInputStream(file)) {
            prefix = in.readNBytes(headerProbeBytes);
        } catch (NoSuchFileException e) {
            return null;
        }
        RecordHeader header = KeepCodec.header(prefix);
        if (header == null) {
            logger.warn("Unreadable record header in {}", file);
        }
        return header;
    }

    private Path fileFor(String physicalId) {
        return directory.resolve(physicalId);
    }

    @Override
    public CompletableFuture<Object> read(String physicalId) {
        return queue.run(physicalId, () -> readSync(physicalId));
    }

    /**
     * Reads the file directly. A file that fails to decode is deleted and treated as absent.
     */
    @Override
    public Object readSync(String physicalId) {
        Path file = fileFor(physicalId);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new StorageIOException("Failed to read " + file, physicalId, e);
        }
        StoredRecord record = KeepCodec.decode(bytes);
        if (record == null) {
            dropCorrupt(physicalId, file);
            return null;
        }
        return record.getValue();
    }

    private void dropCorrupt(String physicalId, Path file) {
        metrics.corruptRecordsDropped.increment();
        headers.remove(physicalId);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.error("Could not delete corrupt record file {}", file, e);
        }
        logger.warn("Deleted corrupt record file {}", file);
        keep.reportError(new CodecException("Corrupt record '" + physicalId + "' was deleted", physicalId, null));
    }

    @Override
    public CompletableFuture<Void> write(KeyDescriptor key, Object value) {
        if (value == null) {
            return remove(key);
        }
        String physicalId = key.getPhysicalId();
        return queue.run(physicalId, () -> {
            byte[] bytes = KeepCodec.encode(physicalId, key.getStoredName(), value, key.flags());
            fileWriter.write(fileFor(physicalId), bytes);
            headers.put(physicalId, new RecordHeader(physicalId, key.getStoredName(), key.flags(),
                    KeepCodec.current().version(), ValueType.infer(value)));
            metrics.recordFileWrites.increment();
            logger.debug("Wrote record file {} ({} bytes)", physicalId, bytes.length);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> remove(KeyDescriptor key) {
        return removeKey(key.getPhysicalId());
    }

    @Override
    public CompletableFuture<Void> removeKey(String physicalId) {
        return queue.run(physicalId, () -> {
            delete(physicalId);
            return null;
        });
    }

    private void delete(String physicalId) {
        headers.remove(physicalId);
        try {
            Files.deleteIfExists(fileFor(physicalId));
        } catch (IOException e) {
            throw new StorageIOException("Failed to delete record file " + physicalId, physicalId, e);
        }
    }

    @Override
    public CompletableFuture<Boolean> exists(String physicalId) {
        return CompletableFuture.completedFuture(existsSync(physicalId));
    }

    @Override
    public boolean existsSync(String physicalId) {
        return headers.containsKey(physicalId);
    }

    @Override
    public CompletableFuture<List<String>> getKeys() {
        return CompletableFuture.supplyAsync(() -> {
            List<String> ids = new ArrayList<>();
            try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
                for (Path file : files) {
                    String name = file.getFileName().toString();
                    if (!name.endsWith(AtomicFileWriter.TEMP_SUFFIX)) {
                        ids.add(name);
                    }
                }
            } catch (IOException e) {
                throw new StorageIOException("Failed to list " + directory, e);
            }
            return ImmutableList.copyOf(ids);
        }, keep.getExecutor());
    }

    @Override
    public CompletableFuture<Void> clear() {
        return getKeys().thenCompose(ids -> {
            List<CompletableFuture<Void>> deletes = new ArrayList<>();
            for (String id : ids) {
                deletes.add(removeKey(id));
            }
            return CompletableFuture.allOf(deletes.toArray(new CompletableFuture[0]));
        }).thenRun(() -> logger.info("Cleared record files in {}", directory));
    }

    /**
     * Deletes the files whose cached header carries the removable flag.
     */
    @Override
    public CompletableFuture<Void> clearRemovable() {
        List<CompletableFuture<Void>> deletes = new ArrayList<>();
        headers.forEach((id, header) -> {
            if (header.isRemovable()) {
                deletes.add(removeKey(id));
            }
        });
        if (!deletes.isEmpty()) {
            logger.info("Removing {} removable record file(s).", deletes.size());
        }
        return CompletableFuture.allOf(deletes.toArray(new CompletableFuture[0]));
    }

    @Override
    public CompletableFuture<RecordHeader> header(String physicalId) {
        RecordHeader cached = headers.get(physicalId);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }
        return queue.run(physicalId, () -> {
            RecordHeader header = probe(fileFor(physicalId));
            if (header != null) {
                headers.put(physicalId, header);
            }
            return header;
        });
    }

    /**
     * @return A future completing once every queued file operation has finished.
     */
    public CompletableFuture<Void> whenIdle() {
        return queue.whenIdle();
    }

    /**
     * @return The ids currently held in the header cache.
     */
    public Set<String> cachedIds() {
        return ImmutableSet.copyOf(headers.keySet());
    }

    @Override
    public void dispose() {
        if (queue != null) {
            queue.dispose();
        }
    }
}

package com.ganesh.keep.storage;

import com.ganesh.keep.Keep;
import com.ganesh.keep.codec.RecordHeader;
import com.ganesh.keep.key.KeyDescriptor;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Contract for a storage backend.
 *
 * <p>The engine ships two implementations: {@link ConsolidatedStorage} for small records held in
 * memory and {@link RecordFileStorage} for one file per record. Applications may plug in their own,
 * for example a database-backed adapter, either engine-wide through the configuration or for a
 * single key.
 *
 * <p>Records are addressed by physical id. Only {@link #write} needs the full descriptor, because the
 * logical name and flags are persisted alongside the value.
 */
public interface KeepStorage {

    /**
     * Prepares the backend. Called once, after the engine's root directory exists.
     */
    CompletableFuture<Void> init(Keep keep);

    /**
     * @return The stored value, or {@code null} if there is none.
     */
    CompletableFuture<Object> read(String physicalId);

    /**
     * Reads without going through any write coordination. Safe only because writers replace
     * records atomically.
     */
    Object readSync(String physicalId);

    /**
     * Stores {@code value} for the key. A {@code null} value removes the record.
     */
    CompletableFuture<Void> write(KeyDescriptor key, Object value);

    CompletableFuture<Void> remove(KeyDescriptor key);

    CompletableFuture<Boolean> exists(String physicalId);

    boolean existsSync(String physicalId);

    /**
     * @return Every physical id currently stored.
     */
    CompletableFuture<List<String>> getKeys();

    CompletableFuture<Void> removeKey(String physicalId);

    CompletableFuture<Void> clear();

    /**
     * Removes every record whose removable flag is set, using stored metadata rather than
     * decoding payloads.
     */
    CompletableFuture<Void> clearRemovable();

    /**
     * @return The record's header without its payload, or {@code null} if absent or unreadable.
     */
    CompletableFuture<RecordHeader> header(String physicalId);

    /**
     * Cancels outstanding debounced work. Must run before the backend is discarded.
     */
    default void dispose() {
    }
}

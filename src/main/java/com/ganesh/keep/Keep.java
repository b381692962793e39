package com.ganesh.keep;

import com.ganesh.keep.crypto.Encryptor;
import com.ganesh.keep.error.InitializationException;
import com.ganesh.keep.error.KeepException;
import com.ganesh.keep.error.KeyConflictException;
import com.ganesh.keep.event.ChangeBus;
import com.ganesh.keep.key.KeyBuilder;
import com.ganesh.keep.key.KeyHandle;
import com.ganesh.keep.storage.ConsolidatedStorage;
import com.ganesh.keep.storage.KeepStorage;
import com.ganesh.keep.storage.RecordFileStorage;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The storage engine: owns both built-in stores, the key registry and the change bus.
 *
 * <p>Keys are declared through {@link #key(String)} at any time, before or after {@link #init}.
 * Every operation on a key waits for initialization to finish before touching storage, so
 * a typical application builds its keys up front and starts reading as soon as it likes.
 *
 * <p>Initialization creates the root directory, initializes the encryptor, then loads the
 * consolidated store and indexes the per-record store in parallel. It happens once; calling
 * {@link #init} again returns the same future.
 *
 * <pre>{@code
 * Keep keep = new Keep();
 * KeyHandle<Integer> counter = keep.key("counter", Integer.class).build();
 * keep.init(appDataDir).join();
 * counter.write(42).join();
 * }</pre>
 */
public class Keep implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Keep.class);

    /**
     * Lifecycle of an engine instance.
     */
    public enum State {
        UNINITIALIZED, INITIALIZING, READY, CLOSED
    }

    private final KeepConfig config;
    private final KeepMetrics metrics = new KeepMetrics();
    private final ChangeBus changes = new ChangeBus();
    private final ScheduledExecutorService scheduler;
    private final ExecutorService executor;

    private final ConsolidatedStorage internal = new ConsolidatedStorage();
    private final KeepStorage external;
    /** Per-key backends, each initialized once after the engine is ready. */
    private final Map<KeepStorage, CompletableFuture<Void>> attached = new ConcurrentHashMap<>();
    /** Every key declared on this engine, by physical id. */
    private final Map<String, KeyHandle<?>> registry = new ConcurrentHashMap<>();
    /** Tail of each key's chain of read-modify-write updates, by physical id. */
    private final Map<String, CompletableFuture<Void>> updateLanes = new ConcurrentHashMap<>();

    private final AtomicReference<State> state = new AtomicReference<>(State.UNINITIALIZED);
    private final CompletableFuture<Void> ready = new CompletableFuture<>();
    private volatile Path root;

    public Keep() {
        this(new KeepConfig.Builder().build());
    }

    public Keep(KeepConfig config) {
        this.config = config;
        this.external = config.newExternalStorage();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("keep-timer-%d").setDaemon(true).build());
        this.executor = Executors.newFixedThreadPool(config.getIoThreads(), new ThreadFactoryBuilder()
                .setNameFormat("keep-io-%d").setDaemon(true).build());
    }

    /**
     * Initializes the engine under {@code path}, using the configured folder name.
     */
    public CompletableFuture<Void> init(Path path) {
        return init(path, config.getFolderName());
    }

    /**
     * Initializes the engine in {@code path/folderName}.
     *
     * @return A future that completes once the engine is ready, or fails with an
     * {@link InitializationException}. Repeated calls return the same future.
     */
    public CompletableFuture<Void> init(Path path, String folderName) {
        if (!state.compareAndSet(State.UNINITIALIZED, State.INITIALIZING)) {
            return ready;
        }
        logger.info("Keep starting in {}", path.resolve(folderName));
        try {
            root = path.resolve(folderName);
            Files.createDirectories(root);
        } catch (IOException | RuntimeException e) {
            failInit(new InitializationException("Failed to create root directory " + path.resolve(folderName), e));
            return ready;
        }

        config.getEncryptor().init()
                .thenCompose(v -> CompletableFuture.allOf(internal.init(this), external.init(this)))
                .whenComplete((v, error) -> {
                    if (error != null) {
                        failInit(KeepException.wrap("Failed to initialize storage", null, unwrap(error)));
                        return;
                    }
                    state.compareAndSet(State.INITIALIZING, State.READY);
                    ready.complete(null);
                    logger.info("Keep ready with {} key(s) declared.", registry.size());
                });
        return ready;
    }

    private void failInit(KeepException error) {
        reportError(error);
        ready.completeExceptionally(error);
    }

    /**
     * @return A future completing when initialization finishes. Safe to await from any thread, any number of times.
     */
    public CompletableFuture<Void> whenReady() {
        return ready;
    }

    public boolean isReady() {
        return state.get() == State.READY;
    }

    public State getState() {
        return state.get();
    }

    /**
     * Returns a future that completes once {@code storage} has been initialized against this engine.
     * Built-in stores resolve with {@link #whenReady()}; any other backend is initialized the
     * first time it is attached.
     */
    public CompletableFuture<Void> attach(KeepStorage storage) {
        if (storage == internal || storage == external) {
            return ready;
        }
        return attached.computeIfAbsent(storage, backend -> ready.thenCompose(v -> backend.init(this)));
    }

    /**
     * Starts declaring an untyped key. Values come back as the codec decodes them.
     */
    public KeyBuilder<Object> key(String name) {
        return new KeyBuilder<>(this, name, Object.class);
    }

    /**
     * Starts declaring a key whose values are read back as {@code type}.
     */
    public <T> KeyBuilder<T> key(String name, Class<T> type) {
        return new KeyBuilder<>(this, name, type);
    }

    /**
     * Adds a key to the registry. Declaring the same key twice is allowed as long as both
     * declarations agree on the value type and on how the key is stored.
     *
     * @throws KeyConflictException if a key with the same physical id was declared differently.
     */
    public void register(KeyHandle<?> handle) {
        KeyHandle<?> existing = registry.putIfAbsent(handle.getPhysicalId(), handle);
        if (existing != null && (existing.getType() != handle.getType()
                || !existing.getDescriptor().isCompatible(handle.getDescriptor()))) {
            KeyConflictException conflict = new KeyConflictException(
                    "Key '" + handle.getName() + "' conflicts with existing key '" + existing.getName() + "'",
                    handle.getName(), null);
            reportError(conflict);
            throw conflict;
        }
    }

    /**
     * Runs {@code update} after every earlier update of the same key has finished, successfully
     * or not. Plain writes are not ordered against it.
     */
    public <T> CompletableFuture<T> serializeUpdate(String physicalId, Supplier<CompletableFuture<T>> update) {
        CompletableFuture<Void> turn = new CompletableFuture<>();
        CompletableFuture<Void> previous = updateLanes.put(physicalId, turn);
        CompletableFuture<Void> start = previous == null ? CompletableFuture.completedFuture(null) : previous;
        CompletableFuture<T> result = start.thenCompose(v -> update.get());
        result.whenComplete((value, error) -> {
            updateLanes.remove(physicalId, turn);
            turn.complete(null);
        });
        return result;
    }

    /**
     * @return Every key declared on this engine.
     */
    public List<KeyHandle<?>> keys() {
        return ImmutableList.copyOf(registry.values());
    }

    /**
     * @return The declared keys that {@link #clearRemovable()} would wipe.
     */
    public List<KeyHandle<?>> removableKeys() {
        ImmutableList.Builder<KeyHandle<?>> removable = ImmutableList.builder();
        for (KeyHandle<?> handle : registry.values()) {
            if (handle.getDescriptor().isRemovable()) {
                removable.add(handle);
            }
        }
        return removable.build();
    }

    /**
     * Deletes every record in every store and notifies every declared key.
     */
    public CompletableFuture<Void> clear() {
        return ready
                .thenCompose(v -> external.clear())
                .thenCompose(v -> internal.clear())
                .thenCompose(v -> forEachAttached(KeepStorage::clear))
                .thenRun(() -> {
                    logger.info("Cleared all stores.");
                    registry.keySet().forEach(changes::publish);
                });
    }

    /**
     * Deletes every record flagged removable and notifies the removable keys.
     */
    public CompletableFuture<Void> clearRemovable() {
        return ready
                .thenCompose(v -> CompletableFuture.allOf(external.clearRemovable(), internal.clearRemovable()))
                .thenCompose(v -> forEachAttached(KeepStorage::clearRemovable))
                .thenRun(() -> removableKeys().forEach(handle -> changes.publish(handle.getPhysicalId())));
    }

    private CompletableFuture<Void> forEachAttached(Function<KeepStorage, CompletableFuture<Void>> action) {
        List<CompletableFuture<Void>> results = new ArrayList<>();
        attached.forEach((storage, initialized) -> results.add(initialized.thenCompose(v -> action.apply(storage))));
        return CompletableFuture.allOf(results.toArray(new CompletableFuture[0]));
    }

    /**
     * Sends {@code error} to the error sink, once. The error is always logged first.
     */
    public void reportError(KeepException error) {
        if (!error.markReported()) {
            return;
        }
        metrics.errorsReported.increment();
        logger.error("Keep error: {}", error.toString(), error);
        try {
            config.getErrorSink().report(error);
        } catch (RuntimeException e) {
            logger.warn("Error sink threw while handling {}", error, e);
        }
    }

    /**
     * Writes out any debounced consolidated save, lets queued record-file work finish, then
     * stops the engine's threads. Records written after this call are not persisted.
     */
    @Override
    public void close() {
        State previous = state.getAndSet(State.CLOSED);
        if (previous == State.CLOSED) {
            return;
        }
        logger.info("Keep closing...");
        if (ready.isDone() && !ready.isCompletedExceptionally()) {
            try {
                internal.flush().join();
                if (external instanceof RecordFileStorage) {
                    ((RecordFileStorage) external).whenIdle().join();
                }
            } catch (CompletionException e) {
                logger.error("Failed to flush pending writes on close.", e.getCause());
            }
        }
        internal.dispose();
        external.dispose();
        attached.keySet().forEach(KeepStorage::dispose);
        try {
            executor.shutdown();
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("I/O executor did not terminate in time.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while closing.", e);
        } finally {
            scheduler.shutdownNow();
        }
        logger.info("Keep closed.\n{}", metrics.getSummary());
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    /**
     * @return The directory holding this engine's files, or {@code null} before {@link #init}.
     */
    public Path getRoot() { return root; }
    public KeepConfig getConfig() { return config; }
    public KeepMetrics getMetrics() { return metrics; }
    public Encryptor getEncryptor() { return config.getEncryptor(); }
    public ConsolidatedStorage getInternalStorage() { return internal; }
    public KeepStorage getExternalStorage() { return external; }

    /**
     * @return The broadcast channel receiving the physical id of every changed key.
     */
    public ChangeBus changes() { return changes; }

    /**
     * @return The worker pool for file I/O, encoding and decryption.
     */
    public ExecutorService getExecutor() { return executor; }
    public ScheduledExecutorService getScheduler() { return scheduler; }
}

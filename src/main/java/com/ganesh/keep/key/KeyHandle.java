package com.ganesh.keep.key;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ganesh.keep.Keep;
import com.ganesh.keep.codec.ValueType;
import com.ganesh.keep.error.EncryptionException;
import com.ganesh.keep.error.KeepException;
import com.ganesh.keep.event.Subscription;
import com.ganesh.keep.storage.KeepStorage;
import com.google.common.base.MoreObjects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * A declared key: reads, writes and removes one value in whichever store its descriptor selects.
 *
 * <p>Plain and secure keys share this class and differ only in how a value is prepared for
 * storage, selected by {@link KeyKind}. A secure value is wrapped in an envelope carrying the key's
 * name, serialized, and encrypted; the store only ever sees the ciphertext.
 *
 * <p>Reads never fail because of bad data. A value that cannot be decrypted or converted is
 * reported, removed in the background, and read as {@code null}. Writes fail fast: the error is
 * reported and then delivered to the caller.
 *
 * @param <T> The type values are read back as.
 */
public final class KeyHandle<T> {
    private static final Logger logger = LoggerFactory.getLogger(KeyHandle.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Keep keep;
    private final KeyDescriptor descriptor;
    private final Class<T> type;
    private final Function<Object, T> fromStorage;
    private final Function<T, Object> toStorage;
    private final KeyHandle<T> parent;
    private final String subId;
    private volatile SubKeyRegistry<T> subKeys;

    KeyHandle(Keep keep, KeyDescriptor descriptor, Class<T> type, Function<Object, T> fromStorage,
              Function<T, Object> toStorage, KeyHandle<T> parent, String subId) {
        this.keep = keep;
        this.descriptor = descriptor;
        this.type = type;
        this.fromStorage = fromStorage;
        this.toStorage = toStorage;
        this.parent = parent;
        this.subId = subId;
    }

    /**
     * @return The value, or {@code null} if absent or unreadable.
     */
    public CompletableFuture<T> read() {
        return ready().thenCompose(v -> {
            keep.getMetrics().reads.increment();
            return storage().read(descriptor.getPhysicalId())
                    .thenCompose(this::fromStored)
                    .exceptionally(this::recoverRead);
        });
    }

    /**
     * Reads on the calling thread, blocking until the engine is ready if necessary.
     */
    public T readSync() {
        awaitReady();
        keep.getMetrics().reads.increment();
        try {
            Object raw = storage().readSync(descriptor.getPhysicalId());
            if (raw == null) {
                return null;
            }
            switch (descriptor.getKind()) {
                case SECURE:
                    String plaintext = keep.getEncryptor().decryptSync(ciphertext(raw));
                    return convertFromStorage(SecureEnvelope.open(plaintext).getValue());
                case PLAIN:
                default:
                    return convertFromStorage(raw);
            }
        } catch (RuntimeException e) {
            return recoverRead(e);
        }
    }

    public CompletableFuture<T> readOrDefault(T defaultValue) {
        return read().thenApply(value -> value == null ? defaultValue : value);
    }

    public T readSyncOrDefault(T defaultValue) {
        T value = readSync();
        return value == null ? defaultValue : value;
    }

    /**
     * Stores {@code value}. Writing {@code null} removes the key.
     *
     * @return A future that fails with a {@link KeepException} if the value could not be stored.
     */
    public CompletableFuture<Void> write(T value) {
        if (value == null) {
            return remove();
        }
        return ready()
                .thenCompose(v -> toStored(value))
                .thenCompose(stored -> storage().write(descriptor, stored))
                .handle((v, error) -> {
                    if (error != null) {
                        throw reportFailure("Failed to write key '" + getName() + "'", error);
                    }
                    keep.getMetrics().writes.increment();
                    if (parent != null) {
                        parent.subKeys().register(this);
                    }
                    keep.changes().publish(descriptor.getPhysicalId());
                    return null;
                });
    }

    /**
     * Reads the current value, applies {@code update} and writes the result. Concurrent updates of
     * the same key run one after another, so none is lost; a plain {@link #write} may still land
     * between the read and the write of an update.
     *
     * @return The value written.
     */
    public CompletableFuture<T> update(UnaryOperator<T> update) {
        return keep.serializeUpdate(descriptor.getPhysicalId(), () -> read().thenCompose(current -> {
            T next = update.apply(current);
            return write(next).thenApply(v -> next);
        }));
    }

    public CompletableFuture<Void> remove() {
        return ready()
                .thenCompose(v -> storage().remove(descriptor))
                .handle((v, error) -> {
                    if (error != null) {
                        throw reportFailure("Failed to remove key '" + getName() + "'", error);
                    }
                    keep.getMetrics().removes.increment();
                    if (parent != null) {
                        parent.subKeys().unregister(this);
                    }
                    keep.changes().publish(descriptor.getPhysicalId());
                    return null;
                });
    }

    public CompletableFuture<Boolean> exists() {
        return ready().thenCompose(v -> storage().exists(descriptor.getPhysicalId()));
    }

    public boolean existsSync() {
        awaitReady();
        return storage().existsSync(descriptor.getPhysicalId());
    }

    /**
     * Returns the sub-key {@code subId} of this key and records it as instantiated, so that
     * {@link SubKeyRegistry#toList()} reports it even before it is written.
     */
    public KeyHandle<T> sub(String subId) {
        KeyHandle<T> child = child(subId);
        keep.register(child);
        subKeys().register(child);
        return child;
    }

    KeyHandle<T> child(String subId) {
        return new KeyHandle<>(keep, descriptor.child(subId), type, fromStorage, toStorage, this, subId);
    }

    public SubKeyRegistry<T> subKeys() {
        SubKeyRegistry<T> registry = subKeys;
        if (registry == null) {
            synchronized (this) {
                registry = subKeys;
                if (registry == null) {
                    registry = new SubKeyRegistry<>(keep, this);
                    subKeys = registry;
                }
            }
        }
        return registry;
    }

    /**
     * Calls {@code listener} after every successful write or removal of this key, and after clears
     * that affect it.
     */
    public Subscription subscribe(Runnable listener) {
        return keep.changes().subscribe(descriptor.getPhysicalId(), id -> listener.run());
    }

    KeepStorage storage() {
        if (descriptor.getStorage() != null) {
            return descriptor.getStorage();
        }
        return descriptor.isExternal() ? keep.getExternalStorage() : keep.getInternalStorage();
    }

    CompletableFuture<Void> ready() {
        return descriptor.getStorage() != null ? keep.attach(descriptor.getStorage()) : keep.whenReady();
    }

    private void awaitReady() {
        try {
            ready().join();
        } catch (CompletionException e) {
            throw KeepException.wrap("Keep failed to initialize", getName(), unwrap(e));
        }
    }

    private CompletableFuture<T> fromStored(Object raw) {
        if (raw == null) {
            return CompletableFuture.completedFuture(null);
        }
        switch (descriptor.getKind()) {
            case SECURE:
                return keep.getEncryptor().decrypt(ciphertext(raw))
                        .thenApplyAsync(plaintext -> convertFromStorage(SecureEnvelope.open(plaintext).getValue()),
                                keep.getExecutor());
            case PLAIN:
            default:
                return CompletableFuture.completedFuture(convertFromStorage(raw));
        }
    }

    private CompletableFuture<Object> toStored(T value) {
        Object converted = convertToStorage(value);
        switch (descriptor.getKind()) {
            case SECURE:
                return keep.getEncryptor().encrypt(SecureEnvelope.seal(getName(), converted))
                        .thenApply(ciphertext -> (Object) ciphertext);
            case PLAIN:
            default:
                return CompletableFuture.completedFuture(converted);
        }
    }

    private String ciphertext(Object raw) {
        if (!(raw instanceof String)) {
            throw new EncryptionException("Secure record does not hold ciphertext", getName(), null);
        }
        return (String) raw;
    }

    private T convertFromStorage(Object raw) {
        if (fromStorage != null) {
            return fromStorage.apply(raw);
        }
        if (type.isInstance(raw)) {
            return type.cast(raw);
        }
        return MAPPER.convertValue(raw, type);
    }

    private Object convertToStorage(T value) {
        if (toStorage != null) {
            return toStorage.apply(value);
        }
        if (ValueType.infer(value) != ValueType.NULL) {
            return value;
        }
        // Beans and other objects go to storage as maps.
        return MAPPER.convertValue(value, Object.class);
    }

    private T recoverRead(Throwable error) {
        KeepException failure = KeepException.wrap("Unreadable value for key '" + getName() + "'", getName(),
                unwrap(error));
        keep.reportError(failure);
        keep.getMetrics().corruptRecordsDropped.increment();
        logger.warn("Removing unreadable value of '{}'", getName());
        storage().removeKey(descriptor.getPhysicalId()).whenComplete((v, e) -> {
            if (e != null) {
                logger.warn("Could not remove unreadable value of '{}'", getName(), e);
            }
        });
        return null;
    }

    private KeepException reportFailure(String message, Throwable error) {
        KeepException failure = KeepException.wrap(message, getName(), unwrap(error));
        keep.reportError(failure);
        return failure;
    }

    private static Throwable unwrap(Throwable error) {
        while (error instanceof CompletionException && error.getCause() != null) {
            error = error.getCause();
        }
        return error;
    }

    public String getName() { return descriptor.getLogicalName(); }
    public String getPhysicalId() { return descriptor.getPhysicalId(); }
    public KeyDescriptor getDescriptor() { return descriptor; }
    public Class<T> getType() { return type; }

    /**
     * @return The parent key, or {@code null} for a top-level key.
     */
    public KeyHandle<T> getParent() { return parent; }

    /**
     * @return The identifier this sub-key was created with, or {@code null} for a top-level key.
     */
    public String getSubId() { return subId; }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("name", getName())
                .add("physicalId", getPhysicalId())
                .add("kind", descriptor.getKind())
                .toString();
    }
}

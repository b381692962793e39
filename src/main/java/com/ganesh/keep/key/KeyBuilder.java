package com.ganesh.keep.key;

import com.ganesh.keep.Keep;
import com.ganesh.keep.storage.KeepStorage;
import com.google.common.base.Preconditions;

import java.util.function.Function;

/**
 * Declares a key on an engine. Obtained from {@link Keep#key(String)}.
 *
 * <pre>{@code
 * KeyHandle<String> token = keep.key("token", String.class).secure().removable().build();
 * }</pre>
 *
 * @param <T> The type values are read back as.
 */
public class KeyBuilder<T> {
    private final Keep keep;
    private final String name;
    private final Class<T> type;
    private boolean removable;
    private boolean external;
    private boolean secure;
    private KeepStorage storage;
    private Function<Object, T> fromStorage;
    private Function<T, Object> toStorage;

    public KeyBuilder(Keep keep, String name, Class<T> type) {
        this.keep = Preconditions.checkNotNull(keep, "keep");
        this.name = name;
        this.type = Preconditions.checkNotNull(type, "type");
    }

    /**
     * Marks the key for deletion by {@link Keep#clearRemovable()}.
     */
    public KeyBuilder<T> removable() {
        this.removable = true;
        return this;
    }

    /**
     * Stores the key in its own file instead of the consolidated store. Suited to large values.
     */
    public KeyBuilder<T> external() {
        this.external = true;
        return this;
    }

    /**
     * Encrypts the value and hides the key name on disk. Implies {@link #external()}.
     */
    public KeyBuilder<T> secure() {
        this.secure = true;
        return this;
    }

    /**
     * Stores the key in {@code storage} instead of the engine's stores. Implies {@link #external()}.
     */
    public KeyBuilder<T> storage(KeepStorage storage) {
        this.storage = Preconditions.checkNotNull(storage, "storage");
        return this;
    }

    /**
     * Replaces the default value conversion.
     *
     * @param fromStorage Turns a stored value (never {@code null}) into a {@code T}.
     * @param toStorage   Turns a {@code T} into something the codec can encode.
     */
    public KeyBuilder<T> converters(Function<Object, T> fromStorage, Function<T, Object> toStorage) {
        this.fromStorage = Preconditions.checkNotNull(fromStorage, "fromStorage");
        this.toStorage = Preconditions.checkNotNull(toStorage, "toStorage");
        return this;
    }

    /**
     * Creates the handle and registers it with the engine.
     *
     * @throws com.ganesh.keep.error.KeyConflictException if the key was already declared differently.
     */
    public KeyHandle<T> build() {
        KeyDescriptor descriptor = KeyDescriptor.root(name, secure ? KeyKind.SECURE : KeyKind.PLAIN,
                removable, external, storage);
        KeyHandle<T> handle = new KeyHandle<>(keep, descriptor, type, fromStorage, toStorage, null, null);
        keep.register(handle);
        return handle;
    }
}

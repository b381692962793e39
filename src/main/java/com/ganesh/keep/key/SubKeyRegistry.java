package com.ganesh.keep.key;

import com.ganesh.keep.Keep;
import com.ganesh.keep.codec.RecordHeader;
import com.ganesh.keep.event.Subscription;
import com.ganesh.keep.storage.KeepStorage;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.BiConsumer;

/**
 * Sub-keys of one parent key.
 *
 * <p>There is no index file. The registry combines the sub-keys created in this session, whether
 * written or not, with the records found in the stores whose physical id starts with the parent's
 * prefix. Only direct children are reported; a grandchild is found through its own parent.
 *
 * <p>Plain children are named from their record header. Secure children store only their hashed
 * id in the header, so each one is read and decrypted to recover its name.
 *
 * @param <T> The value type of the parent and its sub-keys.
 */
public class SubKeyRegistry<T> {
    private static final Logger logger = LoggerFactory.getLogger(SubKeyRegistry.class);

    private final Keep keep;
    private final KeyHandle<T> parent;
    /** Sub-keys created in this session, by physical id. */
    private final Map<String, KeyHandle<T>> instantiated = new ConcurrentHashMap<>();
    private final Set<BiConsumer<SubKeyEvent, String>> listeners = new CopyOnWriteArraySet<>();

    SubKeyRegistry(Keep keep, KeyHandle<T> parent) {
        this.keep = keep;
        this.parent = parent;
    }

    /**
     * @return {@code true} if the sub-key was not tracked before.
     */
    public boolean register(KeyHandle<T> child) {
        if (instantiated.putIfAbsent(child.getPhysicalId(), child) == null) {
            emit(SubKeyEvent.ADDED, child.getSubId());
            return true;
        }
        return false;
    }

    /**
     * @return {@code true} if the sub-key was tracked.
     */
    public boolean unregister(KeyHandle<T> child) {
        if (instantiated.remove(child.getPhysicalId()) != null) {
            emit(SubKeyEvent.REMOVED, child.getSubId());
            return true;
        }
        return false;
    }

    /**
     * @return The sub-identifiers created in this session.
     */
    public Set<String> instantiatedIds() {
        ImmutableSet.Builder<String> ids = ImmutableSet.builder();
        instantiated.values().forEach(handle -> ids.add(handle.getSubId()));
        return ids.build();
    }

    /**
     * Lists every direct child, instantiated or stored, ordered by sub-identifier.
     */
    public CompletableFuture<List<KeyHandle<T>>> toList() {
        return parent.ready()
                .thenCompose(v -> discover())
                .thenApply(discovered -> {
                    Map<String, KeyHandle<T>> bySubId = new TreeMap<>();
                    instantiated.values().forEach(handle -> bySubId.put(handle.getSubId(), handle));
                    for (String subId : discovered) {
                        bySubId.computeIfAbsent(subId, parent::child);
                    }
                    return ImmutableList.copyOf(bySubId.values());
                });
    }

    private CompletableFuture<List<String>> discover() {
        KeyDescriptor descriptor = parent.getDescriptor();
        KeepStorage internal = keep.getInternalStorage();
        KeepStorage storage = parent.storage();

        return internal.getKeys()
                .thenCombine(storage.getKeys(), (internalIds, storedIds) -> {
                    Map<String, KeepStorage> candidates = new LinkedHashMap<>();
                    for (String id : internalIds) {
                        if (descriptor.isDirectChild(id)) {
                            candidates.put(id, internal);
                        }
                    }
                    for (String id : storedIds) {
                        if (descriptor.isDirectChild(id)) {
                            candidates.putIfAbsent(id, storage);
                        }
                    }
                    return candidates;
                })
                .thenCompose(candidates -> {
                    List<CompletableFuture<String>> names = new ArrayList<>();
                    candidates.forEach((id, store) -> names.add(resolveSubId(id, store)));
                    return CompletableFuture.allOf(names.toArray(new CompletableFuture[0]))
                            .thenApply(v -> {
                                List<String> subIds = new ArrayList<>();
                                for (CompletableFuture<String> name : names) {
                                    String subId = name.join();
                                    if (subId != null) {
                                        subIds.add(subId);
                                    }
                                }
                                return subIds;
                            });
                });
    }

    /**
     * Works out the sub-identifier of the stored child {@code id}.
     *
     * @return A future of the sub-identifier, or of {@code null} if the record cannot be named.
     * Never fails.
     */
    private CompletableFuture<String> resolveSubId(String id, KeepStorage store) {
        return store.header(id)
                .thenCompose(header -> logicalName(id, header, store))
                .thenApply(name -> name == null ? null : toSubId(id, name))
                .exceptionally(error -> {
                    logger.warn("Skipping sub-key '{}' of '{}': {}", id, parent.getName(), error.toString());
                    return null;
                });
    }

    private CompletableFuture<String> logicalName(String id, RecordHeader header, KeepStorage store) {
        if (header == null) {
            return CompletableFuture.completedFuture(null);
        }
        if (!header.isSecure()) {
            return CompletableFuture.completedFuture(header.getLogicalName());
        }
        return store.read(id).thenCompose(raw -> {
            if (!(raw instanceof String)) {
                return CompletableFuture.<String>completedFuture(null);
            }
            return keep.getEncryptor().decrypt((String) raw)
                    .thenApply(plaintext -> SecureEnvelope.open(plaintext).getName());
        });
    }

    private String toSubId(String id, String logicalName) {
        String prefix = parent.getName() + KeyDescriptor.NAME_SEPARATOR;
        if (!logicalName.startsWith(prefix) || logicalName.length() == prefix.length()) {
            logger.warn("Sub-key '{}' has unexpected name '{}' under '{}'", id, logicalName, parent.getName());
            return null;
        }
        String subId = logicalName.substring(prefix.length());
        if (!parent.getDescriptor().child(subId).getPhysicalId().equals(id)) {
            logger.warn("Sub-key '{}' named '{}' does not match its id", id, logicalName);
            return null;
        }
        return subId;
    }

    /**
     * Removes every descendant from the stores and forgets the instantiated sub-keys.
     */
    public CompletableFuture<Void> clear() {
        String prefix = parent.getDescriptor().childPrefix();
        KeepStorage internal = keep.getInternalStorage();
        KeepStorage storage = parent.storage();
        return parent.ready()
                .thenCompose(v -> storage == internal
                        ? removeMatching(internal, prefix)
                        : CompletableFuture.allOf(removeMatching(internal, prefix), removeMatching(storage, prefix)))
                .thenRun(() -> {
                    instantiated.clear();
                    emit(SubKeyEvent.CLEARED, null);
                    logger.info("Cleared sub-keys of '{}'", parent.getName());
                });
    }

    private CompletableFuture<Void> removeMatching(KeepStorage store, String prefix) {
        return store.getKeys().thenCompose(ids -> {
            List<CompletableFuture<Void>> removals = new ArrayList<>();
            for (String id : ids) {
                if (id.startsWith(prefix)) {
                    removals.add(store.removeKey(id).thenRun(() -> keep.changes().publish(id)));
                }
            }
            return CompletableFuture.allOf(removals.toArray(new CompletableFuture[0]));
        });
    }

    /**
     * Calls {@code listener} with each event and the affected sub-identifier
     * ({@code null} for {@link SubKeyEvent#CLEARED}).
     */
    public Subscription listen(BiConsumer<SubKeyEvent, String> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private void emit(SubKeyEvent event, String subId) {
        for (BiConsumer<SubKeyEvent, String> listener : listeners) {
            try {
                listener.accept(event, subId);
            } catch (RuntimeException e) {
                logger.warn("Sub-key listener failed on {} for '{}'", event, subId, e);
            }
        }
    }
}

package com.ganesh.keep.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.Consumer;

/**
 * Broadcast channel for key changes, addressed by physical id.
 *
 * <p>The engine publishes after every successful write or removal and after bulk clears.
 * Listeners run on the publishing thread; a listener that throws is logged and skipped so that
 * it cannot break the write path or other listeners.
 */
public class ChangeBus {
    private static final Logger logger = LoggerFactory.getLogger(ChangeBus.class);

    private final ConcurrentHashMap<String, Set<Consumer<String>>> byId = new ConcurrentHashMap<>();
    private final Set<Consumer<String>> everything = new CopyOnWriteArraySet<>();

    /**
     * Delivers {@code physicalId} to listeners of that id and to catch-all listeners.
     */
    public void publish(String physicalId) {
        Set<Consumer<String>> listeners = byId.get(physicalId);
        if (listeners != null) {
            listeners.forEach(listener -> deliver(listener, physicalId));
        }
        everything.forEach(listener -> deliver(listener, physicalId));
    }

    public Subscription subscribe(String physicalId, Consumer<String> listener) {
        byId.computeIfAbsent(physicalId, id -> new CopyOnWriteArraySet<>()).add(listener);
        return () -> byId.computeIfPresent(physicalId, (id, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    public Subscription subscribeAll(Consumer<String> listener) {
        everything.add(listener);
        return () -> everything.remove(listener);
    }

    private static void deliver(Consumer<String> listener, String physicalId) {
        try {
            listener.accept(physicalId);
        } catch (RuntimeException e) {
            logger.warn("Change listener failed for '{}'", physicalId, e);
        }
    }
}

package com.ganesh.keep.queue;

import com.ganesh.keep.KeepMetrics;
import com.ganesh.keep.error.ErrorSink;
import com.ganesh.keep.error.KeepException;
import com.ganesh.keep.error.SupersededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Serializes and debounces side-effecting operations per logical id.
 *
 * <p><b>Debounce:</b> when a call arrives for an id whose previous call is still waiting out its
 * delay, the previous call never runs. Its future resolves with {@code null} (or, for
 * {@link #runStrict}, fails with {@link SupersededException}).
 *
 * <p><b>Queue:</b> once its delay has elapsed a call joins a FIFO lane for its id and starts only
 * after the previous call in that lane has finished, successfully or not. Lanes for different ids
 * are independent and run in parallel on the supplied executor.
 *
 * <p>A call with a zero delay joins its lane immediately and can therefore not be superseded.
 * An action that has started always runs to completion.
 *
 * <p>Failures thrown by an action are wrapped into a {@link KeepException}, reported to the error
 * sink and delivered to the caller's future.
 */
public class WriteQueue {
    private static final Logger logger = LoggerFactory.getLogger(WriteQueue.class);

    private final String name;
    private final ScheduledExecutorService scheduler;
    private final Executor executor;
    private final ErrorSink errorSink;
    private final KeepMetrics metrics;

    /** Calls still waiting out their debounce delay, at most one per id. */
    private final Map<String, PendingOperation<?>> pending = new ConcurrentHashMap<>();
    /** Tail of each id's execution lane. Guarded by itself. */
    private final Map<String, CompletableFuture<?>> lanes = new HashMap<>();

    private volatile boolean disposed;

    /**
     * @param name      Used in log lines and error messages.
     * @param scheduler Runs debounce timers.
     * @param executor  Runs the actions themselves.
     * @param errorSink Receives every failure raised by an action.
     * @param metrics   Counts superseded calls.
     */
    public WriteQueue(String name, ScheduledExecutorService scheduler, Executor executor,
                      ErrorSink errorSink, KeepMetrics metrics) {
        this.name = name;
        this.scheduler = scheduler;
        this.executor = executor;
        this.errorSink = errorSink;
        this.metrics = metrics;
    }

    /**
     * Runs {@code action} for {@code id} without debouncing.
     */
    public <T> CompletableFuture<T> run(String id, Callable<T> action) {
        return schedule(id, action, Duration.ZERO, false);
    }

    /**
     * Runs {@code action} for {@code id} after {@code delay}. If superseded while waiting,
     * the returned future resolves with {@code null}.
     */
    public <T> CompletableFuture<T> run(String id, Callable<T> action, Duration delay) {
        return schedule(id, action, delay, false);
    }

    /**
     * Like {@link #run(String, Callable, Duration)}, but a superseded call fails with
     * {@link SupersededException} instead of resolving with {@code null}.
     */
    public <T> CompletableFuture<T> runStrict(String id, Callable<T> action, Duration delay) {
        return schedule(id, action, delay, true);
    }

    private <T> CompletableFuture<T> schedule(String id, Callable<T> action, Duration delay, boolean strict) {
        CompletableFuture<T> result = new CompletableFuture<>();
        if (disposed) {
            result.completeExceptionally(new KeepException("Write queue '" + name + "' is disposed", id, null));
            return result;
        }

        if (delay.isZero() || delay.isNegative()) {
            PendingOperation<?> previous = pending.remove(id);
            if (previous != null) {
                previous.supersede();
            }
            enqueue(id, action, result);
            return result;
        }

        PendingOperation<T> operation = new PendingOperation<>(id, result, strict);
        PendingOperation<?> previous = pending.put(id, operation);
        if (previous != null) {
            previous.supersede();
        }
        operation.timer = scheduler.schedule(() -> {
            // Losing this race means a newer call replaced us; that call owns the id now.
            if (pending.remove(id, operation)) {
                enqueue(id, action, result);
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
        return result;
    }

    private <T> void enqueue(String id, Callable<T> action, CompletableFuture<T> result) {
        CompletableFuture<T> current;
        synchronized (lanes) {
            CompletableFuture<?> tail = lanes.get(id);
            CompletableFuture<?> previous = tail == null ? CompletableFuture.completedFuture(null) : tail;
            current = previous
                    .handle((ignored, error) -> null)
                    .thenApplyAsync(ignored -> execute(id, action), executor);
            lanes.put(id, current);
        }
        final CompletableFuture<T> lane = current;
        lane.whenComplete((value, error) -> {
            synchronized (lanes) {
                if (lanes.get(id) == lane) {
                    lanes.remove(id);
                }
            }
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else {
                result.complete(value);
            }
        });
    }

    private <T> T execute(String id, Callable<T> action) {
        try {
            return action.call();
        } catch (Exception e) {
            KeepException exception = KeepException.wrap("Queued operation failed for '" + id + "'", null, e);
            logger.debug("[{}] operation for '{}' failed: {}", name, id, exception.getMessage());
            errorSink.report(exception);
            throw exception;
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    /**
     * @return A future that completes once every action currently queued or executing has finished.
     * Calls still waiting out a debounce delay are not included.
     */
    public CompletableFuture<Void> whenIdle() {
        List<CompletableFuture<?>> tails;
        synchronized (lanes) {
            tails = new ArrayList<>(lanes.values());
        }
        return CompletableFuture.allOf(tails.stream()
                .map(f -> f.handle((ignored, error) -> null))
                .toArray(CompletableFuture[]::new));
    }

    /**
     * @return Whether a call for {@code id} is waiting out its debounce delay.
     */
    public boolean isPending(String id) {
        return pending.containsKey(id);
    }

    /**
     * Cancels every debounce timer and resolves the affected futures so no caller waits forever.
     * Actions already queued or running are left to finish. Further calls fail immediately.
     */
    public void dispose() {
        disposed = true;
        int cancelled = 0;
        for (String id : new ArrayList<>(pending.keySet())) {
            PendingOperation<?> operation = pending.remove(id);
            if (operation != null) {
                operation.supersede();
                cancelled++;
            }
        }
        if (cancelled > 0) {
            logger.info("[{}] disposed with {} pending operation(s) cancelled.", name, cancelled);
        }
    }

    /**
     * A call waiting out its debounce delay.
     */
    private final class PendingOperation<T> {
        private final String id;
        private final CompletableFuture<T> result;
        private final boolean strict;
        private volatile ScheduledFuture<?> timer;

        PendingOperation(String id, CompletableFuture<T> result, boolean strict) {
            this.id = id;
            this.result = result;
            this.strict = strict;
        }

        void supersede() {
            ScheduledFuture<?> scheduled = timer;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
            metrics.superseded.increment();
            if (strict) {
                result.completeExceptionally(new SupersededException(
                        "Operation superseded by a newer request", id, null));
            } else {
                result.complete(null);
            }
        }
    }
}

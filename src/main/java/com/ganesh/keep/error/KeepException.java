package com.ganesh.keep.error;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base type for every failure raised by the storage engine.
 *
 * <p>All engine errors are unchecked. Asynchronous operations surface them as the exceptional
 * completion of the returned future; synchronous operations throw them directly. Every instance
 * is also reported to the engine's error sink before it reaches the caller.
 */
public class KeepException extends RuntimeException {
    private final String keyName;
    private final AtomicBoolean reported = new AtomicBoolean();

    public KeepException(String message) {
        this(message, null, null);
    }

    public KeepException(String message, Throwable cause) {
        this(message, null, cause);
    }

    /**
     * @param message A description of the failure.
     * @param keyName The logical name of the key involved, or {@code null} if none.
     * @param cause   The underlying error, or {@code null}.
     */
    public KeepException(String message, String keyName, Throwable cause) {
        super(message, cause);
        this.keyName = keyName;
    }

    /**
     * @return The logical name of the key this failure relates to, or {@code null}.
     */
    public String getKeyName() { return keyName; }

    /**
     * Marks this failure as delivered to the error sink.
     * @return {@code true} the first time only, so a failure that crosses several layers is reported once.
     */
    public boolean markReported() {
        return reported.compareAndSet(false, true);
    }

    /**
     * Wraps an arbitrary throwable, passing {@link KeepException}s through untouched.
     */
    public static KeepException wrap(String message, String keyName, Throwable error) {
        if (error instanceof KeepException) {
            return (KeepException) error;
        }
        return new KeepException(message, keyName, error);
    }

    @Override
    public String toString() {
        String base = getClass().getSimpleName() + ": " + getMessage();
        return keyName == null ? base : base + " (key: " + keyName + ")";
    }
}

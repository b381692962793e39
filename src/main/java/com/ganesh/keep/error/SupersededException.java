package com.ganesh.keep.error;

/**
 * Raised when a debounced operation is replaced by a newer one and the caller asked for a
 * non-neutral outcome.
 */
public class SupersededException extends KeepException {

    public SupersededException(String message) {
        super(message);
    }

    public SupersededException(String message, Throwable cause) {
        super(message, cause);
    }

    public SupersededException(String message, String keyName, Throwable cause) {
        super(message, keyName, cause);
    }
}

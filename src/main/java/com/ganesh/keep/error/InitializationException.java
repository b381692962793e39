package com.ganesh.keep.error;

/**
 * Raised when the root directory, a backing file or a storage backend cannot be prepared.
 */
public class InitializationException extends KeepException {

    public InitializationException(String message) {
        super(message);
    }

    public InitializationException(String message, Throwable cause) {
        super(message, cause);
    }

    public InitializationException(String message, String keyName, Throwable cause) {
        super(message, keyName, cause);
    }
}

package com.ganesh.keep.error;

/**
 * Raised when a filesystem operation fails.
 */
public class StorageIOException extends KeepException {

    public StorageIOException(String message) {
        super(message);
    }

    public StorageIOException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageIOException(String message, String keyName, Throwable cause) {
        super(message, keyName, cause);
    }
}

package com.ganesh.keep.error;

/**
 * Raised when a key is registered under a physical id already bound to an incompatible key.
 */
public class KeyConflictException extends KeepException {

    public KeyConflictException(String message) {
        super(message);
    }

    public KeyConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    public KeyConflictException(String message, String keyName, Throwable cause) {
        super(message, keyName, cause);
    }
}

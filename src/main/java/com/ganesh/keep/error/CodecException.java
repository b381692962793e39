package com.ganesh.keep.error;

/**
 * Raised when bytes are corrupt, a codec version is unsupported, or a value cannot be encoded.
 *
 * <p>On the read path this is always recoverable: callers treat the record as absent.
 */
public class CodecException extends KeepException {

    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }

    public CodecException(String message, String keyName, Throwable cause) {
        super(message, keyName, cause);
    }
}

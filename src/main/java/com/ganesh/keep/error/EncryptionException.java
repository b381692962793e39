package com.ganesh.keep.error;

/**
 * Raised when the encryptor fails to encrypt or decrypt a payload.
 */
public class EncryptionException extends KeepException {

    public EncryptionException(String message) {
        super(message);
    }

    public EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }

    public EncryptionException(String message, String keyName, Throwable cause) {
        super(message, keyName, cause);
    }
}

package com.ganesh.keep.crypto;

import java.util.concurrent.CompletableFuture;

/**
 * Field-level encryption used by secure keys.
 *
 * <p>The asynchronous methods are used on the regular read/write paths; the synchronous ones back
 * {@code readSync()}. An implementation whose cipher is inherently asynchronous may throw
 * {@link UnsupportedOperationException} from the synchronous variants.
 */
public interface Encryptor {

    /**
     * Prepares key material. Called once by the engine before any store is opened.
     */
    CompletableFuture<Void> init();

    default CompletableFuture<String> encrypt(String plaintext) {
        return CompletableFuture.completedFuture(encryptSync(plaintext));
    }

    String encryptSync(String plaintext);

    default CompletableFuture<String> decrypt(String ciphertext) {
        return CompletableFuture.completedFuture(decryptSync(ciphertext));
    }

    String decryptSync(String ciphertext);
}

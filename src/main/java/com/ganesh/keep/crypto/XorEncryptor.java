package com.ganesh.keep.crypto;

import com.ganesh.keep.error.EncryptionException;
import com.google.common.base.Preconditions;
import com.google.common.io.BaseEncoding;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

/**
 * Default encryptor: XORs the UTF-8 bytes with a repeating key and renders the result as base64.
 *
 * <p>This is obfuscation, not encryption. Anyone holding the key, or enough ciphertext, can
 * recover the plaintext. Production use should supply an authenticated cipher such as AES-GCM.
 */
public class XorEncryptor implements Encryptor {
    private static final BaseEncoding BASE64 = BaseEncoding.base64();

    private final byte[] key;

    public XorEncryptor(String secureKey) {
        Preconditions.checkArgument(secureKey != null && !secureKey.isEmpty(), "secureKey must not be empty");
        this.key = secureKey.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @return An encryptor using the built-in key of 32 {@code '0'} characters.
     */
    public static XorEncryptor withDefaultKey() {
        return new XorEncryptor("0".repeat(32));
    }

    @Override
    public CompletableFuture<Void> init() {
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public String encryptSync(String plaintext) {
        return BASE64.encode(xor(plaintext.getBytes(StandardCharsets.UTF_8)));
    }

    @Override
    public String decryptSync(String ciphertext) {
        byte[] bytes;
        try {
            bytes = BASE64.decode(ciphertext);
        } catch (IllegalArgumentException e) {
            throw new EncryptionException("Ciphertext is not valid base64", e);
        }
        return new String(xor(bytes), StandardCharsets.UTF_8);
    }

    private byte[] xor(byte[] input) {
        byte[] out = new byte[input.length];
        for (int i = 0; i < input.length; i++) {
            out[i] = (byte) (input[i] ^ key[i % key.length]);
        }
        return out;
    }
}

package com.ganesh.keep.key;

/**
 * How a key treats its value on the way to storage.
 */
public enum KeyKind {
    /** Stored as-is, after the optional converters. */
    PLAIN,
    /** Wrapped with its name, encrypted, and stored under a hashed id. */
    SECURE
}

package com.ganesh.keep.key;

import com.ganesh.keep.codec.KeepCodec;
import com.ganesh.keep.storage.AtomicFileWriter;
import com.ganesh.keep.storage.KeepStorage;
import com.google.common.base.CharMatcher;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import java.nio.charset.StandardCharsets;

/**
 * Identity and storage placement of a key.
 *
 * <p>The physical id is what the stores see. For a plain top-level key it is the logical name;
 * for a secure key it is the hash of the name. A sub-key's id is its parent's id, the separator,
 * and the hash of the two joined, so that every child of a parent shares the prefix
 * {@code parentId + "$"} and a direct child has no further separator after it.
 *
 * <p>Secure keys and sub-keys always live in the per-record store (or the key's own backend).
 */
public final class KeyDescriptor {
    public static final String SEPARATOR = "$";
    /** Joins a parent's logical name and a sub-identifier. */
    public static final String NAME_SEPARATOR = ".";

    private static final CharMatcher FORBIDDEN = CharMatcher.anyOf(SEPARATOR + "/\\\0");

    private final String physicalId;
    private final String logicalName;
    private final KeyKind kind;
    private final boolean removable;
    private final boolean external;
    private final KeepStorage storage;
    private final KeyDescriptor parent;

    private KeyDescriptor(String physicalId, String logicalName, KeyKind kind, boolean removable,
                          boolean external, KeepStorage storage, KeyDescriptor parent) {
        this.physicalId = physicalId;
        this.logicalName = logicalName;
        this.kind = kind;
        this.removable = removable;
        this.external = external;
        this.storage = storage;
        this.parent = parent;
    }

    /**
     * Describes a top-level key.
     *
     * @param storage A dedicated backend, or {@code null} to use the engine's stores.
     * @throws IllegalArgumentException if a plain key's name cannot be used as a file name.
     */
    public static KeyDescriptor root(String logicalName, KeyKind kind, boolean removable,
                                     boolean external, KeepStorage storage) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(logicalName), "key name must not be empty");
        Preconditions.checkNotNull(kind, "kind");
        String physicalId;
        if (kind == KeyKind.SECURE) {
            physicalId = KeepCodec.hash(logicalName);
        } else {
            Preconditions.checkArgument(FORBIDDEN.matchesNoneOf(logicalName),
                    "key name '%s' must not contain '$', '/', '\\' or NUL", logicalName);
            Preconditions.checkArgument(!logicalName.endsWith(AtomicFileWriter.TEMP_SUFFIX),
                    "key name '%s' must not end with %s", logicalName, AtomicFileWriter.TEMP_SUFFIX);
            Preconditions.checkArgument(!logicalName.equals(".") && !logicalName.equals(".."),
                    "key name '%s' is reserved", logicalName);
            Preconditions.checkArgument(
                    logicalName.getBytes(StandardCharsets.UTF_8).length <= KeepCodec.MAX_NAME_BYTES,
                    "key name '%s' is longer than %s bytes", logicalName, KeepCodec.MAX_NAME_BYTES);
            physicalId = logicalName;
        }
        boolean placedExternally = external || kind == KeyKind.SECURE || storage != null;
        return new KeyDescriptor(physicalId, logicalName, kind, removable, placedExternally, storage, null);
    }

    /**
     * Describes the sub-key {@code subId} of this key. It inherits kind, flags and backend.
     */
    public KeyDescriptor child(String subId) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(subId), "sub-key id must not be empty");
        String childId = physicalId + SEPARATOR + KeepCodec.hash(physicalId + SEPARATOR + subId);
        return new KeyDescriptor(childId, logicalName + NAME_SEPARATOR + subId, kind, removable,
                true, storage, this);
    }

    /**
     * @return Whether {@code id} names a direct child of this key.
     */
    public boolean isDirectChild(String id) {
        String prefix = childPrefix();
        return id.length() > prefix.length()
                && id.startsWith(prefix)
                && !id.substring(prefix.length()).contains(SEPARATOR);
    }

    /**
     * @return The prefix shared by the physical ids of every descendant.
     */
    public String childPrefix() {
        return physicalId + SEPARATOR;
    }

    /**
     * The name written into the record header. Secure keys write their physical id so the
     * logical name only exists inside the ciphertext.
     */
    public String getStoredName() {
        return isSecure() ? physicalId : logicalName;
    }

    public int flags() {
        return KeepCodec.flags(removable, isSecure());
    }

    /**
     * @return Whether two declarations of the same physical id agree on how it is stored.
     */
    public boolean isCompatible(KeyDescriptor other) {
        return kind == other.kind
                && removable == other.removable
                && external == other.external
                && storage == other.storage;
    }

    public String getPhysicalId() { return physicalId; }
    public String getLogicalName() { return logicalName; }
    public KeyKind getKind() { return kind; }
    public boolean isSecure() { return kind == KeyKind.SECURE; }
    public boolean isRemovable() { return removable; }
    public boolean isExternal() { return external; }
    public KeepStorage getStorage() { return storage; }
    public KeyDescriptor getParent() { return parent; }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("physicalId", physicalId)
                .add("logicalName", logicalName)
                .add("kind", kind)
                .add("removable", removable)
                .add("external", external)
                .omitNullValues()
                .add("storage", storage == null ? null : storage.getClass().getSimpleName())
                .toString();
    }
}

package com.ganesh.keep.key;

/**
 * Change to the set of sub-keys tracked by a {@link SubKeyRegistry}.
 */
public enum SubKeyEvent {
    ADDED,
    REMOVED,
    /** Every sub-key was removed; no sub-identifier accompanies this event. */
    CLEARED
}

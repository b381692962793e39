package com.ganesh.keep.error;

/**
 * Single funnel through which the engine reports every failure, whether it was self-healed
 * on a read path or propagated to a caller on a write path.
 */
@FunctionalInterface
public interface ErrorSink {

    /** A sink that discards reports; the engine still logs them. */
    ErrorSink NONE = error -> { };

    void report(KeepException error);
}

package com.ganesh.keep.event;

/**
 * Handle returned by a subscription; closing it stops further deliveries.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}

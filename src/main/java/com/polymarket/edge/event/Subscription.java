package com.polymarket.edge.event;

/**
 * Handle returned by listener registration; {@link #unsubscribe()} is idempotent.
 */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}

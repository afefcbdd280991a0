package com.questrail.possync.api;

/**
 * Handle returned by a subscribe call.
 */
@FunctionalInterface
public interface Subscription
{
    /**
     * Removes the listener. Idempotent.
     */
    void unsubscribe();
}

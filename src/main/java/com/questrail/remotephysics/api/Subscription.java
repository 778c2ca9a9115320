package com.questrail.remotephysics.api;

/**
 * Handle returned when a listener is registered with a {@link PhysicsMessenger}.
 */
@FunctionalInterface
public interface Subscription {

    /**
     * Removes the listener.
     *
     * @return {@code true} if the listener was still registered
     */
    boolean cancel();
}

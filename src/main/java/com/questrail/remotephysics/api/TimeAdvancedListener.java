package com.questrail.remotephysics.api;

/**
 * Notified when the remote engine has completed a time step for this
 * simulation.
 */
@FunctionalInterface
public interface TimeAdvancedListener {
    void onTimeAdvanced();
}

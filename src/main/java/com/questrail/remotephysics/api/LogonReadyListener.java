package com.questrail.remotephysics.api;

/**
 * Notified when the remote engine has fully processed a logon.
 */
@FunctionalInterface
public interface LogonReadyListener {
    void onLogonReady(int simulationId);
}

package com.questrail.remotephysics.protocol.app.model;

/**
 * Sent by the remote engine once a logon has been fully processed.
 */
public record LogonReady(int simulationId) implements AppMessage
{
    @Override
    public AppMessageType type() {
        return AppMessageType.LOGON_READY;
    }
}

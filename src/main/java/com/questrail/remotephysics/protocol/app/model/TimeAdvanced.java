package com.questrail.remotephysics.protocol.app.model;

/**
 * Sent by the remote engine when a step requested by {@link AdvanceTime}
 * has completed.
 */
public record TimeAdvanced(int simulationId) implements AppMessage
{
    @Override
    public AppMessageType type() {
        return AppMessageType.TIME_ADVANCED;
    }
}

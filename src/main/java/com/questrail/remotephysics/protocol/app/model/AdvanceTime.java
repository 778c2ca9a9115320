package com.questrail.remotephysics.protocol.app.model;

/**
 * Requests a simulation step of {@code time} seconds.
 */
public record AdvanceTime(int simulationId, float time) implements AppMessage
{
    @Override
    public AppMessageType type() {
        return AppMessageType.ADVANCE_TIME;
    }
}

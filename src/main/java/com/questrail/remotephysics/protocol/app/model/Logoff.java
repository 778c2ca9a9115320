package com.questrail.remotephysics.protocol.app.model;

public record Logoff(int simulationId) implements AppMessage
{
    @Override
    public AppMessageType type() {
        return AppMessageType.LOGOFF;
    }
}

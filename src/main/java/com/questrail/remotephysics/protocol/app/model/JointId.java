package com.questrail.remotephysics.protocol.app.model;

public record JointId(int simulationId, int jointId)
{
    @Override
    public String toString() {
        return "JointId[" + Integer.toUnsignedString(simulationId) + ":" + Integer.toUnsignedString(jointId) + "]";
    }
}

package com.questrail.remotephysics.protocol.app.model;

/**
 * Wire identity of an actor: the owning simulation plus the actor's ID within
 * that simulation. Both values are unsigned 32-bit on the wire.
 */
public record ActorId(int simulationId, int actorId)
{
    @Override
    public String toString() {
        return "ActorId[" + Integer.toUnsignedString(simulationId) + ":" + Integer.toUnsignedString(actorId) + "]";
    }
}

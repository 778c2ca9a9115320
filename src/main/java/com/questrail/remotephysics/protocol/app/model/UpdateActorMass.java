package com.questrail.remotephysics.protocol.app.model;

import java.util.Objects;

/**
 * Mass of a dynamic actor, as reported by the remote engine.
 */
public record UpdateActorMass(ActorId actor, float mass) implements AppMessage
{
    public UpdateActorMass {
        Objects.requireNonNull(actor, "actor");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.UPDATE_ACTOR_MASS;
    }
}

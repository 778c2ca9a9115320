package com.questrail.remotephysics.protocol.app.model;

import com.questrail.remotephysics.api.Vector3;

import java.util.Objects;

public record UpdateActorLinearVelocity(ActorId actor, Vector3 velocity) implements AppMessage
{
    public UpdateActorLinearVelocity {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(velocity, "velocity");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.UPDATE_ACTOR_LINEAR_VELOCITY;
    }
}

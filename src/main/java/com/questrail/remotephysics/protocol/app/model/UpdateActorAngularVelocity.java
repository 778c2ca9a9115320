package com.questrail.remotephysics.protocol.app.model;

import com.questrail.remotephysics.api.Vector3;

import java.util.Objects;

public record UpdateActorAngularVelocity(ActorId actor, Vector3 velocity) implements AppMessage
{
    public UpdateActorAngularVelocity {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(velocity, "velocity");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.UPDATE_ACTOR_ANGULAR_VELOCITY;
    }
}

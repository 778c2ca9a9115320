package com.questrail.remotephysics.protocol.app.model;

import java.util.Objects;

public record GetActorMass(ActorId actor) implements AppMessage
{
    public GetActorMass {
        Objects.requireNonNull(actor, "actor");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.GET_ACTOR_MASS;
    }
}

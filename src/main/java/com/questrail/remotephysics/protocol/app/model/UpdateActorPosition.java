package com.questrail.remotephysics.protocol.app.model;

import com.questrail.remotephysics.api.Vector3;

import java.util.Objects;

public record UpdateActorPosition(ActorId actor, Vector3 position) implements AppMessage
{
    public UpdateActorPosition {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(position, "position");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.UPDATE_ACTOR_POSITION;
    }
}

package com.questrail.remotephysics.protocol.app.model;

import com.questrail.remotephysics.api.Quaternion;

import java.util.Objects;

public record UpdateActorOrientation(ActorId actor, Quaternion orientation) implements AppMessage
{
    public UpdateActorOrientation {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(orientation, "orientation");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.UPDATE_ACTOR_ORIENTATION;
    }
}

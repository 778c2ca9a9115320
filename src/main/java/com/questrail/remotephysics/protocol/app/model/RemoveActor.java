package com.questrail.remotephysics.protocol.app.model;

import java.util.Objects;

public record RemoveActor(ActorId actor) implements AppMessage
{
    public RemoveActor {
        Objects.requireNonNull(actor, "actor");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.REMOVE_ACTOR;
    }
}

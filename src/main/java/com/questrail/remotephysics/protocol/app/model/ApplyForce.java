package com.questrail.remotephysics.protocol.app.model;

import com.questrail.remotephysics.api.Vector3;

import java.util.Objects;

public record ApplyForce(ActorId actor, Vector3 force) implements AppMessage
{
    public ApplyForce {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(force, "force");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.APPLY_FORCE;
    }
}

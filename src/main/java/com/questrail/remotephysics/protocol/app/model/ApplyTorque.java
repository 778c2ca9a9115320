package com.questrail.remotephysics.protocol.app.model;

import com.questrail.remotephysics.api.Vector3;

import java.util.Objects;

public record ApplyTorque(ActorId actor, Vector3 torque) implements AppMessage
{
    public ApplyTorque {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(torque, "torque");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.APPLY_TORQUE;
    }
}

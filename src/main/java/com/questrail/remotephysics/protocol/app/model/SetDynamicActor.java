package com.questrail.remotephysics.protocol.app.model;

import com.questrail.remotephysics.api.Quaternion;
import com.questrail.remotephysics.api.Vector3;

import java.util.Objects;

/**
 * Full state of a dynamic actor. Sent in both directions: as a command and as
 * the engine's per-step update notification.
 */
public record SetDynamicActor(
        ActorId actor,
        Vector3 position,
        Quaternion orientation,
        float gravityModifier,
        Vector3 linearVelocity,
        Vector3 angularVelocity
) implements AppMessage
{
    public SetDynamicActor {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(orientation, "orientation");
        Objects.requireNonNull(linearVelocity, "linearVelocity");
        Objects.requireNonNull(angularVelocity, "angularVelocity");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.SET_DYNAMIC_ACTOR;
    }
}

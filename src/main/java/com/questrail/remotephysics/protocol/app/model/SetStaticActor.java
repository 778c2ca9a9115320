package com.questrail.remotephysics.protocol.app.model;

import com.questrail.remotephysics.api.Quaternion;
import com.questrail.remotephysics.api.Vector3;

import java.util.Objects;

/**
 * Full pose of a static actor. Sent in both directions: as a command and as
 * the engine's update notification.
 */
public record SetStaticActor(ActorId actor, Vector3 position, Quaternion orientation) implements AppMessage
{
    public SetStaticActor {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(orientation, "orientation");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.SET_STATIC_ACTOR;
    }
}

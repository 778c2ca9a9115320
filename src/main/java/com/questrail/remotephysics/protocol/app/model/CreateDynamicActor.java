package com.questrail.remotephysics.protocol.app.model;

import com.questrail.remotephysics.api.Quaternion;
import com.questrail.remotephysics.api.Vector3;

import java.util.Objects;

/**
 * Creates a dynamic (simulated) actor.
 *
 * <p>Flags share their meaning with {@link CreateStaticActor#FLAG_REPORT_COLLISIONS}.</p>
 */
public record CreateDynamicActor(
        ActorId actor,
        Vector3 position,
        Quaternion orientation,
        float gravityModifier,
        Vector3 linearVelocity,
        Vector3 angularVelocity,
        int flags
) implements AppMessage
{
    public CreateDynamicActor {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(orientation, "orientation");
        Objects.requireNonNull(linearVelocity, "linearVelocity");
        Objects.requireNonNull(angularVelocity, "angularVelocity");
    }

    public boolean reportCollisions() {
        return (flags & CreateStaticActor.FLAG_REPORT_COLLISIONS) != 0;
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.CREATE_DYNAMIC_ACTOR;
    }
}

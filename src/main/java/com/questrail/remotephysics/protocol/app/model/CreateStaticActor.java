package com.questrail.remotephysics.protocol.app.model;

import com.questrail.remotephysics.api.Quaternion;
import com.questrail.remotephysics.api.Vector3;

import java.util.Objects;

public record CreateStaticActor(
        ActorId actor,
        Vector3 position,
        Quaternion orientation,
        int flags
) implements AppMessage
{
    /** Bit 0 of {@code flags}: the engine reports collisions of this actor. */
    public static final int FLAG_REPORT_COLLISIONS = 0x1;

    public CreateStaticActor {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(orientation, "orientation");
    }

    public static CreateStaticActor of(ActorId actor, Vector3 position, Quaternion orientation, boolean reportCollisions) {
        return new CreateStaticActor(actor, position, orientation, reportCollisions ? FLAG_REPORT_COLLISIONS : 0);
    }

    public boolean reportCollisions() {
        return (flags & FLAG_REPORT_COLLISIONS) != 0;
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.CREATE_STATIC_ACTOR;
    }
}

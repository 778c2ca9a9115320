package com.questrail.remotephysics.protocol.app.model;

import com.questrail.remotephysics.api.Vector3;

import java.util.Objects;

/**
 * Collision report from the remote engine.
 *
 * <p>{@code collidingActor} is the actor that moved into {@code collidedActor}.
 * A negative {@code separation} is the penetration depth.</p>
 */
public record ActorsCollided(
        ActorId collidingActor,
        ActorId collidedActor,
        Vector3 contactPoint,
        Vector3 contactNormal,
        float separation
) implements AppMessage
{
    public ActorsCollided {
        Objects.requireNonNull(collidingActor, "collidingActor");
        Objects.requireNonNull(collidedActor, "collidedActor");
        Objects.requireNonNull(contactPoint, "contactPoint");
        Objects.requireNonNull(contactNormal, "contactNormal");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.ACTORS_COLLIDED;
    }
}

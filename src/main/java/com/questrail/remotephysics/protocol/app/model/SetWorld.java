package com.questrail.remotephysics.protocol.app.model;

import com.questrail.remotephysics.api.Vector3;

import java.util.Objects;

/**
 * World-wide physical properties plus the ground plane.
 *
 * <p>{@code world} names the simulation and the ID of the ground plane actor.</p>
 */
public record SetWorld(
        ActorId world,
        Vector3 gravity,
        float staticFriction,
        float kineticFriction,
        float restitution,
        float collisionMargin,
        float groundPlaneHeight,
        Vector3 groundPlaneNormal
) implements AppMessage
{
    public SetWorld {
        Objects.requireNonNull(world, "world");
        Objects.requireNonNull(gravity, "gravity");
        Objects.requireNonNull(groundPlaneNormal, "groundPlaneNormal");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.SET_WORLD;
    }
}

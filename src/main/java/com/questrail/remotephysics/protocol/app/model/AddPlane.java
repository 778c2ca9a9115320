package com.questrail.remotephysics.protocol.app.model;

import com.questrail.remotephysics.api.Vector3;

import java.util.Objects;

/**
 * Infinite plane {@code normal . p = constant}.
 */
public record AddPlane(ShapeId shape, Vector3 normal, float constant) implements AppMessage
{
    public AddPlane {
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(normal, "normal");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.ADD_PLANE;
    }
}

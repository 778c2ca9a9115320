package com.questrail.remotephysics.protocol.app.model;

import com.questrail.remotephysics.api.Vector3;

import java.util.Objects;

public record AddSphere(ShapeId shape, Vector3 origin, float radius) implements AppMessage
{
    public AddSphere {
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(origin, "origin");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.ADD_SPHERE;
    }
}

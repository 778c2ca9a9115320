package com.questrail.remotephysics.protocol.app.model;

import java.util.Objects;

public record AddCapsule(ShapeId shape, float radius, float height) implements AppMessage
{
    public AddCapsule {
        Objects.requireNonNull(shape, "shape");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.ADD_CAPSULE;
    }
}

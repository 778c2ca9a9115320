package com.questrail.remotephysics.protocol.app.model;

import java.util.Objects;

public record DetachShape(ActorId actor, ShapeId shape) implements AppMessage
{
    public DetachShape {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(shape, "shape");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.DETACH_SHAPE;
    }
}

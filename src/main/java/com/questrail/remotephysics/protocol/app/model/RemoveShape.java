package com.questrail.remotephysics.protocol.app.model;

import java.util.Objects;

public record RemoveShape(ShapeId shape) implements AppMessage
{
    public RemoveShape {
        Objects.requireNonNull(shape, "shape");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.REMOVE_SHAPE;
    }
}

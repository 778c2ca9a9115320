package com.questrail.remotephysics.protocol.app.model;

import java.util.Objects;

public record AddBox(ShapeId shape, float length, float width, float height) implements AppMessage
{
    public AddBox {
        Objects.requireNonNull(shape, "shape");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.ADD_BOX;
    }
}

package com.questrail.remotephysics.protocol.app.model;

import java.util.Objects;

public record UpdateShapeMaterial(ActorId actor, ShapeId shape, Material material) implements AppMessage
{
    public UpdateShapeMaterial {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(material, "material");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.UPDATE_SHAPE_MATERIAL;
    }
}

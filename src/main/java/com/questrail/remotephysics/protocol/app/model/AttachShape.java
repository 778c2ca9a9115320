package com.questrail.remotephysics.protocol.app.model;

import com.questrail.remotephysics.api.Quaternion;
import com.questrail.remotephysics.api.Vector3;

import java.util.Objects;

/**
 * Attaches a previously added shape to an actor with a local pose and a
 * surface material.
 */
public record AttachShape(
        ActorId actor,
        ShapeId shape,
        Material material,
        Quaternion orientation,
        Vector3 translation
) implements AppMessage
{
    public AttachShape {
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(material, "material");
        Objects.requireNonNull(orientation, "orientation");
        Objects.requireNonNull(translation, "translation");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.ATTACH_SHAPE;
    }
}

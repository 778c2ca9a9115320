package com.questrail.remotephysics.protocol.app.model;

/**
 * Wire identity of a collision shape.
 */
public record ShapeId(int simulationId, int shapeId)
{
    @Override
    public String toString() {
        return "ShapeId[" + Integer.toUnsignedString(simulationId) + ":" + Integer.toUnsignedString(shapeId) + "]";
    }
}

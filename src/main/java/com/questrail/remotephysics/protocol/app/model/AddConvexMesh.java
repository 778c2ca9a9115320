package com.questrail.remotephysics.protocol.app.model;

import com.questrail.remotephysics.api.Vector3;

import java.util.List;
import java.util.Objects;

/**
 * Convex hull given by its points.
 *
 * <p>Encoded as a point count followed by the points, so the body size is
 * {@code 8 + 4 + 12 * points.size()}.</p>
 */
public record AddConvexMesh(ShapeId shape, List<Vector3> points) implements AppMessage
{
    public AddConvexMesh {
        Objects.requireNonNull(shape, "shape");
        points = List.copyOf(Objects.requireNonNull(points, "points"));
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.ADD_CONVEX_MESH;
    }
}

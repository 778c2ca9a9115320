package com.questrail.remotephysics.protocol.app.model;

import com.questrail.remotephysics.api.Vector3;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Arbitrary triangle mesh.
 *
 * <p>Wire layout after the shape ID: point count, triangle count, the points,
 * then one index triple per triangle.</p>
 */
public record AddTriangleMesh(ShapeId shape, List<Vector3> points, List<IndexTriple> triangles) implements AppMessage
{
    public AddTriangleMesh {
        Objects.requireNonNull(shape, "shape");
        points = List.copyOf(Objects.requireNonNull(points, "points"));
        triangles = List.copyOf(Objects.requireNonNull(triangles, "triangles"));
    }

    /**
     * Builds a mesh from a flat index array, three indices per triangle.
     *
     * @throws IllegalArgumentException if the index count is not a multiple of three
     */
    public static AddTriangleMesh fromIndices(ShapeId shape, List<Vector3> points, int[] indices) {
        Objects.requireNonNull(indices, "indices");
        if (indices.length % 3 != 0) {
            throw new IllegalArgumentException(
                    "Triangle index count must be a multiple of 3, got " + indices.length);
        }

        List<IndexTriple> triangles = new ArrayList<>(indices.length / 3);
        for (int i = 0; i < indices.length; i += 3) {
            triangles.add(new IndexTriple(indices[i], indices[i + 1], indices[i + 2]));
        }
        return new AddTriangleMesh(shape, points, triangles);
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.ADD_TRIANGLE_MESH;
    }
}

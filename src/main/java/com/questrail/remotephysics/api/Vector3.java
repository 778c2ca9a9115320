package com.questrail.remotephysics.api;

/**
 * Three-component single-precision vector as carried on the wire
 * (positions, velocities, forces, normals).
 */
public record Vector3(float x, float y, float z) {

    public static final Vector3 ZERO = new Vector3(0f, 0f, 0f);

    public static Vector3 of(float x, float y, float z) {
        return new Vector3(x, y, z);
    }
}

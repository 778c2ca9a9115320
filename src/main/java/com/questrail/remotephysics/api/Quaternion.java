package com.questrail.remotephysics.api;

/**
 * Rotation quaternion, wire order x, y, z, w.
 */
public record Quaternion(float x, float y, float z, float w) {

    public static final Quaternion IDENTITY = new Quaternion(0f, 0f, 0f, 1f);
}

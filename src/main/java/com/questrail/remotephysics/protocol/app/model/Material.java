package com.questrail.remotephysics.protocol.app.model;

/**
 * Surface material of an attached shape. Wire order is density, static
 * friction, kinetic friction, restitution.
 */
public record Material(
        float density,
        float staticFriction,
        float kineticFriction,
        float restitution
) {
}

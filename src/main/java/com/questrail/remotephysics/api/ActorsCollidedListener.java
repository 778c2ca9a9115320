package com.questrail.remotephysics.api;

/**
 * Notified when two actors in the remote engine collide.
 *
 * <p>A negative {@code separation} denotes penetration depth.</p>
 */
@FunctionalInterface
public interface ActorsCollidedListener {
    void onActorsCollided(int collidedActorId,
                          int collidingActorId,
                          Vector3 contactPoint,
                          Vector3 contactNormal,
                          float separation);
}

package com.questrail.remotephysics.api;

/**
 * Notified when the remote engine reports the mass of a dynamic actor,
 * usually in response to {@link PhysicsMessenger#getActorMass(int)}.
 */
@FunctionalInterface
public interface ActorMassUpdatedListener {
    void onActorMassUpdated(int actorId, float mass);
}

package com.questrail.remotephysics.api;

@FunctionalInterface
public interface StaticActorUpdatedListener {
    void onStaticActorUpdated(int actorId, Vector3 position, Quaternion orientation);
}

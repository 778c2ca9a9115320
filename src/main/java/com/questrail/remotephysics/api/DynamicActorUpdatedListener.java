package com.questrail.remotephysics.api;

@FunctionalInterface
public interface DynamicActorUpdatedListener {
    void onDynamicActorUpdated(int actorId,
                               Vector3 position,
                               Quaternion orientation,
                               Vector3 linearVelocity,
                               Vector3 angularVelocity);
}

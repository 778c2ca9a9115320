package com.questrail.remotephysics.protocol.app.model;

import java.util.Objects;

/**
 * Scales the effect of world gravity on one actor (1 = normal, 0 = weightless).
 */
public record UpdateActorGravityModifier(ActorId actor, float gravityModifier) implements AppMessage
{
    public UpdateActorGravityModifier {
        Objects.requireNonNull(actor, "actor");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.UPDATE_ACTOR_GRAVITY_MODIFIER;
    }
}

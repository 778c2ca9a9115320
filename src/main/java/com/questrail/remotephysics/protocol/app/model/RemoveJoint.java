package com.questrail.remotephysics.protocol.app.model;

import java.util.Objects;

public record RemoveJoint(JointId joint) implements AppMessage
{
    public RemoveJoint {
        Objects.requireNonNull(joint, "joint");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.REMOVE_JOINT;
    }
}

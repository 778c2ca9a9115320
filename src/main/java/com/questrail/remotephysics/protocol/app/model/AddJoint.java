package com.questrail.remotephysics.protocol.app.model;

import com.questrail.remotephysics.api.Quaternion;
import com.questrail.remotephysics.api.Vector3;

import java.util.Objects;

/**
 * Adds a six-degree-of-freedom joint between two actors.
 *
 * <p>Each actor's joint frame is given by an orientation and a translation
 * relative to that actor. The four limit vectors bound the relative linear
 * and angular motion along each axis; equal lower and upper limits lock
 * the axis.</p>
 */
public record AddJoint(
        JointId joint,
        ActorId actor1,
        Quaternion orientation1,
        Vector3 translation1,
        ActorId actor2,
        Quaternion orientation2,
        Vector3 translation2,
        Vector3 linearLowerLimits,
        Vector3 linearUpperLimits,
        Vector3 angularLowerLimits,
        Vector3 angularUpperLimits
) implements AppMessage
{
    public AddJoint {
        Objects.requireNonNull(joint, "joint");
        Objects.requireNonNull(actor1, "actor1");
        Objects.requireNonNull(orientation1, "orientation1");
        Objects.requireNonNull(translation1, "translation1");
        Objects.requireNonNull(actor2, "actor2");
        Objects.requireNonNull(orientation2, "orientation2");
        Objects.requireNonNull(translation2, "translation2");
        Objects.requireNonNull(linearLowerLimits, "linearLowerLimits");
        Objects.requireNonNull(linearUpperLimits, "linearUpperLimits");
        Objects.requireNonNull(angularLowerLimits, "angularLowerLimits");
        Objects.requireNonNull(angularUpperLimits, "angularUpperLimits");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.ADD_JOINT;
    }
}

package com.questrail.remotephysics.protocol.app.model;

/**
 * Canonical semantic representation of an APP message body.
 *
 * <h2>Purpose</h2>
 * <p>
 * An {@code AppMessage} is a fully decoded message with all wire concerns
 * (byte order, header fields, fixed-width string padding, element counts)
 * already resolved. Messenger logic reasons only about these types; the
 * header travels separately in an {@link AppEnvelope}.
 * </p>
 *
 * <p>
 * Identifiers inside a message ({@link ActorId}, {@link ShapeId},
 * {@link JointId}) already carry the simulation ID.
 * </p>
 */
public sealed interface AppMessage
        permits EngineError, Logon, LogonReady, Logoff, AdvanceTime, TimeAdvanced,
                SetWorld, CreateStaticActor, CreateDynamicActor, SetStaticActor, SetDynamicActor,
                UpdateActorPosition, UpdateActorOrientation, UpdateActorGravityModifier,
                UpdateActorLinearVelocity, UpdateActorAngularVelocity, UpdateActorMass,
                GetActorMass, RemoveActor,
                AddJoint, RemoveJoint,
                AddSphere, AddPlane, AddCapsule, AddBox, AddConvexMesh, AddTriangleMesh, AddHeightField,
                RemoveShape, AttachShape, UpdateShapeMaterial, DetachShape,
                ActorsCollided, ApplyForce, ApplyTorque {

    /**
     * @return the catalog entry this message is encoded as
     */
    AppMessageType type();
}

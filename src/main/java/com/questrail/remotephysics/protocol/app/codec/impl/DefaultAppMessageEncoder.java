package com.questrail.remotephysics.protocol.app.codec.impl;

import com.questrail.remotephysics.api.Vector3;
import com.questrail.remotephysics.protocol.app.codec.AppMessageEncoder;
import com.questrail.remotephysics.protocol.app.model.*;

import java.util.Objects;

/**
 * DefaultAppMessageEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link AppMessageEncoder}.
 *
 * <h2>Length invariant</h2>
 * The header {@code length} field is computed from the message on every call:
 * the fixed body size from the catalog for fixed-layout types, and the element
 * counts for the convex mesh, triangle mesh and height field. The buffer is
 * allocated at exactly that size and the encoder verifies that the body filled
 * it, so the declared length and the bytes on the wire cannot disagree.
 *
 * <h2>Reserved fields</h2>
 * Both reserved header words are written as zero.
 *
 * <p>The encoder is stateless and thread-safe.</p>
 */
public final class DefaultAppMessageEncoder implements AppMessageEncoder
{
    private static final int VECTOR_SIZE = 12;
    private static final int TRIANGLE_SIZE = 12;
    private static final int FLOAT_SIZE = 4;

    @Override
    public byte[] encode(AppMessage message, int messageIndex, float timestamp)
    {
        Objects.requireNonNull(message, "message");

        final int length = encodedLength(message);
        final AppWireWriter w = new AppWireWriter(length);

        // Header
        w.u16(AppHeader.PROTOCOL_VERSION)
         .u16(message.type().code())
         .u32(messageIndex)
         .u32(length)
         .f32(timestamp)
         .u32(0)
         .u32(0);

        writeBody(message, w);

        if (w.position() != length) {
            throw new IllegalStateException(
                    message.type() + " body wrote " + w.position() + " bytes, declared " + length);
        }
        return w.array();
    }

    @Override
    public int encodedLength(AppMessage message)
    {
        return AppHeader.SIZE + bodySize(message);
    }

    private static int bodySize(AppMessage message)
    {
        final AppMessageType type = message.type();

        if (message instanceof EngineError) {
            return type.minimumBodySize() + AppMessageType.ERROR_REASON_LENGTH;
        }
        else if (message instanceof AddConvexMesh m) {
            return type.minimumBodySize() + VECTOR_SIZE * m.points().size();
        }
        else if (message instanceof AddTriangleMesh m) {
            return type.minimumBodySize()
                    + VECTOR_SIZE * m.points().size()
                    + TRIANGLE_SIZE * m.triangles().size();
        }
        else if (message instanceof AddHeightField m) {
            return type.minimumBodySize() + FLOAT_SIZE * m.postCount();
        }
        return type.minimumBodySize();
    }

    private static void writeBody(AppMessage message, AppWireWriter w)
    {
        // ==================================================================
        // Simulation control
        // ==================================================================

        if (message instanceof EngineError m) {
            w.u32(m.referencedIndex()).fixedString(AppMessageType.ERROR_REASON_LENGTH, m.reason());
        }
        else if (message instanceof Logon m) {
            w.u32(m.simulationId()).fixedString(AppMessageType.LOGON_NAME_LENGTH, m.simulationName());
        }
        else if (message instanceof LogonReady m) {
            w.u32(m.simulationId());
        }
        else if (message instanceof Logoff m) {
            w.u32(m.simulationId());
        }
        else if (message instanceof AdvanceTime m) {
            w.u32(m.simulationId()).f32(m.time());
        }
        else if (message instanceof TimeAdvanced m) {
            w.u32(m.simulationId());
        }

        // ==================================================================
        // Actors
        // ==================================================================

        else if (message instanceof SetWorld m) {
            w.actor(m.world())
             .vector(m.gravity())
             .f32(m.staticFriction())
             .f32(m.kineticFriction())
             .f32(m.restitution())
             .f32(m.collisionMargin())
             .f32(m.groundPlaneHeight())
             .vector(m.groundPlaneNormal());
        }
        else if (message instanceof CreateStaticActor m) {
            w.actor(m.actor()).vector(m.position()).quaternion(m.orientation()).u32(m.flags());
        }
        else if (message instanceof CreateDynamicActor m) {
            w.actor(m.actor())
             .vector(m.position())
             .quaternion(m.orientation())
             .f32(m.gravityModifier())
             .vector(m.linearVelocity())
             .vector(m.angularVelocity())
             .u32(m.flags());
        }
        else if (message instanceof SetStaticActor m) {
            w.actor(m.actor()).vector(m.position()).quaternion(m.orientation());
        }
        else if (message instanceof SetDynamicActor m) {
            w.actor(m.actor())
             .vector(m.position())
             .quaternion(m.orientation())
             .f32(m.gravityModifier())
             .vector(m.linearVelocity())
             .vector(m.angularVelocity());
        }
        else if (message instanceof UpdateActorPosition m) {
            w.actor(m.actor()).vector(m.position());
        }
        else if (message instanceof UpdateActorOrientation m) {
            w.actor(m.actor()).quaternion(m.orientation());
        }
        else if (message instanceof UpdateActorGravityModifier m) {
            w.actor(m.actor()).f32(m.gravityModifier());
        }
        else if (message instanceof UpdateActorLinearVelocity m) {
            w.actor(m.actor()).vector(m.velocity());
        }
        else if (message instanceof UpdateActorAngularVelocity m) {
            w.actor(m.actor()).vector(m.velocity());
        }
        else if (message instanceof UpdateActorMass m) {
            w.actor(m.actor()).f32(m.mass());
        }
        else if (message instanceof GetActorMass m) {
            w.actor(m.actor());
        }
        else if (message instanceof RemoveActor m) {
            w.actor(m.actor());
        }

        // ==================================================================
        // Joints
        // ==================================================================

        else if (message instanceof AddJoint m) {
            w.joint(m.joint())
             .actor(m.actor1())
             .quaternion(m.orientation1())
             .vector(m.translation1())
             .actor(m.actor2())
             .quaternion(m.orientation2())
             .vector(m.translation2())
             .vector(m.linearLowerLimits())
             .vector(m.linearUpperLimits())
             .vector(m.angularLowerLimits())
             .vector(m.angularUpperLimits());
        }
        else if (message instanceof RemoveJoint m) {
            w.joint(m.joint());
        }

        // ==================================================================
        // Shapes
        // ==================================================================

        else if (message instanceof AddSphere m) {
            w.shape(m.shape()).vector(m.origin()).f32(m.radius());
        }
        else if (message instanceof AddPlane m) {
            w.shape(m.shape()).vector(m.normal()).f32(m.constant());
        }
        else if (message instanceof AddCapsule m) {
            w.shape(m.shape()).f32(m.radius()).f32(m.height());
        }
        else if (message instanceof AddBox m) {
            w.shape(m.shape()).f32(m.length()).f32(m.width()).f32(m.height());
        }
        else if (message instanceof AddConvexMesh m) {
            w.shape(m.shape()).u32(m.points().size());
            for (Vector3 p : m.points()) {
                w.vector(p);
            }
        }
        else if (message instanceof AddTriangleMesh m) {
            w.shape(m.shape()).u32(m.points().size()).u32(m.triangles().size());
            for (Vector3 p : m.points()) {
                w.vector(p);
            }
            for (IndexTriple t : m.triangles()) {
                w.triangle(t);
            }
        }
        else if (message instanceof AddHeightField m) {
            w.shape(m.shape())
             .u32(m.rows())
             .u32(m.columns())
             .f32(m.rowSpacing())
             .f32(m.columnSpacing());
            for (int r = 0; r < m.rows(); r++) {
                for (int c = 0; c < m.columns(); c++) {
                    w.f32(m.post(r, c));
                }
            }
        }
        else if (message instanceof RemoveShape m) {
            w.shape(m.shape());
        }
        else if (message instanceof AttachShape m) {
            w.actor(m.actor())
             .shape(m.shape())
             .material(m.material())
             .quaternion(m.orientation())
             .vector(m.translation());
        }
        else if (message instanceof UpdateShapeMaterial m) {
            w.actor(m.actor()).shape(m.shape()).material(m.material());
        }
        else if (message instanceof DetachShape m) {
            w.actor(m.actor()).shape(m.shape());
        }

        // ==================================================================
        // Dynamics and collision
        // ==================================================================

        else if (message instanceof ActorsCollided m) {
            w.actor(m.collidingActor())
             .actor(m.collidedActor())
             .vector(m.contactPoint())
             .vector(m.contactNormal())
             .f32(m.separation());
        }
        else if (message instanceof ApplyForce m) {
            w.actor(m.actor()).vector(m.force());
        }
        else if (message instanceof ApplyTorque m) {
            w.actor(m.actor()).vector(m.torque());
        }
        else {
            throw new IllegalArgumentException("Unsupported APP message type: " + message.getClass());
        }
    }
}

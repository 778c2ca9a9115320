package com.questrail.remotephysics.protocol.app.codec.impl;

import com.questrail.remotephysics.api.Vector3;
import com.questrail.remotephysics.protocol.app.codec.AppMessageDecoder;
import com.questrail.remotephysics.protocol.app.internal.decode.AppDecodeException;
import com.questrail.remotephysics.protocol.app.model.*;
import com.questrail.remotephysics.protocol.app.observability.AppDropEvent;
import com.questrail.remotephysics.protocol.app.observability.AppDropReason;
import com.questrail.remotephysics.protocol.app.observability.AppObservabilitySink;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * DefaultAppMessageDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link AppMessageDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Header presence: at least 24 bytes</li>
 *   <li>Version check against {@link AppHeader#PROTOCOL_VERSION}</li>
 *   <li>Type code lookup in {@link AppMessageType}</li>
 *   <li>Minimum size check for the type, before any body field is read</li>
 *   <li>For variable-layout bodies, a size check against the element counts
 *       before any element is read or allocated</li>
 *   <li>Body parse into the semantic {@link AppMessage}</li>
 * </ol>
 *
 * <p>Any failure drops the packet: the drop is reported to the observability
 * sink and {@link Optional#empty()} is returned. Nothing is thrown, so one bad
 * packet never disturbs the packets after it.</p>
 */
public final class DefaultAppMessageDecoder implements AppMessageDecoder
{
    private final AppObservabilitySink sink;

    public DefaultAppMessageDecoder(AppObservabilitySink sink)
    {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public Optional<AppEnvelope> decode(byte[] packet)
    {
        Objects.requireNonNull(packet, "packet");

        int typeCode = -1;
        try {
            // 1) Header
            if (packet.length < AppHeader.SIZE) {
                throw new AppDecodeException(AppDropReason.INSUFFICIENT_DATA,
                        "Packet shorter than header: " + packet.length + " bytes");
            }

            // 2) Version
            final int version = AppWireFormat.getU16(packet, 0);
            typeCode = AppWireFormat.getU16(packet, 2);
            if (version != AppHeader.PROTOCOL_VERSION) {
                throw new AppDecodeException(AppDropReason.VERSION_MISMATCH,
                        "Protocol version " + version + ", expected " + AppHeader.PROTOCOL_VERSION);
            }

            final int messageIndex = AppWireFormat.getU32(packet, 4);
            final long declaredLength = Integer.toUnsignedLong(AppWireFormat.getU32(packet, AppHeader.LENGTH_OFFSET));
            final float timestamp = AppWireFormat.getF32(packet, 12);

            // 3) Type
            final int code = typeCode;
            final AppMessageType type = AppMessageType.fromCode(code)
                    .orElseThrow(() -> new AppDecodeException(AppDropReason.UNKNOWN_TYPE,
                            "Unknown APP message type " + code));

            // 4) Minimum size
            if (packet.length < type.minimumMessageSize()) {
                throw new AppDecodeException(AppDropReason.INSUFFICIENT_DATA,
                        type + " needs " + type.minimumMessageSize() + " bytes, got " + packet.length);
            }
            if (declaredLength < type.minimumMessageSize()) {
                throw new AppDecodeException(AppDropReason.MALFORMED,
                        type + " declares length " + declaredLength + " below its minimum " + type.minimumMessageSize());
            }
            if (declaredLength > packet.length) {
                throw new AppDecodeException(AppDropReason.INSUFFICIENT_DATA,
                        type + " declares length " + declaredLength + ", got " + packet.length);
            }

            // 5) + 6) Body; bytes past the declared length are not part of this message
            final AppWireReader r = new AppWireReader(packet, AppHeader.SIZE, (int) declaredLength);
            final AppMessage message = decodeBody(type, r);

            final AppHeader header = new AppHeader(version, code, messageIndex, (int) declaredLength, timestamp);
            return Optional.of(new AppEnvelope(header, message));
        }
        catch (AppDecodeException e) {
            drop(e.reason(), typeCode, packet.length, e.getMessage());
            return Optional.empty();
        }
        catch (IllegalArgumentException e) {
            // Counts that pass the size checks but not the model invariants.
            drop(AppDropReason.MALFORMED, typeCode, packet.length, e.getMessage());
            return Optional.empty();
        }
    }

    private void drop(AppDropReason reason, int typeCode, int length, String detail)
    {
        sink.onMessageDropped(new AppDropEvent(Instant.now(), reason, typeCode, length, detail));
    }

    private static AppMessage decodeBody(AppMessageType type, AppWireReader r)
    {
        return switch (type) {

            // =============================================================
            // Simulation control
            // =============================================================

            case ERROR -> new EngineError(r.u32(), r.fixedString(AppMessageType.ERROR_REASON_LENGTH));
            case LOGON -> new Logon(r.u32(), r.fixedString(AppMessageType.LOGON_NAME_LENGTH));
            case LOGON_READY -> new LogonReady(r.u32());
            case LOGOFF -> new Logoff(r.u32());
            case ADVANCE_TIME -> new AdvanceTime(r.u32(), r.f32());
            case TIME_ADVANCED -> new TimeAdvanced(r.u32());

            // =============================================================
            // Actors
            // =============================================================

            case SET_WORLD -> new SetWorld(
                    r.actor(), r.vector(), r.f32(), r.f32(), r.f32(), r.f32(), r.f32(), r.vector());
            case CREATE_STATIC_ACTOR -> new CreateStaticActor(r.actor(), r.vector(), r.quaternion(), r.u32());
            case CREATE_DYNAMIC_ACTOR -> new CreateDynamicActor(
                    r.actor(), r.vector(), r.quaternion(), r.f32(), r.vector(), r.vector(), r.u32());
            case SET_STATIC_ACTOR -> new SetStaticActor(r.actor(), r.vector(), r.quaternion());
            case SET_DYNAMIC_ACTOR -> new SetDynamicActor(
                    r.actor(), r.vector(), r.quaternion(), r.f32(), r.vector(), r.vector());
            case UPDATE_ACTOR_POSITION -> new UpdateActorPosition(r.actor(), r.vector());
            case UPDATE_ACTOR_ORIENTATION -> new UpdateActorOrientation(r.actor(), r.quaternion());
            case UPDATE_ACTOR_GRAVITY_MODIFIER -> new UpdateActorGravityModifier(r.actor(), r.f32());
            case UPDATE_ACTOR_LINEAR_VELOCITY -> new UpdateActorLinearVelocity(r.actor(), r.vector());
            case UPDATE_ACTOR_ANGULAR_VELOCITY -> new UpdateActorAngularVelocity(r.actor(), r.vector());
            case UPDATE_ACTOR_MASS -> new UpdateActorMass(r.actor(), r.f32());
            case GET_ACTOR_MASS -> new GetActorMass(r.actor());
            case REMOVE_ACTOR -> new RemoveActor(r.actor());

            // =============================================================
            // Joints
            // =============================================================

            case ADD_JOINT -> new AddJoint(
                    r.joint(),
                    r.actor(), r.quaternion(), r.vector(),
                    r.actor(), r.quaternion(), r.vector(),
                    r.vector(), r.vector(), r.vector(), r.vector());
            case REMOVE_JOINT -> new RemoveJoint(r.joint());

            // =============================================================
            // Shapes
            // =============================================================

            case ADD_SPHERE -> new AddSphere(r.shape(), r.vector(), r.f32());
            case ADD_PLANE -> new AddPlane(r.shape(), r.vector(), r.f32());
            case ADD_CAPSULE -> new AddCapsule(r.shape(), r.f32(), r.f32());
            case ADD_BOX -> new AddBox(r.shape(), r.f32(), r.f32(), r.f32());
            case ADD_CONVEX_MESH -> decodeConvexMesh(r);
            case ADD_TRIANGLE_MESH -> decodeTriangleMesh(r);
            case ADD_HEIGHT_FIELD -> decodeHeightField(r);
            case REMOVE_SHAPE -> new RemoveShape(r.shape());
            case ATTACH_SHAPE -> new AttachShape(r.actor(), r.shape(), r.material(), r.quaternion(), r.vector());
            case UPDATE_SHAPE_MATERIAL -> new UpdateShapeMaterial(r.actor(), r.shape(), r.material());
            case DETACH_SHAPE -> new DetachShape(r.actor(), r.shape());

            // =============================================================
            // Dynamics and collision
            // =============================================================

            case ACTORS_COLLIDED -> new ActorsCollided(r.actor(), r.actor(), r.vector(), r.vector(), r.f32());
            case APPLY_FORCE -> new ApplyForce(r.actor(), r.vector());
            case APPLY_TORQUE -> new ApplyTorque(r.actor(), r.vector());
        };
    }

    // ========================================================================
    // Variable-layout bodies
    // ========================================================================

    private static AddConvexMesh decodeConvexMesh(AppWireReader r)
    {
        final ShapeId shape = r.shape();
        final long pointCount = Integer.toUnsignedLong(r.u32());

        requireElements(r, pointCount * 12L, "convex mesh points");

        List<Vector3> points = new ArrayList<>((int) pointCount);
        for (long i = 0; i < pointCount; i++) {
            points.add(r.vector());
        }
        return new AddConvexMesh(shape, points);
    }

    private static AddTriangleMesh decodeTriangleMesh(AppWireReader r)
    {
        final ShapeId shape = r.shape();
        final long pointCount = Integer.toUnsignedLong(r.u32());
        final long triangleCount = Integer.toUnsignedLong(r.u32());

        requireElements(r, pointCount * 12L + triangleCount * 12L, "triangle mesh points and triangles");

        List<Vector3> points = new ArrayList<>((int) pointCount);
        for (long i = 0; i < pointCount; i++) {
            points.add(r.vector());
        }
        List<IndexTriple> triangles = new ArrayList<>((int) triangleCount);
        for (long i = 0; i < triangleCount; i++) {
            triangles.add(r.triangle());
        }
        return new AddTriangleMesh(shape, points, triangles);
    }

    private static AddHeightField decodeHeightField(AppWireReader r)
    {
        final ShapeId shape = r.shape();
        final long rows = Integer.toUnsignedLong(r.u32());
        final long columns = Integer.toUnsignedLong(r.u32());
        final float rowSpacing = r.f32();
        final float columnSpacing = r.f32();

        final long available = r.remaining() / 4L;
        if (columns != 0 && rows > available / columns) {
            throw new AppDecodeException(AppDropReason.INSUFFICIENT_DATA,
                    "Height field of " + rows + "x" + columns + " posts exceeds " + r.remaining() + " remaining bytes");
        }
        final long postCount = rows * columns;

        float[] posts = new float[(int) postCount];
        for (int i = 0; i < posts.length; i++) {
            posts[i] = r.f32();
        }
        return new AddHeightField(shape, (int) rows, (int) columns, rowSpacing, columnSpacing, posts);
    }

    private static void requireElements(AppWireReader r, long bytes, String what)
    {
        if (bytes > r.remaining()) {
            throw new AppDecodeException(AppDropReason.INSUFFICIENT_DATA,
                    "Counts require " + bytes + " bytes of " + what + ", " + r.remaining() + " remaining");
        }
    }
}

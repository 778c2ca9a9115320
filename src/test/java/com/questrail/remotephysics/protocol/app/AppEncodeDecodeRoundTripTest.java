package com.questrail.remotephysics.protocol.app;

import com.questrail.remotephysics.api.Quaternion;
import com.questrail.remotephysics.api.Vector3;
import com.questrail.remotephysics.protocol.app.codec.impl.DefaultAppMessageDecoder;
import com.questrail.remotephysics.protocol.app.codec.impl.DefaultAppMessageEncoder;
import com.questrail.remotephysics.protocol.app.model.*;
import com.questrail.remotephysics.protocol.app.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Semantic round-trip tests.
 *
 * These tests prove:
 *   AppMessage -> bytes -> AppMessage
 * preserves every field, and that the catalogue below covers every type code.
 */
final class AppEncodeDecodeRoundTripTest
{
    private static final int SIM = 7;

    private static final Vector3 P = new Vector3(1.5f, -2.25f, 3.0f);
    private static final Vector3 Q = new Vector3(-0.5f, 0.0f, 9.81f);
    private static final Quaternion ROT = new Quaternion(0.0f, 0.7071068f, 0.0f, 0.7071068f);

    private static final ActorId A1 = new ActorId(SIM, 101);
    private static final ActorId A2 = new ActorId(SIM, 102);
    private static final ShapeId S1 = new ShapeId(SIM, 201);

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final DefaultAppMessageEncoder encoder = new DefaultAppMessageEncoder();
    private final DefaultAppMessageDecoder decoder = new DefaultAppMessageDecoder(sink);

    static List<AppMessage> catalogue()
    {
        return List.of(
                new EngineError(42, "actor 101 does not exist"),
                new Logon(SIM, "TestSim"),
                new LogonReady(SIM),
                new Logoff(SIM),
                new AdvanceTime(SIM, 0.0166f),
                new TimeAdvanced(SIM),
                new SetWorld(new ActorId(SIM, 1), new Vector3(0f, 0f, -9.8f), 0.5f, 0.4f, 0.1f, 0.04f, 21.0f,
                        new Vector3(0f, 0f, 1f)),
                CreateStaticActor.of(A1, P, ROT, true),
                new CreateDynamicActor(A2, P, ROT, 1.0f, Q, P, 0),
                new SetStaticActor(A1, P, ROT),
                new SetDynamicActor(A2, P, ROT, 0.5f, Q, P),
                new UpdateActorPosition(A1, Q),
                new UpdateActorOrientation(A1, Quaternion.IDENTITY),
                new UpdateActorGravityModifier(A1, 0.25f),
                new UpdateActorLinearVelocity(A1, P),
                new UpdateActorAngularVelocity(A1, Q),
                new UpdateActorMass(A1, 80.0f),
                new GetActorMass(A1),
                new RemoveActor(A2),
                new AddJoint(new JointId(SIM, 301), A1, ROT, P, A2, Quaternion.IDENTITY, Q,
                        new Vector3(-1f, -1f, -1f), new Vector3(1f, 1f, 1f),
                        new Vector3(-0.5f, -0.5f, -0.5f), new Vector3(0.5f, 0.5f, 0.5f)),
                new RemoveJoint(new JointId(SIM, 301)),
                new AddSphere(S1, P, 0.5f),
                new AddPlane(S1, new Vector3(0f, 0f, 1f), -2.0f),
                new AddCapsule(S1, 0.3f, 1.8f),
                new AddBox(S1, 2.0f, 1.0f, 0.5f),
                new AddConvexMesh(S1, List.of(P, Q, Vector3.ZERO)),
                AddTriangleMesh.fromIndices(S1, List.of(P, Q, Vector3.ZERO, Vector3.of(1f, 1f, 1f)),
                        new int[] { 0, 1, 2, 1, 2, 3 }),
                new AddHeightField(S1, 2, 3, 1.0f, 2.0f, new float[] { 0f, 1f, 2f, 3f, 4f, 5f }),
                new RemoveShape(S1),
                new AttachShape(A1, S1, new Material(1000f, 0.6f, 0.5f, 0.2f), ROT, P),
                new UpdateShapeMaterial(A1, S1, new Material(500f, 0.3f, 0.2f, 0.9f)),
                new DetachShape(A1, S1),
                new ActorsCollided(A2, A1, P, new Vector3(0f, 0f, 1f), -0.01f),
                new ApplyForce(A2, new Vector3(0f, 0f, 100f)),
                new ApplyTorque(A2, new Vector3(5f, 0f, 0f))
        );
    }

    @Test
    void catalogueCoversEveryMessageType()
    {
        Set<AppMessageType> covered = EnumSet.noneOf(AppMessageType.class);
        for (AppMessage m : catalogue()) {
            covered.add(m.type());
        }
        assertEquals(EnumSet.allOf(AppMessageType.class), covered);
        assertEquals(35, AppMessageType.values().length);
    }

    @Test
    void everyMessageSurvivesEncodeThenDecode()
    {
        int index = 0;
        for (AppMessage original : catalogue()) {
            byte[] bytes = encoder.encode(original, index, 1.25f);
            AppEnvelope decoded = decoder.decode(bytes).orElseThrow(
                    () -> new AssertionError(original.type() + " failed to decode"));

            assertEquals(original, decoded.message(), original.type().name());
            assertEquals(AppHeader.PROTOCOL_VERSION, decoded.header().version());
            assertEquals(original.type().code(), decoded.header().messageType());
            assertEquals(index, decoded.header().messageIndex());
            assertEquals(bytes.length, decoded.header().length());
            assertEquals(1.25f, decoded.header().timestamp());
            index++;
        }
        assertTrue(sink.getDrops().isEmpty());
    }

    @Test
    void unsignedIdentifiersRoundTrip()
    {
        AppMessage original = new RemoveActor(new ActorId(0xFFFF_FFFF, 0x8000_0000));

        AppEnvelope decoded = decoder.decode(encoder.encode(original, -1, 0f)).orElseThrow();

        assertEquals(original, decoded.message());
        assertEquals(-1, decoded.header().messageIndex());
        assertEquals("4294967295", Integer.toUnsignedString(decoded.header().messageIndex()));
    }

    @Test
    void emptyMeshesRoundTrip()
    {
        AppMessage convex = new AddConvexMesh(S1, List.of());
        AppMessage mesh = new AddTriangleMesh(S1, List.of(), List.of());
        AppMessage field = new AddHeightField(S1, 0, 0, 1f, 1f, new float[0]);

        assertEquals(convex, decoder.decode(encoder.encode(convex, 0, 0f)).orElseThrow().message());
        assertEquals(mesh, decoder.decode(encoder.encode(mesh, 0, 0f)).orElseThrow().message());
        assertEquals(field, decoder.decode(encoder.encode(field, 0, 0f)).orElseThrow().message());
    }
}

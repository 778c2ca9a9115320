package com.questrail.remotephysics.protocol.app;

import com.questrail.remotephysics.api.Quaternion;
import com.questrail.remotephysics.api.Subscription;
import com.questrail.remotephysics.api.Vector3;
import com.questrail.remotephysics.protocol.app.codec.impl.DefaultAppMessageDecoder;
import com.questrail.remotephysics.protocol.app.codec.impl.DefaultAppMessageEncoder;
import com.questrail.remotephysics.protocol.app.config.RemotePhysicsConfig;
import com.questrail.remotephysics.protocol.app.model.*;
import com.questrail.remotephysics.protocol.app.observability.AppDropReason;
import com.questrail.remotephysics.protocol.app.observability.NullObservabilitySink;
import com.questrail.remotephysics.protocol.app.observability.RecordingObservabilitySink;
import com.questrail.remotephysics.protocol.app.time.ManualMonotonicClock;
import com.questrail.remotephysics.protocol.app.transport.FakePacketChannel;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AppMessengerTest
 * -----------------------------------------------------------------------------
 * Drives {@link AppMessenger} against in-memory channels.
 *
 * <p>Outbound assertions decode what the fake channels captured; inbound
 * assertions inject encoded packets and call {@link AppMessenger#update()}.</p>
 */
final class AppMessengerTest
{
    private static final long SECOND = 1_000_000_000L;

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final ManualMonotonicClock clock = new ManualMonotonicClock(5 * SECOND);
    private final DefaultAppMessageEncoder encoder = new DefaultAppMessageEncoder();
    private final DefaultAppMessageDecoder decoder = new DefaultAppMessageDecoder(NullObservabilitySink.INSTANCE);

    private final FakePacketChannel reliable = new FakePacketChannel();
    private final FakePacketChannel bestEffort = new FakePacketChannel();

    private final AppMessenger messenger =
            new AppMessenger(encoder, new DefaultAppMessageDecoder(sink), sink, clock);

    private static RemotePhysicsConfig config()
    {
        return RemotePhysicsConfig.builder()
                .withSimulationId(7)
                .withMessengerInternalThread(false)
                .withPacketChannelInternalThread(false)
                .build();
    }

    private void initialize()
    {
        messenger.initialize(config(), reliable, bestEffort);
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Test
    void commandsBeforeInitializeAreIgnored()
    {
        messenger.logon(1, "Early");
        messenger.createStaticActor(1, Vector3.ZERO, Quaternion.IDENTITY, false);
        messenger.addTriangleMesh(1, List.of(), new int[] { 0 });
        messenger.update();

        assertFalse(messenger.isInitialized());

        initialize();

        assertTrue(reliable.sent().isEmpty());
        assertTrue(bestEffort.sent().isEmpty());
        assertEquals(0, messenger.nextMessageIndex());
        assertEquals(7, messenger.simulationId());
    }

    @Test
    void initializeSuppliesFramingParametersToBothChannels()
    {
        initialize();

        assertEquals(AppHeader.SIZE, reliable.headerSize());
        assertEquals(AppHeader.LENGTH_OFFSET, reliable.lengthOffset());
        assertEquals(AppHeader.SIZE, bestEffort.headerSize());
        assertEquals(AppHeader.LENGTH_OFFSET, bestEffort.lengthOffset());
    }

    @Test
    void closeReturnsMessengerToNoOpState()
    {
        initialize();
        messenger.close();

        messenger.advanceTime(0.1f);

        assertFalse(messenger.isInitialized());
        assertTrue(reliable.sent().isEmpty());
        assertFalse(reliable.isClosed());
    }

    @Test
    void reinitializeRestartsMessageIndex()
    {
        initialize();
        messenger.advanceTime(0.1f);
        messenger.advanceTime(0.1f);
        assertEquals(2, messenger.nextMessageIndex());

        initialize();

        assertEquals(0, messenger.nextMessageIndex());
    }

    // ---------------------------------------------------------------------
    // Outbound
    // ---------------------------------------------------------------------

    @Test
    void logonIsSentOnBothChannelsAndAdoptsSimulationId()
    {
        initialize();

        messenger.logon(42, "TestSim");

        assertEquals(1, reliable.sent().size());
        assertEquals(1, bestEffort.sent().size());
        assertArrayEquals(reliable.sent().get(0), bestEffort.sent().get(0));
        assertEquals(76, reliable.sent().get(0).length);
        assertEquals(new Logon(42, "TestSim"), sentMessage(0));
        assertEquals(42, messenger.simulationId());
        assertEquals(1, messenger.nextMessageIndex());
    }

    @Test
    void everythingButLogonUsesReliableChannelOnly()
    {
        initialize();

        messenger.logoff(7);
        messenger.applyForce(1, Vector3.of(0f, 0f, 10f));
        messenger.removeShape(3);

        assertEquals(3, reliable.sent().size());
        assertTrue(bestEffort.sent().isEmpty());
    }

    @Test
    void messageIndexIncreasesPerAcceptedMessage()
    {
        initialize();

        messenger.advanceTime(0.1f);
        messenger.getActorMass(1);
        messenger.removeActor(1);

        for (int i = 0; i < 3; i++) {
            assertEquals(i, sentEnvelope(i).header().messageIndex());
        }
    }

    @Test
    void refusedMessageDoesNotConsumeIndex()
    {
        initialize();
        reliable.setAccepting(false);

        messenger.removeActor(1);
        assertEquals(0, messenger.nextMessageIndex());

        reliable.setAccepting(true);
        messenger.removeActor(2);

        assertEquals(0, sentEnvelope(0).header().messageIndex());
        assertEquals(new RemoveActor(new ActorId(7, 2)), sentMessage(0));
    }

    @Test
    void logonAcceptedByEitherChannelConsumesIndex()
    {
        initialize();
        reliable.setAccepting(false);

        messenger.logon(7, "Sim");

        assertEquals(1, bestEffort.sent().size());
        assertEquals(1, messenger.nextMessageIndex());
    }

    @Test
    void timestampIsSecondsSinceInitialize()
    {
        initialize();
        clock.advanceMillis(1500);

        messenger.advanceTime(0.02f);

        assertEquals(1.5f, sentEnvelope(0).header().timestamp(), 1e-6f);
    }

    @Test
    void commandsAreScopedToCurrentSimulation()
    {
        initialize();
        messenger.logon(42, "Sim");
        reliable.clear();

        messenger.createStaticActor(5, Vector3.of(1f, 2f, 3f), Quaternion.IDENTITY, true);
        messenger.createDynamicActor(6, Vector3.ZERO, Quaternion.IDENTITY, 0.5f, Vector3.ZERO, Vector3.ZERO, false);
        messenger.advanceTime(0.25f);

        assertEquals(new CreateStaticActor(new ActorId(42, 5), Vector3.of(1f, 2f, 3f), Quaternion.IDENTITY,
                CreateStaticActor.FLAG_REPORT_COLLISIONS), sentMessage(0));
        assertEquals(new CreateDynamicActor(new ActorId(42, 6), Vector3.ZERO, Quaternion.IDENTITY, 0.5f,
                Vector3.ZERO, Vector3.ZERO, 0), sentMessage(1));
        assertEquals(new AdvanceTime(42, 0.25f), sentMessage(2));
    }

    @Test
    void initializeWorldNamesGroundPlaneActor()
    {
        initialize();

        messenger.initializeWorld(Vector3.of(0f, 0f, -9.8f), 0.5f, 0.4f, 0.1f, 0.04f, 99, 21f, Vector3.of(0f, 0f, 1f));

        assertEquals(new SetWorld(new ActorId(7, 99), Vector3.of(0f, 0f, -9.8f), 0.5f, 0.4f, 0.1f, 0.04f, 21f,
                Vector3.of(0f, 0f, 1f)), sentMessage(0));
    }

    @Test
    void shapeCommandsMapParametersInOrder()
    {
        initialize();
        Quaternion rot = new Quaternion(0f, 0f, 1f, 0f);
        Vector3 offset = Vector3.of(0f, 1f, 0f);

        messenger.attachShape(1, 2, 1000f, 0.6f, 0.5f, 0.2f, rot, offset);
        messenger.updateShapeMaterial(1, 2, 0.6f, 0.5f, 0.2f, 1000f);
        messenger.detachShape(1, 2);
        messenger.addTriangleMesh(3, List.of(Vector3.ZERO, offset, Vector3.of(1f, 0f, 0f)), new int[] { 0, 1, 2 });
        messenger.addHeightField(4, 1, 2, 1f, 1f, new float[] { 3f, 4f });

        Material material = new Material(1000f, 0.6f, 0.5f, 0.2f);
        assertEquals(new AttachShape(new ActorId(7, 1), new ShapeId(7, 2), material, rot, offset), sentMessage(0));
        assertEquals(new UpdateShapeMaterial(new ActorId(7, 1), new ShapeId(7, 2), material), sentMessage(1));
        assertEquals(new DetachShape(new ActorId(7, 1), new ShapeId(7, 2)), sentMessage(2));
        assertEquals(List.of(new IndexTriple(0, 1, 2)), ((AddTriangleMesh) sentMessage(3)).triangles());
        assertEquals(4f, ((AddHeightField) sentMessage(4)).post(0, 1));
    }

    @Test
    void jointCommandMapsBothActors()
    {
        initialize();
        Vector3 t1 = Vector3.of(1f, 0f, 0f);
        Vector3 t2 = Vector3.of(-1f, 0f, 0f);
        Quaternion o2 = new Quaternion(1f, 0f, 0f, 0f);
        Vector3 lo = Vector3.of(-1f, -1f, -1f);
        Vector3 hi = Vector3.of(1f, 1f, 1f);

        messenger.addJoint(9, 1, t1, Quaternion.IDENTITY, 2, t2, o2, lo, hi, Vector3.ZERO, Vector3.ZERO);
        messenger.removeJoint(9);

        assertEquals(new AddJoint(new JointId(7, 9),
                new ActorId(7, 1), Quaternion.IDENTITY, t1,
                new ActorId(7, 2), o2, t2,
                lo, hi, Vector3.ZERO, Vector3.ZERO), sentMessage(0));
        assertEquals(new RemoveJoint(new JointId(7, 9)), sentMessage(1));
    }

    // ---------------------------------------------------------------------
    // Inbound
    // ---------------------------------------------------------------------

    @Test
    void inboundMessagesReachTheirListeners()
    {
        initialize();
        List<String> seen = new ArrayList<>();

        messenger.onLogonReady(sim -> seen.add("ready " + sim));
        messenger.onStaticActorUpdated((id, pos, rot) -> seen.add("static " + id + " " + pos.x()));
        messenger.onDynamicActorUpdated((id, pos, rot, lin, ang) -> seen.add("dynamic " + id + " " + lin.z()));
        messenger.onActorMassUpdated((id, mass) -> seen.add("mass " + id + " " + mass));
        messenger.onRemoteEngineError((index, reason) -> seen.add("error " + index + " " + reason));

        inject(reliable, new LogonReady(7));
        inject(reliable, new SetStaticActor(new ActorId(7, 1), Vector3.of(2f, 0f, 0f), Quaternion.IDENTITY));
        inject(reliable, new SetDynamicActor(new ActorId(7, 2), Vector3.ZERO, Quaternion.IDENTITY, 1f,
                Vector3.of(0f, 0f, -3f), Vector3.ZERO));
        inject(reliable, new UpdateActorMass(new ActorId(7, 3), 80f));
        inject(reliable, new EngineError(4, "no such actor"));

        messenger.update();

        assertEquals(List.of(
                "ready 7",
                "static 1 2.0",
                "dynamic 2 -3.0",
                "mass 3 80.0",
                "error 4 no such actor"), seen);
    }

    @Test
    void collisionListenerReceivesCollidedActorFirst()
    {
        initialize();
        List<int[]> pairs = new ArrayList<>();
        messenger.onActorsCollided((collided, colliding, point, normal, separation) ->
                pairs.add(new int[] { collided, colliding }));

        inject(reliable, new ActorsCollided(new ActorId(7, 10), new ActorId(7, 20),
                Vector3.ZERO, Vector3.of(0f, 0f, 1f), -0.01f));
        messenger.update();

        assertEquals(1, pairs.size());
        assertArrayEquals(new int[] { 20, 10 }, pairs.get(0));
    }

    @Test
    void timeAdvancedFiresOnlyForOwnSimulation()
    {
        initialize();
        AtomicInteger ticks = new AtomicInteger();
        messenger.onTimeAdvanced(ticks::incrementAndGet);

        inject(reliable, new TimeAdvanced(8));
        inject(reliable, new TimeAdvanced(7));
        messenger.update();

        assertEquals(1, ticks.get());
    }

    @Test
    void bestEffortChannelIsDrainedAfterReliable()
    {
        initialize();
        List<Integer> order = new ArrayList<>();
        messenger.onActorMassUpdated((id, mass) -> order.add(id));

        inject(bestEffort, new UpdateActorMass(new ActorId(7, 2), 1f));
        inject(reliable, new UpdateActorMass(new ActorId(7, 1), 1f));
        messenger.update();

        assertEquals(List.of(1, 2), order);
    }

    @Test
    void inboundDispatchIsBoundedPerUpdate()
    {
        messenger.initialize(RemotePhysicsConfig.builder()
                .withMessengerInternalThread(false)
                .withMaxIncomingPerUpdate(2)
                .build(), reliable, bestEffort);
        AtomicInteger ready = new AtomicInteger();
        messenger.onLogonReady(sim -> ready.incrementAndGet());
        for (int i = 0; i < 5; i++) {
            inject(reliable, new LogonReady(i));
        }

        messenger.update();
        assertEquals(2, ready.get());
        assertEquals(3, reliable.pendingInbound());

        messenger.update();
        messenger.update();
        assertEquals(5, ready.get());
    }

    @Test
    void malformedInboundIsDroppedAndReported()
    {
        initialize();
        byte[] bad = encoder.encode(new LogonReady(7), 0, 0f);
        bad[1] = 9;
        reliable.inject(bad);

        messenger.update();

        assertEquals(AppDropReason.VERSION_MISMATCH, sink.getDrops().get(0).reason());
    }

    @Test
    void throwingListenerDoesNotStarveOthers()
    {
        initialize();
        AtomicInteger delivered = new AtomicInteger();
        messenger.onLogonReady(sim -> { throw new IllegalStateException("boom"); });
        messenger.onLogonReady(sim -> delivered.incrementAndGet());

        inject(reliable, new LogonReady(7));
        messenger.update();

        assertEquals(1, delivered.get());
        assertEquals(1, sink.getErrors().size());
        assertInstanceOf(IllegalStateException.class, sink.getErrors().get(0).cause());
    }

    @Test
    void cancelledSubscriptionStopsDelivery()
    {
        initialize();
        AtomicInteger ready = new AtomicInteger();
        Subscription subscription = messenger.onLogonReady(sim -> ready.incrementAndGet());

        inject(reliable, new LogonReady(7));
        messenger.update();
        assertTrue(subscription.cancel());
        assertFalse(subscription.cancel());

        inject(reliable, new LogonReady(7));
        messenger.update();

        assertEquals(1, ready.get());
    }

    @Test
    void updateDrivesChannelsWithoutTheirOwnThread()
    {
        bestEffort.setInternalThread(true);
        initialize();

        messenger.update();

        assertEquals(1, reliable.updates());
        assertEquals(0, bestEffort.updates());
    }

    @Test
    void internalThreadDispatchesWithoutExplicitUpdate() throws InterruptedException
    {
        messenger.initialize(RemotePhysicsConfig.builder()
                .withMessengerInternalThread(true)
                .withMessengerPollInterval(Duration.ofMillis(5))
                .withShutdownGrace(Duration.ofMillis(200))
                .build(), reliable, bestEffort);
        try {
            CountDownLatch latch = new CountDownLatch(1);
            messenger.onLogonReady(sim -> latch.countDown());

            inject(reliable, new LogonReady(0));

            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }
        finally {
            messenger.close();
        }
    }

    @Test
    void reinitializeStopsPreviousPollThread() throws InterruptedException
    {
        RemotePhysicsConfig threaded = RemotePhysicsConfig.builder()
                .withMessengerInternalThread(true)
                .withMessengerPollInterval(Duration.ofMillis(5))
                .withShutdownGrace(Duration.ofMillis(200))
                .build();

        messenger.initialize(threaded, reliable, bestEffort);
        messenger.initialize(threaded, reliable, bestEffort);
        assertEquals(1, livePollThreads());

        messenger.close();

        long deadline = System.currentTimeMillis() + 2_000;
        while (livePollThreads() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, livePollThreads());
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static long livePollThreads()
    {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(t -> t.isAlive() && "app-messenger-poll".equals(t.getName()))
                .count();
    }

    private void inject(FakePacketChannel channel, AppMessage message)
    {
        channel.inject(encoder.encode(message, 0, 0f));
    }

    private AppEnvelope sentEnvelope(int i)
    {
        return decoder.decode(reliable.sent().get(i)).orElseThrow();
    }

    private AppMessage sentMessage(int i)
    {
        return sentEnvelope(i).message();
    }
}

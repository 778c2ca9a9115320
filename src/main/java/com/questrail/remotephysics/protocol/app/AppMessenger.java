package com.questrail.remotephysics.protocol.app;

import com.questrail.remotephysics.api.*;
import com.questrail.remotephysics.core.ListenerRegistry;
import com.questrail.remotephysics.protocol.app.codec.AppMessageDecoder;
import com.questrail.remotephysics.protocol.app.codec.AppMessageEncoder;
import com.questrail.remotephysics.protocol.app.codec.impl.DefaultAppMessageDecoder;
import com.questrail.remotephysics.protocol.app.codec.impl.DefaultAppMessageEncoder;
import com.questrail.remotephysics.protocol.app.config.RemotePhysicsConfig;
import com.questrail.remotephysics.protocol.app.internal.exec.PollLoop;
import com.questrail.remotephysics.protocol.app.internal.time.MonotonicClock;
import com.questrail.remotephysics.protocol.app.internal.time.SystemMonotonicClock;
import com.questrail.remotephysics.protocol.app.model.*;
import com.questrail.remotephysics.protocol.app.observability.AppErrorEvent;
import com.questrail.remotephysics.protocol.app.observability.AppObservabilitySink;
import com.questrail.remotephysics.protocol.app.transport.PacketChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * AppMessenger
 * =============================================================================
 * {@link PhysicsMessenger} that speaks APP over one reliable and one
 * best-effort {@link PacketChannel}.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Turns each command into an {@link AppMessage}, encodes it and queues it
 *       on the reliable channel (logon goes on both channels)</li>
 *   <li>Stamps every outbound header with the message index and the seconds
 *       elapsed since {@link #initialize}</li>
 *   <li>Drains, decodes and dispatches inbound packets on {@link #update()}</li>
 * </ul>
 *
 * <h2>Initialization contract</h2>
 * Until {@link #initialize} has run, and again after {@link #close()}, every
 * command is a silent no-op and {@link #update()} does nothing. Listener
 * registration works at any time.
 *
 * <h2>Sequencing</h2>
 * The message index starts at 0 on initialization. It is stamped under a lock
 * and advances only when at least one channel accepted the packet, so indices
 * reported back in engine errors always name a message that was actually
 * queued.
 *
 * <h2>Threading model</h2>
 * Commands may come from any thread. With {@code messengerInternalThread}
 * set, a private {@link PollLoop} calls {@link #update()}; otherwise the owner
 * must. Listeners run on whichever thread calls {@link #update()}, with no
 * messenger lock held.
 */
public final class AppMessenger implements PhysicsMessenger
{
    private static final Logger log = LoggerFactory.getLogger(AppMessenger.class);

    private final AppMessageEncoder encoder;
    private final AppMessageDecoder decoder;
    private final AppObservabilitySink sink;
    private final MonotonicClock clock;

    private final Object sendLock = new Object();

    // Guarded by sendLock.
    private int messageIndex;

    private volatile boolean initialized;
    private volatile PacketChannel reliable;
    private volatile PacketChannel bestEffort;
    private volatile int simulationId;
    private volatile long epochNanos;
    private volatile int maxIncomingPerUpdate;
    private volatile PollLoop pollLoop;

    private final ListenerRegistry<LogonReadyListener> logonReady;
    private final ListenerRegistry<StaticActorUpdatedListener> staticActorUpdated;
    private final ListenerRegistry<DynamicActorUpdatedListener> dynamicActorUpdated;
    private final ListenerRegistry<ActorMassUpdatedListener> actorMassUpdated;
    private final ListenerRegistry<RemoteEngineErrorListener> remoteEngineError;
    private final ListenerRegistry<ActorsCollidedListener> actorsCollided;
    private final ListenerRegistry<TimeAdvancedListener> timeAdvanced;

    public AppMessenger(AppObservabilitySink sink)
    {
        this(new DefaultAppMessageEncoder(), new DefaultAppMessageDecoder(sink), sink, SystemMonotonicClock.INSTANCE);
    }

    public AppMessenger(AppMessageEncoder encoder,
                        AppMessageDecoder decoder,
                        AppObservabilitySink sink,
                        MonotonicClock clock)
    {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.logonReady = registry("logon-ready");
        this.staticActorUpdated = registry("static-actor-updated");
        this.dynamicActorUpdated = registry("dynamic-actor-updated");
        this.actorMassUpdated = registry("actor-mass-updated");
        this.remoteEngineError = registry("remote-engine-error");
        this.actorsCollided = registry("actors-collided");
        this.timeAdvanced = registry("time-advanced");
    }

    private <L> ListenerRegistry<L> registry(String eventName)
    {
        return new ListenerRegistry<>(eventName, (event, e) ->
                sink.onError(new AppErrorEvent(Instant.now(), "Listener for " + event + " threw", e)));
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Binds the messenger to its channels and enables sending.
     *
     * <p>Both channels are told the APP header size and length-field offset.
     * The message index restarts at 0 and the simulation ID is taken from the
     * configuration until a {@link #logon(int, String)} replaces it. A poll
     * thread left from an earlier initialization is stopped first.</p>
     */
    public void initialize(RemotePhysicsConfig config, PacketChannel reliable, PacketChannel bestEffort)
    {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(reliable, "reliable");
        Objects.requireNonNull(bestEffort, "bestEffort");

        stopPollLoop();

        reliable.initializePacketParameters(AppHeader.SIZE, AppHeader.LENGTH_OFFSET);
        bestEffort.initializePacketParameters(AppHeader.SIZE, AppHeader.LENGTH_OFFSET);

        synchronized (sendLock) {
            this.reliable = reliable;
            this.bestEffort = bestEffort;
            this.messageIndex = 0;
            this.simulationId = config.simulationId();
            this.maxIncomingPerUpdate = config.maxIncomingPerUpdate();
            this.epochNanos = clock.nowNanos();
            this.initialized = true;
        }

        if (config.messengerInternalThread()) {
            PollLoop loop = new PollLoop("app-messenger-poll", this::update,
                    config.messengerPollInterval(), config.shutdownGrace(), sink);
            pollLoop = loop;
            loop.start();
        }

        log.info("APP messenger initialized (simulation {}, internal thread {})",
                Integer.toUnsignedString(simulationId), config.messengerInternalThread());
    }

    public boolean isInitialized()
    {
        return initialized;
    }

    public int simulationId()
    {
        return simulationId;
    }

    /**
     * @return the index the next accepted message will carry
     */
    public int nextMessageIndex()
    {
        synchronized (sendLock) {
            return messageIndex;
        }
    }

    @Override
    public void update()
    {
        if (!initialized) {
            return;
        }

        PacketChannel r = reliable;
        PacketChannel b = bestEffort;

        if (!r.usesInternalThread()) {
            r.update();
        }
        if (!b.usesInternalThread()) {
            b.update();
        }

        drain(r);
        drain(b);
    }

    /**
     * Stops the poll thread and returns the messenger to its uninitialized
     * state. The channels belong to the caller and are left open.
     */
    @Override
    public void close()
    {
        initialized = false;
        stopPollLoop();
    }

    private void stopPollLoop()
    {
        PollLoop loop = pollLoop;
        pollLoop = null;
        if (loop != null) {
            loop.stop();
        }
    }

    // ---------------------------------------------------------------------
    // Simulation
    // ---------------------------------------------------------------------

    @Override
    public void logon(int simulationId, String simulationName)
    {
        if (!initialized) {
            return;
        }
        this.simulationId = simulationId;
        send(new Logon(simulationId, simulationName), true);
    }

    @Override
    public void logoff(int simulationId)
    {
        send(new Logoff(simulationId));
    }

    @Override
    public void initializeWorld(Vector3 gravity,
                                float staticFriction,
                                float kineticFriction,
                                float restitution,
                                float collisionMargin,
                                int groundPlaneId,
                                float groundPlaneHeight,
                                Vector3 groundPlaneNormal)
    {
        if (!initialized) {
            return;
        }
        send(new SetWorld(actor(groundPlaneId), gravity, staticFriction, kineticFriction, restitution,
                collisionMargin, groundPlaneHeight, groundPlaneNormal));
    }

    @Override
    public void advanceTime(float time)
    {
        if (!initialized) {
            return;
        }
        send(new AdvanceTime(simulationId, time));
    }

    // ---------------------------------------------------------------------
    // Actors
    // ---------------------------------------------------------------------

    @Override
    public void createStaticActor(int actorId, Vector3 position, Quaternion orientation, boolean reportCollisions)
    {
        if (!initialized) {
            return;
        }
        send(CreateStaticActor.of(actor(actorId), position, orientation, reportCollisions));
    }

    @Override
    public void createDynamicActor(int actorId,
                                   Vector3 position,
                                   Quaternion orientation,
                                   float gravityModifier,
                                   Vector3 linearVelocity,
                                   Vector3 angularVelocity,
                                   boolean reportCollisions)
    {
        if (!initialized) {
            return;
        }
        int flags = reportCollisions ? CreateStaticActor.FLAG_REPORT_COLLISIONS : 0;
        send(new CreateDynamicActor(actor(actorId), position, orientation, gravityModifier,
                linearVelocity, angularVelocity, flags));
    }

    @Override
    public void setStaticActor(int actorId, Vector3 position, Quaternion orientation)
    {
        if (!initialized) {
            return;
        }
        send(new SetStaticActor(actor(actorId), position, orientation));
    }

    @Override
    public void setDynamicActor(int actorId,
                                Vector3 position,
                                Quaternion orientation,
                                float gravityModifier,
                                Vector3 linearVelocity,
                                Vector3 angularVelocity)
    {
        if (!initialized) {
            return;
        }
        send(new SetDynamicActor(actor(actorId), position, orientation, gravityModifier,
                linearVelocity, angularVelocity));
    }

    @Override
    public void updateActorPosition(int actorId, Vector3 position)
    {
        if (!initialized) {
            return;
        }
        send(new UpdateActorPosition(actor(actorId), position));
    }

    @Override
    public void updateActorOrientation(int actorId, Quaternion orientation)
    {
        if (!initialized) {
            return;
        }
        send(new UpdateActorOrientation(actor(actorId), orientation));
    }

    @Override
    public void updateActorGravityModifier(int actorId, float gravityModifier)
    {
        if (!initialized) {
            return;
        }
        send(new UpdateActorGravityModifier(actor(actorId), gravityModifier));
    }

    @Override
    public void updateActorVelocity(int actorId, Vector3 velocity)
    {
        if (!initialized) {
            return;
        }
        send(new UpdateActorLinearVelocity(actor(actorId), velocity));
    }

    @Override
    public void updateActorAngularVelocity(int actorId, Vector3 velocity)
    {
        if (!initialized) {
            return;
        }
        send(new UpdateActorAngularVelocity(actor(actorId), velocity));
    }

    @Override
    public void getActorMass(int actorId)
    {
        if (!initialized) {
            return;
        }
        send(new GetActorMass(actor(actorId)));
    }

    @Override
    public void removeActor(int actorId)
    {
        if (!initialized) {
            return;
        }
        send(new RemoveActor(actor(actorId)));
    }

    @Override
    public void applyForce(int actorId, Vector3 force)
    {
        if (!initialized) {
            return;
        }
        send(new ApplyForce(actor(actorId), force));
    }

    @Override
    public void applyTorque(int actorId, Vector3 torque)
    {
        if (!initialized) {
            return;
        }
        send(new ApplyTorque(actor(actorId), torque));
    }

    // ---------------------------------------------------------------------
    // Joints
    // ---------------------------------------------------------------------

    @Override
    public void addJoint(int jointId,
                         int actor1Id,
                         Vector3 actor1Translation,
                         Quaternion actor1Orientation,
                         int actor2Id,
                         Vector3 actor2Translation,
                         Quaternion actor2Orientation,
                         Vector3 linearLowerLimits,
                         Vector3 linearUpperLimits,
                         Vector3 angularLowerLimits,
                         Vector3 angularUpperLimits)
    {
        if (!initialized) {
            return;
        }
        send(new AddJoint(new JointId(simulationId, jointId),
                actor(actor1Id), actor1Orientation, actor1Translation,
                actor(actor2Id), actor2Orientation, actor2Translation,
                linearLowerLimits, linearUpperLimits, angularLowerLimits, angularUpperLimits));
    }

    @Override
    public void removeJoint(int jointId)
    {
        if (!initialized) {
            return;
        }
        send(new RemoveJoint(new JointId(simulationId, jointId)));
    }

    // ---------------------------------------------------------------------
    // Shapes
    // ---------------------------------------------------------------------

    @Override
    public void addSphere(int shapeId, Vector3 origin, float radius)
    {
        if (!initialized) {
            return;
        }
        send(new AddSphere(shape(shapeId), origin, radius));
    }

    @Override
    public void addPlane(int shapeId, Vector3 planeNormal, float planeConstant)
    {
        if (!initialized) {
            return;
        }
        send(new AddPlane(shape(shapeId), planeNormal, planeConstant));
    }

    @Override
    public void addCapsule(int shapeId, float radius, float height)
    {
        if (!initialized) {
            return;
        }
        send(new AddCapsule(shape(shapeId), radius, height));
    }

    @Override
    public void addBox(int shapeId, float length, float width, float height)
    {
        if (!initialized) {
            return;
        }
        send(new AddBox(shape(shapeId), length, width, height));
    }

    @Override
    public void addConvexMesh(int shapeId, List<Vector3> points)
    {
        if (!initialized) {
            return;
        }
        send(new AddConvexMesh(shape(shapeId), points));
    }

    @Override
    public void addTriangleMesh(int shapeId, List<Vector3> points, int[] triangles)
    {
        if (!initialized) {
            return;
        }
        send(AddTriangleMesh.fromIndices(shape(shapeId), points, triangles));
    }

    @Override
    public void addHeightField(int shapeId, int rows, int columns, float rowSpacing, float columnSpacing, float[] posts)
    {
        if (!initialized) {
            return;
        }
        send(new AddHeightField(shape(shapeId), rows, columns, rowSpacing, columnSpacing, posts));
    }

    @Override
    public void removeShape(int shapeId)
    {
        if (!initialized) {
            return;
        }
        send(new RemoveShape(shape(shapeId)));
    }

    @Override
    public void attachShape(int actorId,
                            int shapeId,
                            float density,
                            float staticFriction,
                            float kineticFriction,
                            float restitution,
                            Quaternion orientation,
                            Vector3 translation)
    {
        if (!initialized) {
            return;
        }
        send(new AttachShape(actor(actorId), shape(shapeId),
                new Material(density, staticFriction, kineticFriction, restitution),
                orientation, translation));
    }

    @Override
    public void updateShapeMaterial(int actorId,
                                    int shapeId,
                                    float staticFriction,
                                    float kineticFriction,
                                    float restitution,
                                    float density)
    {
        if (!initialized) {
            return;
        }
        send(new UpdateShapeMaterial(actor(actorId), shape(shapeId),
                new Material(density, staticFriction, kineticFriction, restitution)));
    }

    @Override
    public void detachShape(int actorId, int shapeId)
    {
        if (!initialized) {
            return;
        }
        send(new DetachShape(actor(actorId), shape(shapeId)));
    }

    // ---------------------------------------------------------------------
    // Events
    // ---------------------------------------------------------------------

    @Override
    public Subscription onLogonReady(LogonReadyListener listener)
    {
        return logonReady.add(listener);
    }

    @Override
    public Subscription onStaticActorUpdated(StaticActorUpdatedListener listener)
    {
        return staticActorUpdated.add(listener);
    }

    @Override
    public Subscription onDynamicActorUpdated(DynamicActorUpdatedListener listener)
    {
        return dynamicActorUpdated.add(listener);
    }

    @Override
    public Subscription onActorMassUpdated(ActorMassUpdatedListener listener)
    {
        return actorMassUpdated.add(listener);
    }

    @Override
    public Subscription onRemoteEngineError(RemoteEngineErrorListener listener)
    {
        return remoteEngineError.add(listener);
    }

    @Override
    public Subscription onActorsCollided(ActorsCollidedListener listener)
    {
        return actorsCollided.add(listener);
    }

    @Override
    public Subscription onTimeAdvanced(TimeAdvancedListener listener)
    {
        return timeAdvanced.add(listener);
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private ActorId actor(int actorId)
    {
        return new ActorId(simulationId, actorId);
    }

    private ShapeId shape(int shapeId)
    {
        return new ShapeId(simulationId, shapeId);
    }

    private void send(AppMessage message)
    {
        send(message, false);
    }

    private void send(AppMessage message, boolean alsoBestEffort)
    {
        synchronized (sendLock) {
            if (!initialized) {
                return;
            }

            float timestamp = (clock.nowNanos() - epochNanos) / 1_000_000_000f;
            byte[] packet = encoder.encode(message, messageIndex, timestamp);

            boolean accepted = reliable.sendPacket(packet);
            if (alsoBestEffort) {
                accepted |= bestEffort.sendPacket(packet);
            }

            if (accepted) {
                messageIndex++;
            }
            else {
                log.debug("{} not accepted by any channel; index {} not consumed",
                        message.type(), Integer.toUnsignedString(messageIndex));
            }
        }
    }

    private void drain(PacketChannel channel)
    {
        final int max = maxIncomingPerUpdate;
        for (int i = 0; i < max; i++) {
            Optional<byte[]> packet = channel.pollIncomingPacket();
            if (packet.isEmpty()) {
                return;
            }
            decoder.decode(packet.get()).ifPresent(this::dispatch);
        }
    }

    private void dispatch(AppEnvelope envelope)
    {
        final AppMessage message = envelope.message();

        if (message instanceof LogonReady m) {
            logonReady.dispatch(l -> l.onLogonReady(m.simulationId()));
        }
        else if (message instanceof SetStaticActor m) {
            staticActorUpdated.dispatch(l -> l.onStaticActorUpdated(
                    m.actor().actorId(), m.position(), m.orientation()));
        }
        else if (message instanceof SetDynamicActor m) {
            dynamicActorUpdated.dispatch(l -> l.onDynamicActorUpdated(
                    m.actor().actorId(), m.position(), m.orientation(), m.linearVelocity(), m.angularVelocity()));
        }
        else if (message instanceof UpdateActorMass m) {
            actorMassUpdated.dispatch(l -> l.onActorMassUpdated(m.actor().actorId(), m.mass()));
        }
        else if (message instanceof EngineError m) {
            remoteEngineError.dispatch(l -> l.onRemoteEngineError(m.referencedIndex(), m.reason()));
        }
        else if (message instanceof ActorsCollided m) {
            actorsCollided.dispatch(l -> l.onActorsCollided(
                    m.collidedActor().actorId(), m.collidingActor().actorId(),
                    m.contactPoint(), m.contactNormal(), m.separation()));
        }
        else if (message instanceof TimeAdvanced m) {
            // Other simulations sharing the engine receive their own notifications.
            if (m.simulationId() == simulationId) {
                timeAdvanced.dispatch(TimeAdvancedListener::onTimeAdvanced);
            }
        }
        else {
            log.trace("Ignoring inbound {}", message.type());
        }
    }
}

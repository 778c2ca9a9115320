package com.questrail.remotephysics.api;

import java.util.List;

/**
 * PhysicsMessenger
 * =============================================================================
 * Collaborator-facing surface of the remote physics link.
 *
 * <p>The scene and object model drive the remote engine exclusively through
 * the command methods below and observe it exclusively through the listener
 * registrations. All identifiers passed here are local to the current
 * simulation; the messenger qualifies them with the simulation ID established
 * at logon.</p>
 *
 * <h2>Availability over strictness</h2>
 * Commands issued before the messenger has been initialized (or after it has
 * been closed) are silently ignored. They are never errors.
 *
 * <h2>Threading</h2>
 * Commands may be issued from any thread. Listeners are invoked on the thread
 * that runs {@link #update()}: the messenger's own poll thread when it runs
 * one, otherwise the caller of {@link #update()}.
 */
public interface PhysicsMessenger extends AutoCloseable
{
    // ---------------------------------------------------------------------
    // Simulation
    // ---------------------------------------------------------------------

    /**
     * Logs this simulation on to the remote engine.
     *
     * <p>The logon is sent on both the reliable and the best-effort channel.
     * The given ID becomes the simulation ID of every subsequent command.</p>
     *
     * @param simulationId   the simulation ID
     * @param simulationName name shown by the remote engine; truncated to 48 bytes
     */
    void logon(int simulationId, String simulationName);

    void logoff(int simulationId);

    /**
     * Configures world-wide properties and the ground plane.
     */
    void initializeWorld(Vector3 gravity,
                         float staticFriction,
                         float kineticFriction,
                         float restitution,
                         float collisionMargin,
                         int groundPlaneId,
                         float groundPlaneHeight,
                         Vector3 groundPlaneNormal);

    /**
     * Asks the remote engine to advance this simulation by {@code time} seconds.
     */
    void advanceTime(float time);

    // ---------------------------------------------------------------------
    // Actors
    // ---------------------------------------------------------------------

    void createStaticActor(int actorId, Vector3 position, Quaternion orientation, boolean reportCollisions);

    void createDynamicActor(int actorId,
                            Vector3 position,
                            Quaternion orientation,
                            float gravityModifier,
                            Vector3 linearVelocity,
                            Vector3 angularVelocity,
                            boolean reportCollisions);

    void setStaticActor(int actorId, Vector3 position, Quaternion orientation);

    void setDynamicActor(int actorId,
                         Vector3 position,
                         Quaternion orientation,
                         float gravityModifier,
                         Vector3 linearVelocity,
                         Vector3 angularVelocity);

    void updateActorPosition(int actorId, Vector3 position);

    void updateActorOrientation(int actorId, Quaternion orientation);

    void updateActorGravityModifier(int actorId, float gravityModifier);

    void updateActorVelocity(int actorId, Vector3 velocity);

    void updateActorAngularVelocity(int actorId, Vector3 velocity);

    /**
     * Requests the mass of a dynamic actor. The answer arrives through
     * {@link #onActorMassUpdated(ActorMassUpdatedListener)}.
     */
    void getActorMass(int actorId);

    void removeActor(int actorId);

    void applyForce(int actorId, Vector3 force);

    void applyTorque(int actorId, Vector3 torque);

    // ---------------------------------------------------------------------
    // Joints
    // ---------------------------------------------------------------------

    void addJoint(int jointId,
                  int actor1Id,
                  Vector3 actor1Translation,
                  Quaternion actor1Orientation,
                  int actor2Id,
                  Vector3 actor2Translation,
                  Quaternion actor2Orientation,
                  Vector3 linearLowerLimits,
                  Vector3 linearUpperLimits,
                  Vector3 angularLowerLimits,
                  Vector3 angularUpperLimits);

    void removeJoint(int jointId);

    // ---------------------------------------------------------------------
    // Shapes
    // ---------------------------------------------------------------------

    void addSphere(int shapeId, Vector3 origin, float radius);

    void addPlane(int shapeId, Vector3 planeNormal, float planeConstant);

    void addCapsule(int shapeId, float radius, float height);

    void addBox(int shapeId, float length, float width, float height);

    void addConvexMesh(int shapeId, List<Vector3> points);

    /**
     * @param triangles vertex indices, three per triangle
     */
    void addTriangleMesh(int shapeId, List<Vector3> points, int[] triangles);

    /**
     * @param posts heights in row-major order; exactly {@code rows * columns} values
     */
    void addHeightField(int shapeId, int rows, int columns, float rowSpacing, float columnSpacing, float[] posts);

    void removeShape(int shapeId);

    void attachShape(int actorId,
                     int shapeId,
                     float density,
                     float staticFriction,
                     float kineticFriction,
                     float restitution,
                     Quaternion orientation,
                     Vector3 translation);

    void updateShapeMaterial(int actorId,
                             int shapeId,
                             float staticFriction,
                             float kineticFriction,
                             float restitution,
                             float density);

    void detachShape(int actorId, int shapeId);

    // ---------------------------------------------------------------------
    // Events
    // ---------------------------------------------------------------------

    Subscription onLogonReady(LogonReadyListener listener);

    Subscription onStaticActorUpdated(StaticActorUpdatedListener listener);

    Subscription onDynamicActorUpdated(DynamicActorUpdatedListener listener);

    Subscription onActorMassUpdated(ActorMassUpdatedListener listener);

    Subscription onRemoteEngineError(RemoteEngineErrorListener listener);

    Subscription onActorsCollided(ActorsCollidedListener listener);

    /**
     * Fires only for time-advanced notifications addressed to this simulation.
     */
    Subscription onTimeAdvanced(TimeAdvancedListener listener);

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Pumps both packet channels and dispatches pending inbound messages.
     *
     * <p>Only needed when the messenger does not run its own poll thread.</p>
     */
    void update();

    @Override
    void close();
}

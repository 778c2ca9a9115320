package com.questrail.remotephysics.protocol.app.model;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * AppMessageType
 * -----------------------------------------------------------------------------
 * The APP message catalog: wire type code and minimum body size of each
 * message.
 *
 * <p>For fixed-layout messages the minimum body size is the exact body size.
 * For the three variable-layout messages (convex mesh, triangle mesh, height
 * field) it covers the fixed prefix up to and including the element counts;
 * the full size follows from those counts. The error message carries its
 * reason in a fixed 256-byte field on encode but is accepted on decode as
 * soon as the referenced index is present.</p>
 */
public enum AppMessageType
{
    // Simulation control
    ERROR(1, 4),
    LOGON(11, 52),
    LOGON_READY(12, 4),
    LOGOFF(13, 4),
    ADVANCE_TIME(14, 8),
    TIME_ADVANCED(15, 4),

    // Actor lifecycle
    SET_WORLD(101, 52),
    CREATE_STATIC_ACTOR(102, 40),
    CREATE_DYNAMIC_ACTOR(103, 68),
    SET_STATIC_ACTOR(104, 36),
    SET_DYNAMIC_ACTOR(105, 64),
    UPDATE_ACTOR_POSITION(106, 20),
    UPDATE_ACTOR_ORIENTATION(107, 24),
    UPDATE_ACTOR_GRAVITY_MODIFIER(108, 12),
    UPDATE_ACTOR_LINEAR_VELOCITY(109, 20),
    UPDATE_ACTOR_ANGULAR_VELOCITY(110, 20),
    UPDATE_ACTOR_MASS(111, 12),
    GET_ACTOR_MASS(112, 8),
    REMOVE_ACTOR(113, 8),

    // Joints
    ADD_JOINT(201, 128),
    REMOVE_JOINT(202, 8),

    // Shapes
    ADD_SPHERE(301, 24),
    ADD_PLANE(302, 24),
    ADD_CAPSULE(303, 16),
    ADD_BOX(304, 20),
    ADD_CONVEX_MESH(305, 12),
    ADD_TRIANGLE_MESH(306, 16),
    ADD_HEIGHT_FIELD(307, 24),
    REMOVE_SHAPE(308, 8),
    ATTACH_SHAPE(309, 60),
    UPDATE_SHAPE_MATERIAL(310, 32),
    DETACH_SHAPE(311, 16),

    // Dynamics and collision notification
    ACTORS_COLLIDED(401, 44),
    APPLY_FORCE(402, 20),
    APPLY_TORQUE(403, 20);

    /** Fixed width of the simulation name in a logon body. */
    public static final int LOGON_NAME_LENGTH = 48;

    /** Fixed width of the reason text in an error body. */
    public static final int ERROR_REASON_LENGTH = 256;

    private static final Map<Integer, AppMessageType> BY_CODE = new HashMap<>();

    static {
        for (AppMessageType t : values()) {
            BY_CODE.put(t.code, t);
        }
    }

    private final int code;
    private final int minimumBodySize;

    AppMessageType(int code, int minimumBodySize)
    {
        this.code = code;
        this.minimumBodySize = minimumBodySize;
    }

    public int code()
    {
        return code;
    }

    public int minimumBodySize()
    {
        return minimumBodySize;
    }

    public int minimumMessageSize()
    {
        return AppHeader.SIZE + minimumBodySize;
    }

    public static Optional<AppMessageType> fromCode(int code)
    {
        return Optional.ofNullable(BY_CODE.get(code));
    }
}

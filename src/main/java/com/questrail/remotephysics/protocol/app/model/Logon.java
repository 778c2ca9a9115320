package com.questrail.remotephysics.protocol.app.model;

import java.util.Objects;

/**
 * Logs a simulation on to the remote engine.
 *
 * <p>The name is written into a fixed 48-byte field: truncated when longer,
 * no length prefix, no terminator.</p>
 */
public record Logon(int simulationId, String simulationName) implements AppMessage
{
    public Logon {
        Objects.requireNonNull(simulationName, "simulationName");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.LOGON;
    }
}

package com.questrail.remotephysics.protocol.app.observability;

import java.time.Instant;

/**
 * Lifecycle change of a packet channel.
 *
 * @param channel human-readable channel name, e.g. {@code "tcp 127.0.0.1:30000"}
 * @param cause   failure that triggered the change, or {@code null}
 */
public record AppTransportEvent(
    Instant timestamp,
    String channel,
    State state,
    Throwable cause
) {
    public enum State {
        CONNECTED,
        DISCONNECTED,
        CLOSED
    }
}

package com.questrail.remotephysics.protocol.app.observability;

import java.time.Instant;

/**
 * Record representing a local error or anomaly in the APP stack.
 *
 * <p>Errors reported by the remote engine are not represented here; they are
 * delivered to messenger listeners.</p>
 */
public record AppErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}

package com.questrail.remotephysics.protocol.app.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for the header timestamp and for poll-loop pacing.
 *
 * <h2>Binding invariant</h2>
 * Elapsed-time values written into outbound headers MUST come from a
 * monotonic source so that wall-clock adjustments never make the remote
 * engine observe time running backwards.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}

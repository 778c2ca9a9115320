package com.questrail.remotephysics.protocol.app.time;

import com.questrail.remotephysics.protocol.app.internal.time.MonotonicClock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic monotonic clock for tests.
 *
 * - Starts at the value given on construction
 * - Advances only when explicitly instructed
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong nowNanos;

    public ManualMonotonicClock() {
        this(0L);
    }

    public ManualMonotonicClock(long startNanos) {
        this.nowNanos = new AtomicLong(startNanos);
    }

    @Override
    public long nowNanos() {
        return nowNanos.get();
    }

    public void advanceNanos(long deltaNanos) {
        if (deltaNanos < 0) {
            throw new IllegalArgumentException("Cannot advance monotonic clock backwards");
        }
        nowNanos.addAndGet(deltaNanos);
    }

    public void advanceMillis(long millis) {
        advanceNanos(millis * 1_000_000L);
    }
}

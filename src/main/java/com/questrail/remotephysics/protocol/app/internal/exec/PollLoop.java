package com.questrail.remotephysics.protocol.app.internal.exec;

import com.questrail.remotephysics.protocol.app.observability.AppErrorEvent;
import com.questrail.remotephysics.protocol.app.observability.AppObservabilitySink;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * PollLoop
 * =============================================================================
 * Private thread that repeatedly runs one update step and sleeps.
 *
 * <h2>Threading Model</h2>
 * The stop flag is checked at the top of every iteration. {@link #stop()}
 * clears it, wakes the thread from its sleep and joins it for at most the
 * configured grace period. An I/O operation still outstanding when the grace
 * period runs out is abandoned; nothing is cancelled.
 *
 * <p>A step that throws is reported to the observability sink and the loop
 * continues with the next iteration.</p>
 */
public final class PollLoop
{
    private final String threadName;
    private final Runnable step;
    private final Duration interval;
    private final Duration shutdownGrace;
    private final AppObservabilitySink sink;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread thread;

    public PollLoop(String threadName,
                    Runnable step,
                    Duration interval,
                    Duration shutdownGrace,
                    AppObservabilitySink sink)
    {
        this.threadName = Objects.requireNonNull(threadName, "threadName");
        this.step = Objects.requireNonNull(step, "step");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.shutdownGrace = Objects.requireNonNull(shutdownGrace, "shutdownGrace");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Starts the loop thread.
     * Idempotent: calling start() while running has no effect.
     */
    public void start()
    {
        if (running.compareAndSet(false, true)) {
            Thread t = new Thread(this::run, threadName);
            t.setDaemon(true);
            thread = t;
            t.start();
        }
    }

    /**
     * Stops the loop and waits up to the grace period for it to finish.
     */
    public void stop()
    {
        if (running.compareAndSet(true, false)) {
            Thread t = thread;
            if (t == null || t == Thread.currentThread()) {
                return;
            }
            t.interrupt();
            try {
                t.join(shutdownGrace.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isRunning()
    {
        return running.get();
    }

    private void run()
    {
        final long sleepMillis = interval.toMillis();
        while (running.get()) {
            try {
                step.run();
            } catch (RuntimeException e) {
                sink.onError(new AppErrorEvent(Instant.now(), threadName + " step failed", e));
            }

            try {
                Thread.sleep(sleepMillis);
            } catch (InterruptedException e) {
                // Expected during shutdown
                if (running.get()) {
                    Thread.currentThread().interrupt();
                }
                return;
            }
        }
    }
}

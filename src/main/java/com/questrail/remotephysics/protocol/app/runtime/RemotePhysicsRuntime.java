package com.questrail.remotephysics.protocol.app.runtime;

import com.questrail.remotephysics.api.PhysicsMessenger;
import com.questrail.remotephysics.protocol.app.AppMessenger;
import com.questrail.remotephysics.protocol.app.codec.impl.DefaultAppMessageDecoder;
import com.questrail.remotephysics.protocol.app.codec.impl.DefaultAppMessageEncoder;
import com.questrail.remotephysics.protocol.app.config.RemotePhysicsConfig;
import com.questrail.remotephysics.protocol.app.internal.time.MonotonicClock;
import com.questrail.remotephysics.protocol.app.internal.time.SystemMonotonicClock;
import com.questrail.remotephysics.protocol.app.observability.AppObservabilitySink;
import com.questrail.remotephysics.protocol.app.observability.Slf4jAppObservabilitySink;
import com.questrail.remotephysics.protocol.app.transport.PacketChannel;
import com.questrail.remotephysics.protocol.app.transport.tcp.netty.NettyTcpPacketChannel;
import com.questrail.remotephysics.protocol.app.transport.udp.netty.NettyUdpPacketChannel;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * RemotePhysicsRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one remote physics link.
 *
 * <pre>
 *   RemotePhysicsRuntime runtime = RemotePhysicsRuntime.builder()
 *       .withConfig(RemotePhysicsConfig.defaults())
 *       .build();                 → TCP connect attempt, UDP bind
 *   runtime.start();              → poll threads, messenger initialized
 *   runtime.messenger().logon(7, "TestSim");
 *   runtime.stop();               → messenger, then channels
 * </pre>
 *
 * <p>A failed connect does not fail {@link Builder#build()}; the reliable
 * channel reports the failure to the sink and refuses every packet, so the
 * messenger degrades to a no-op.</p>
 */
public final class RemotePhysicsRuntime {
    private final RemotePhysicsConfig config;
    private final AppMessenger messenger;
    private final PacketChannel reliable;
    private final PacketChannel bestEffort;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private RemotePhysicsRuntime(RemotePhysicsConfig config,
                                 AppMessenger messenger,
                                 PacketChannel reliable,
                                 PacketChannel bestEffort) {
        this.config = config;
        this.messenger = messenger;
        this.reliable = reliable;
        this.bestEffort = bestEffort;
    }

    public void start() {
        if (started.compareAndSet(false, true)) {
            messenger.initialize(config, reliable, bestEffort);
            reliable.start();
            bestEffort.start();
        }
    }

    public void stop() {
        messenger.close();
        reliable.close();
        bestEffort.close();
    }

    public PhysicsMessenger messenger() {
        return messenger;
    }

    public RemotePhysicsConfig config() {
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RemotePhysicsConfig config = RemotePhysicsConfig.defaults();
        private AppObservabilitySink observabilitySink = new Slf4jAppObservabilitySink();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;

        public Builder withConfig(RemotePhysicsConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(AppObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public RemotePhysicsRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(clock, "clock");

            // Initialization order follows the link: stream first, then datagrams.
            PacketChannel reliable = new NettyTcpPacketChannel(config, observabilitySink);
            PacketChannel bestEffort = new NettyUdpPacketChannel(config, observabilitySink);

            AppMessenger messenger = new AppMessenger(
                new DefaultAppMessageEncoder(),
                new DefaultAppMessageDecoder(observabilitySink),
                observabilitySink,
                clock
            );

            return new RemotePhysicsRuntime(config, messenger, reliable, bestEffort);
        }
    }
}

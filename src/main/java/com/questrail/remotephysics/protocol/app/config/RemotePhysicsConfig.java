package com.questrail.remotephysics.protocol.app.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Aggregated configuration for the remote physics link.
 *
 * <p>{@link #fromProperties(Properties)} reads the same keys the plugin section
 * of a region configuration uses ({@code RemoteAddress}, {@code RemotePort},
 * {@code SimulationID}, ...). Keys that are absent keep their defaults.</p>
 *
 * @param remoteAddress               host of the remote physics engine
 * @param remotePort                  TCP and UDP port of the remote engine
 * @param localUdpPort                local UDP bind port; 0 picks an ephemeral port
 * @param simulationId                simulation ID used until a logon sets another
 * @param packetChannelInternalThread whether each packet channel runs its own poll thread
 * @param messengerInternalThread     whether the messenger runs its own poll thread
 * @param connectTimeout              upper bound on the blocking TCP connect
 * @param maxOutgoingPerUpdate        packets a channel writes per update cycle
 * @param maxIncomingPerUpdate        packets the messenger dispatches per channel per update cycle
 * @param messengerPollInterval       sleep between messenger poll iterations
 * @param reliablePollInterval        sleep between TCP channel poll iterations
 * @param bestEffortPollInterval      sleep between UDP channel poll iterations
 * @param shutdownGrace               bounded join applied to poll threads on close
 * @param maxFrameLength              largest message the TCP reassembler accepts
 */
public record RemotePhysicsConfig(
    String remoteAddress,
    int remotePort,
    int localUdpPort,
    int simulationId,
    boolean packetChannelInternalThread,
    boolean messengerInternalThread,
    Duration connectTimeout,
    int maxOutgoingPerUpdate,
    int maxIncomingPerUpdate,
    Duration messengerPollInterval,
    Duration reliablePollInterval,
    Duration bestEffortPollInterval,
    Duration shutdownGrace,
    int maxFrameLength
) {
    public static final String DEFAULT_REMOTE_ADDRESS = "127.0.0.1";
    public static final int DEFAULT_REMOTE_PORT = 30000;

    public RemotePhysicsConfig {
        Objects.requireNonNull(remoteAddress, "remoteAddress");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(messengerPollInterval, "messengerPollInterval");
        Objects.requireNonNull(reliablePollInterval, "reliablePollInterval");
        Objects.requireNonNull(bestEffortPollInterval, "bestEffortPollInterval");
        Objects.requireNonNull(shutdownGrace, "shutdownGrace");

        if (remoteAddress.isBlank()) {
            throw new IllegalArgumentException("remoteAddress must not be blank");
        }
        requirePort("remotePort", remotePort, false);
        requirePort("localUdpPort", localUdpPort, true);
        requirePositive("maxOutgoingPerUpdate", maxOutgoingPerUpdate);
        requirePositive("maxIncomingPerUpdate", maxIncomingPerUpdate);
        requirePositive("connectTimeout", connectTimeout);
        requireNotNegative("messengerPollInterval", messengerPollInterval);
        requireNotNegative("reliablePollInterval", reliablePollInterval);
        requireNotNegative("bestEffortPollInterval", bestEffortPollInterval);
        requireNotNegative("shutdownGrace", shutdownGrace);
        if (maxFrameLength < 24) {
            throw new IllegalArgumentException("maxFrameLength must hold at least a header, got " + maxFrameLength);
        }
    }

    public static RemotePhysicsConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a configuration from properties.
     *
     * @throws IllegalArgumentException if a present key holds a malformed value
     */
    public static RemotePhysicsConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");

        Builder b = builder();
        String address = props.getProperty("RemoteAddress");
        if (address != null) {
            b.withRemoteAddress(address.trim());
        }
        b.withRemotePort(intProperty(props, "RemotePort", b.remotePort));
        b.withLocalUdpPort(intProperty(props, "LocalUdpPort", b.localUdpPort));
        b.withSimulationId(unsignedIntProperty(props, "SimulationID", b.simulationId));
        b.withPacketChannelInternalThread(booleanProperty(props, "PacketManagerInternalThread", b.packetChannelInternalThread));
        b.withMessengerInternalThread(booleanProperty(props, "MessengerInternalThread", b.messengerInternalThread));
        b.withConnectTimeout(millisProperty(props, "ConnectTimeoutMillis", b.connectTimeout));
        b.withMaxOutgoingPerUpdate(intProperty(props, "MaxOutgoingPerUpdate", b.maxOutgoingPerUpdate));
        b.withMaxIncomingPerUpdate(intProperty(props, "MaxIncomingPerUpdate", b.maxIncomingPerUpdate));
        b.withMessengerPollInterval(millisProperty(props, "MessengerPollMillis", b.messengerPollInterval));
        b.withReliablePollInterval(millisProperty(props, "ReliablePollMillis", b.reliablePollInterval));
        b.withBestEffortPollInterval(millisProperty(props, "BestEffortPollMillis", b.bestEffortPollInterval));
        b.withShutdownGrace(millisProperty(props, "ShutdownGraceMillis", b.shutdownGrace));
        b.withMaxFrameLength(intProperty(props, "MaxFrameLength", b.maxFrameLength));
        return b.build();
    }

    private static int intProperty(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": '" + raw + "'", e);
        }
    }

    // Simulation IDs are u32 on the wire.
    private static int unsignedIntProperty(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseUnsignedInt(raw.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid unsigned integer for " + key + ": '" + raw + "'", e);
        }
    }

    private static boolean booleanProperty(Properties props, String key, boolean fallback) {
        String raw = props.getProperty(key);
        if (raw == null) {
            return fallback;
        }
        String v = raw.trim();
        if (v.equalsIgnoreCase("true")) {
            return true;
        }
        if (v.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException("Invalid boolean for " + key + ": '" + raw + "'");
    }

    private static Duration millisProperty(Properties props, String key, Duration fallback) {
        String raw = props.getProperty(key);
        if (raw == null) {
            return fallback;
        }
        try {
            return Duration.ofMillis(Long.parseLong(raw.trim()));
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid millisecond value for " + key + ": '" + raw + "'", e);
        }
    }

    private static void requirePort(String name, int port, boolean zeroAllowed) {
        int min = zeroAllowed ? 0 : 1;
        if (port < min || port > 0xFFFF) {
            throw new IllegalArgumentException(name + " out of range: " + port);
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0, got " + value);
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0, got " + value);
        }
    }

    private static void requireNotNegative(String name, Duration value) {
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative, got " + value);
        }
    }

    public static final class Builder {
        private String remoteAddress = DEFAULT_REMOTE_ADDRESS;
        private int remotePort = DEFAULT_REMOTE_PORT;
        private int localUdpPort = 0;
        private int simulationId = 0;
        private boolean packetChannelInternalThread = true;
        private boolean messengerInternalThread = true;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private int maxOutgoingPerUpdate = 50;
        private int maxIncomingPerUpdate = 5000;
        private Duration messengerPollInterval = Duration.ofMillis(10);
        private Duration reliablePollInterval = Duration.ofMillis(30);
        private Duration bestEffortPollInterval = Duration.ofMillis(10);
        private Duration shutdownGrace = Duration.ofMillis(500);
        private int maxFrameLength = 4 * 1024 * 1024;

        public Builder withRemoteAddress(String remoteAddress) {
            this.remoteAddress = remoteAddress;
            return this;
        }

        public Builder withRemotePort(int remotePort) {
            this.remotePort = remotePort;
            return this;
        }

        public Builder withLocalUdpPort(int localUdpPort) {
            this.localUdpPort = localUdpPort;
            return this;
        }

        public Builder withSimulationId(int simulationId) {
            this.simulationId = simulationId;
            return this;
        }

        public Builder withPacketChannelInternalThread(boolean enabled) {
            this.packetChannelInternalThread = enabled;
            return this;
        }

        public Builder withMessengerInternalThread(boolean enabled) {
            this.messengerInternalThread = enabled;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withMaxOutgoingPerUpdate(int max) {
            this.maxOutgoingPerUpdate = max;
            return this;
        }

        public Builder withMaxIncomingPerUpdate(int max) {
            this.maxIncomingPerUpdate = max;
            return this;
        }

        public Builder withMessengerPollInterval(Duration interval) {
            this.messengerPollInterval = interval;
            return this;
        }

        public Builder withReliablePollInterval(Duration interval) {
            this.reliablePollInterval = interval;
            return this;
        }

        public Builder withBestEffortPollInterval(Duration interval) {
            this.bestEffortPollInterval = interval;
            return this;
        }

        public Builder withShutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
            return this;
        }

        public Builder withMaxFrameLength(int maxFrameLength) {
            this.maxFrameLength = maxFrameLength;
            return this;
        }

        public RemotePhysicsConfig build() {
            return new RemotePhysicsConfig(
                remoteAddress,
                remotePort,
                localUdpPort,
                simulationId,
                packetChannelInternalThread,
                messengerInternalThread,
                connectTimeout,
                maxOutgoingPerUpdate,
                maxIncomingPerUpdate,
                messengerPollInterval,
                reliablePollInterval,
                bestEffortPollInterval,
                shutdownGrace,
                maxFrameLength);
        }
    }
}

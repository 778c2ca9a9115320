package com.questrail.remotephysics.protocol.app.transport.udp.netty;

import com.questrail.remotephysics.protocol.app.codec.impl.DefaultAppMessageEncoder;
import com.questrail.remotephysics.protocol.app.config.RemotePhysicsConfig;
import com.questrail.remotephysics.protocol.app.model.Logon;
import com.questrail.remotephysics.protocol.app.model.LogonReady;
import com.questrail.remotephysics.protocol.app.observability.AppTransportEvent;
import com.questrail.remotephysics.protocol.app.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.time.Duration;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyUdpPacketChannelTest
 * -----------------------------------------------------------------------------
 * Loopback tests against a plain {@link DatagramSocket} standing in for the
 * remote engine.
 */
final class NettyUdpPacketChannelTest
{
    private static final int TIMEOUT_MILLIS = 5_000;

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final DefaultAppMessageEncoder encoder = new DefaultAppMessageEncoder();

    @Test
    void eachPacketIsOneDatagram() throws Exception
    {
        try (DatagramSocket peer = new DatagramSocket(0, InetAddress.getLoopbackAddress())) {
            peer.setSoTimeout(TIMEOUT_MILLIS);
            NettyUdpPacketChannel channel = new NettyUdpPacketChannel(configFor(peer.getLocalPort()), sink);
            try {
                assertTrue(channel.localAddress().isPresent());
                assertTrue(sink.hasTransportState(AppTransportEvent.State.CONNECTED));

                byte[] a = encoder.encode(new Logon(7, "TestSim"), 0, 0f);
                byte[] b = encoder.encode(new LogonReady(7), 1, 0f);
                assertTrue(channel.sendPacket(a));
                assertTrue(channel.sendPacket(b));
                channel.update();

                assertArrayEquals(a, receive(peer));
                assertArrayEquals(b, receive(peer));
            }
            finally {
                channel.close();
            }
        }
    }

    @Test
    void inboundDatagramsAreQueuedWhole() throws Exception
    {
        try (DatagramSocket peer = new DatagramSocket(0, InetAddress.getLoopbackAddress())) {
            NettyUdpPacketChannel channel = new NettyUdpPacketChannel(configFor(peer.getLocalPort()), sink);
            try {
                int localPort = channel.localAddress().orElseThrow().getPort();
                byte[] payload = encoder.encode(new LogonReady(3), 5, 0f);

                peer.send(new DatagramPacket(payload, payload.length, InetAddress.getLoopbackAddress(), localPort));

                long deadline = System.currentTimeMillis() + TIMEOUT_MILLIS;
                while (!channel.hasIncomingPacket() && System.currentTimeMillis() < deadline) {
                    channel.update();
                    Thread.sleep(10);
                }

                assertArrayEquals(payload, channel.pollIncomingPacket().orElseThrow());
            }
            finally {
                channel.close();
            }
        }
    }

    @Test
    void closedChannelRefusesPackets() throws Exception
    {
        try (DatagramSocket peer = new DatagramSocket(0, InetAddress.getLoopbackAddress())) {
            NettyUdpPacketChannel channel = new NettyUdpPacketChannel(configFor(peer.getLocalPort()), sink);

            channel.close();

            assertFalse(channel.sendPacket(new byte[] { 1 }));
            assertTrue(sink.hasTransportState(AppTransportEvent.State.CLOSED));
        }
    }

    private static byte[] receive(DatagramSocket peer) throws Exception
    {
        DatagramPacket packet = new DatagramPacket(new byte[2048], 2048);
        peer.receive(packet);
        return Arrays.copyOf(packet.getData(), packet.getLength());
    }

    private static RemotePhysicsConfig configFor(int remotePort)
    {
        return RemotePhysicsConfig.builder()
                .withRemoteAddress("127.0.0.1")
                .withRemotePort(remotePort)
                .withPacketChannelInternalThread(false)
                .withShutdownGrace(Duration.ofMillis(200))
                .build();
    }
}

package com.questrail.remotephysics.protocol.app.transport.udp.netty;

import com.questrail.remotephysics.protocol.app.config.RemotePhysicsConfig;
import com.questrail.remotephysics.protocol.app.observability.AppErrorEvent;
import com.questrail.remotephysics.protocol.app.observability.AppObservabilitySink;
import com.questrail.remotephysics.protocol.app.observability.AppTransportEvent;
import com.questrail.remotephysics.protocol.app.transport.AbstractPacketChannel;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * NettyUdpPacketChannel
 * =============================================================================
 * Netty-backed best-effort {@link com.questrail.remotephysics.protocol.app.transport.PacketChannel}.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. One outbound packet
 * is one datagram to the remote engine; one inbound datagram is one packet.
 * There is no reassembly and no delivery or ordering guarantee.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound payloads are copied into
 * {@code byte[]}; all reference-counted buffers are released internally.
 *
 * <h2>Failure handling</h2>
 * Datagram sockets have no connection to lose. Send and receive errors are
 * logged and swallowed, and the channel keeps trying on later updates.
 *
 * <h2>Lifecycle</h2>
 * - The constructor binds the local UDP socket (ephemeral port by default).
 * - {@link #close()} stops the poll thread, closes the channel and shuts down
 *   the event loop group.
 */
public final class NettyUdpPacketChannel extends AbstractPacketChannel
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpPacketChannel.class);

    private final InetSocketAddress remote;
    private final long shutdownGraceMillis;

    private final EventLoopGroup group;

    private volatile Channel channel;
    private volatile boolean closed;

    public NettyUdpPacketChannel(RemotePhysicsConfig config, AppObservabilitySink sink)
    {
        super("udp " + config.remoteAddress() + ":" + config.remotePort(),
              config.maxOutgoingPerUpdate(),
              config.packetChannelInternalThread(),
              config.bestEffortPollInterval(),
              config.shutdownGrace(),
              sink);

        this.remote = new InetSocketAddress(config.remoteAddress(), config.remotePort());
        this.shutdownGraceMillis = config.shutdownGrace().toMillis();
        this.group = new NioEventLoopGroup(1);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });

        ChannelFuture f = bootstrap.bind(config.localUdpPort()).awaitUninterruptibly();
        if (f.isSuccess()) {
            channel = f.channel();
            log.debug("UDP channel bound to {} for {}", channel.localAddress(), remote);
            sink.onTransportEvent(new AppTransportEvent(Instant.now(), name(), AppTransportEvent.State.CONNECTED, null));
        }
        else {
            sink.onError(new AppErrorEvent(Instant.now(),
                    "Unable to bind UDP port " + config.localUdpPort(), f.cause()));
        }
    }

    /**
     * @return the bound local address, if the bind succeeded
     */
    public Optional<InetSocketAddress> localAddress()
    {
        Channel ch = channel;
        return ch == null ? Optional.empty() : Optional.of((InetSocketAddress) ch.localAddress());
    }

    @Override
    protected boolean isOpen()
    {
        // A channel that never bound refuses packets instead of queueing them forever.
        return !closed && channel != null;
    }

    @Override
    protected boolean isSendReady()
    {
        return channel != null;
    }

    @Override
    protected void transmit(List<byte[]> batch)
    {
        Channel ch = channel;
        if (ch == null) {
            return;
        }

        for (byte[] packet : batch) {
            ByteBuf buf = Unpooled.wrappedBuffer(packet);
            ch.write(new DatagramPacket(buf, remote)).addListener((ChannelFutureListener) future -> {
                if (!future.isSuccess()) {
                    log.warn("UDP send of {} bytes to {} failed: {}", packet.length, remote, future.cause().toString());
                }
            });
        }
        ch.flush();
    }

    @Override
    protected void onUpdate()
    {
        // Auto-read delivers datagrams as they arrive.
    }

    @Override
    protected void closeTransport()
    {
        if (closed) {
            return;
        }
        closed = true;

        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
        group.shutdownGracefully(0, shutdownGraceMillis, TimeUnit.MILLISECONDS);

        sink.onTransportEvent(new AppTransportEvent(Instant.now(), name(), AppTransportEvent.State.CLOSED, null));
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives Netty {@link DatagramPacket}s and queues a copy of each payload.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            if (closed) {
                return;
            }

            // Copy the payload into a plain byte[] (Netty containment rule).
            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            deliver(bytes);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // e.g. ICMP port unreachable surfaced as PortUnreachableException; the socket stays usable.
            log.warn("UDP receive error on {}: {}", name(), cause.toString());
        }
    }
}

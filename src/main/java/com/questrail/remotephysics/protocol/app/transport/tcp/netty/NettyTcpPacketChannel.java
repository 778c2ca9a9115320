package com.questrail.remotephysics.protocol.app.transport.tcp.netty;

import com.questrail.remotephysics.protocol.app.config.RemotePhysicsConfig;
import com.questrail.remotephysics.protocol.app.observability.AppErrorEvent;
import com.questrail.remotephysics.protocol.app.observability.AppObservabilitySink;
import com.questrail.remotephysics.protocol.app.observability.AppTransportEvent;
import com.questrail.remotephysics.protocol.app.transport.AbstractPacketChannel;
import com.questrail.remotephysics.protocol.app.transport.tcp.StreamFrameAssembler;
import com.questrail.remotephysics.protocol.app.transport.tcp.StreamFramingException;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpPacketChannel
 * =============================================================================
 * Netty-backed reliable {@link com.questrail.remotephysics.protocol.app.transport.PacketChannel}.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It splits the TCP
 * stream into packets using the header length field and nothing else.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Decode APP messages</li>
 *   <li>Interpret message types</li>
 *   <li>Reconnect on its own</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound bytes are copied into {@code byte[]}
 * before they reach the {@link StreamFrameAssembler}.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>The constructor connects and blocks until the connect succeeds, fails,
 *       or the configured connect timeout elapses. Failure does not throw; the
 *       channel is simply never open.</li>
 *   <li>A socket error at any later point marks the channel permanently
 *       disconnected. Sends are refused and updates do nothing until the owner
 *       creates a new channel.</li>
 *   <li>{@link #close()} stops the poll thread, closes the socket and shuts
 *       down the event loop group.</li>
 * </ul>
 *
 * <h2>I/O discipline</h2>
 * Auto-read is disabled: each update issues one read when none is outstanding.
 * Each update writes at most one batch, and never while the previous batch is
 * still being flushed.
 */
public final class NettyTcpPacketChannel extends AbstractPacketChannel
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpPacketChannel.class);

    private final InetSocketAddress remote;
    private final int maxFrameLength;
    private final long shutdownGraceMillis;

    private final EventLoopGroup group;

    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final AtomicBoolean sendReady = new AtomicBoolean(true);
    private final AtomicBoolean receiveReady = new AtomicBoolean(true);

    private volatile boolean closed;
    private volatile Channel channel;

    // Touched only on the event loop thread once reads have started.
    private volatile StreamFrameAssembler assembler;

    public NettyTcpPacketChannel(RemotePhysicsConfig config, AppObservabilitySink sink)
    {
        super("tcp " + config.remoteAddress() + ":" + config.remotePort(),
              config.maxOutgoingPerUpdate(),
              config.packetChannelInternalThread(),
              config.reliablePollInterval(),
              config.shutdownGrace(),
              sink);

        this.remote = new InetSocketAddress(config.remoteAddress(), config.remotePort());
        this.maxFrameLength = config.maxFrameLength();
        this.shutdownGraceMillis = config.shutdownGrace().toMillis();
        this.group = new NioEventLoopGroup(1);

        connect(config.connectTimeout().toMillis());
    }

    private void connect(long timeoutMillis)
    {
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.AUTO_READ, false)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, timeoutMillis))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });

        log.debug("Connecting to remote physics engine at {}", remote);

        final CountDownLatch done = new CountDownLatch(1);
        final Throwable[] failure = new Throwable[1];
        final AtomicBoolean abandoned = new AtomicBoolean(false);

        ChannelFuture f = bootstrap.connect(remote);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                if (abandoned.get()) {
                    // The wait already gave up; nobody will use this socket.
                    future.channel().close();
                }
                else {
                    channel = future.channel();
                }
            }
            else {
                failure[0] = future.cause();
            }
            done.countDown();
        });

        try {
            if (!done.await(timeoutMillis, TimeUnit.MILLISECONDS)) {
                abandonConnect(f, abandoned);
                markDisconnected(new TimeoutException(
                        "Connect to " + remote + " timed out after " + timeoutMillis + " ms"));
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandonConnect(f, abandoned);
            markDisconnected(e);
            return;
        }

        if (channel == null) {
            markDisconnected(failure[0]);
            return;
        }

        connected.set(true);
        sink.onTransportEvent(new AppTransportEvent(Instant.now(), name(), AppTransportEvent.State.CONNECTED, null));
    }

    /**
     * Gives up on a pending connect. A listener that completes afterwards
     * closes its socket; one that completed in between is closed here.
     */
    private void abandonConnect(ChannelFuture f, AtomicBoolean abandoned)
    {
        abandoned.set(true);
        f.cancel(false);
        Channel late = channel;
        if (late != null) {
            channel = null;
            late.close();
        }
    }

    public boolean isConnected()
    {
        return connected.get();
    }

    @Override
    protected void onPacketParameters(int headerSize, int lengthOffset)
    {
        assembler = new StreamFrameAssembler(headerSize, lengthOffset, maxFrameLength);
    }

    @Override
    protected boolean isOpen()
    {
        return connected.get() && !closed;
    }

    @Override
    protected boolean isSendReady()
    {
        return sendReady.get();
    }

    @Override
    protected void transmit(List<byte[]> batch)
    {
        Channel ch = channel;
        if (ch == null) {
            return;
        }

        sendReady.set(false);
        ByteBuf buf = Unpooled.wrappedBuffer(batch.toArray(new byte[0][]));
        ch.writeAndFlush(buf).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                sendReady.set(true);
            }
            else {
                markDisconnected(future.cause());
            }
        });
    }

    @Override
    protected void onUpdate()
    {
        Channel ch = channel;
        // No reads until the framing parameters are known.
        if (ch == null || assembler == null) {
            return;
        }
        if (receiveReady.compareAndSet(true, false)) {
            ch.read();
        }
    }

    @Override
    protected void closeTransport()
    {
        if (closed) {
            return;
        }
        closed = true;
        connected.set(false);

        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
        group.shutdownGracefully(0, shutdownGraceMillis, TimeUnit.MILLISECONDS);

        sink.onTransportEvent(new AppTransportEvent(Instant.now(), name(), AppTransportEvent.State.CLOSED, null));
    }

    private void markDisconnected(Throwable cause)
    {
        if (closed) {
            return;
        }
        boolean wasConnected = connected.getAndSet(false);
        if (wasConnected || channel == null) {
            sink.onTransportEvent(new AppTransportEvent(
                    Instant.now(), name(), AppTransportEvent.State.DISCONNECTED, cause));
            sink.onError(new AppErrorEvent(Instant.now(), "Reliable channel to " + remote + " lost", cause));
        }

        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies each read into a {@code byte[]} and runs it through the
     * assembler; complete packets go to the incoming queue.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
        {
            StreamFrameAssembler a = assembler;
            if (a == null || !connected.get()) {
                return;
            }

            byte[] bytes = new byte[msg.readableBytes()];
            msg.getBytes(msg.readerIndex(), bytes);

            try {
                a.feed(bytes, packet -> deliver(packet));
            } catch (StreamFramingException e) {
                markDisconnected(e);
            }
        }

        @Override
        public void channelReadComplete(ChannelHandlerContext ctx)
        {
            receiveReady.set(true);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            markDisconnected(new EOFException("Connection closed by " + remote));
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            markDisconnected(cause);
            ctx.close();
        }
    }
}

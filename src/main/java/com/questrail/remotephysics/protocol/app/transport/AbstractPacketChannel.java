package com.questrail.remotephysics.protocol.app.transport;

import com.questrail.remotephysics.protocol.app.internal.exec.PollLoop;
import com.questrail.remotephysics.protocol.app.observability.AppObservabilitySink;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * AbstractPacketChannel
 * -----------------------------------------------------------------------------
 * Queueing and threading shared by the reliable and best-effort channels.
 *
 * <h2>What this class does</h2>
 * <ul>
 *   <li>Owns an outgoing and an incoming FIFO, each guarded by its own lock</li>
 *   <li>Drains at most {@code maxOutgoingPerUpdate} packets per update into one
 *       batch, and only when the subclass reports it is ready to send</li>
 *   <li>Optionally runs {@link #update()} on a private {@link PollLoop}</li>
 * </ul>
 *
 * <h2>What subclasses do</h2>
 * Subclasses perform the socket I/O: {@link #transmit(List)} writes a batch,
 * {@link #onUpdate()} arms the next receive, and {@link #deliver(byte[])} hands
 * each complete received packet back to this class.
 */
public abstract class AbstractPacketChannel implements PacketChannel
{
    private final Object outgoingLock = new Object();
    private final Object incomingLock = new Object();

    private final Deque<byte[]> outgoing = new ArrayDeque<>();
    private final Deque<byte[]> incoming = new ArrayDeque<>();

    private final String name;
    private final int maxOutgoingPerUpdate;
    private final PollLoop pollLoop;

    protected final AppObservabilitySink sink;

    private volatile int headerSize = -1;
    private volatile int lengthOffset = -1;

    protected AbstractPacketChannel(String name,
                                    int maxOutgoingPerUpdate,
                                    boolean internalThread,
                                    Duration pollInterval,
                                    Duration shutdownGrace,
                                    AppObservabilitySink sink)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.sink = Objects.requireNonNull(sink, "sink");
        if (maxOutgoingPerUpdate <= 0) {
            throw new IllegalArgumentException("maxOutgoingPerUpdate must be > 0");
        }
        this.maxOutgoingPerUpdate = maxOutgoingPerUpdate;
        this.pollLoop = internalThread
                ? new PollLoop("app-" + name + "-poll", this::update, pollInterval, shutdownGrace, sink)
                : null;
    }

    @Override
    public void initializePacketParameters(int headerSize, int lengthOffset)
    {
        if (headerSize <= 0) {
            throw new IllegalArgumentException("headerSize must be > 0, got " + headerSize);
        }
        if (lengthOffset < 0 || lengthOffset + 4 > headerSize) {
            throw new IllegalArgumentException(
                    "lengthOffset " + lengthOffset + " does not fit a 4-byte field in a " + headerSize + "-byte header");
        }
        if (headerSize == this.headerSize && lengthOffset == this.lengthOffset) {
            // Unchanged; keep any partially framed input.
            return;
        }
        this.headerSize = headerSize;
        this.lengthOffset = lengthOffset;
        onPacketParameters(headerSize, lengthOffset);
    }

    @Override
    public boolean sendPacket(byte[] packet)
    {
        Objects.requireNonNull(packet, "packet");
        if (!isOpen()) {
            return false;
        }
        synchronized (outgoingLock) {
            outgoing.addLast(packet);
        }
        return true;
    }

    @Override
    public boolean hasIncomingPacket()
    {
        synchronized (incomingLock) {
            return !incoming.isEmpty();
        }
    }

    @Override
    public Optional<byte[]> pollIncomingPacket()
    {
        synchronized (incomingLock) {
            return Optional.ofNullable(incoming.pollFirst());
        }
    }

    @Override
    public void update()
    {
        if (!isOpen()) {
            return;
        }

        if (isSendReady()) {
            List<byte[]> batch = drainOutgoing();
            if (!batch.isEmpty()) {
                transmit(batch);
            }
        }

        onUpdate();
    }

    @Override
    public boolean usesInternalThread()
    {
        return pollLoop != null;
    }

    @Override
    public void start()
    {
        if (pollLoop != null) {
            pollLoop.start();
        }
    }

    @Override
    public void close()
    {
        if (pollLoop != null) {
            pollLoop.stop();
        }
        closeTransport();
    }

    public String name()
    {
        return name;
    }

    public int pendingOutgoing()
    {
        synchronized (outgoingLock) {
            return outgoing.size();
        }
    }

    protected final int headerSize()
    {
        return headerSize;
    }

    protected final int lengthOffset()
    {
        return lengthOffset;
    }

    /**
     * Queues one complete received packet for the owner.
     */
    protected final void deliver(byte[] packet)
    {
        synchronized (incomingLock) {
            incoming.addLast(packet);
        }
    }

    private List<byte[]> drainOutgoing()
    {
        synchronized (outgoingLock) {
            int n = Math.min(outgoing.size(), maxOutgoingPerUpdate);
            List<byte[]> batch = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                batch.add(outgoing.pollFirst());
            }
            return batch;
        }
    }

    // ---------------------------------------------------------------------
    // Subclass hooks
    // ---------------------------------------------------------------------

    /** Called when the framing parameters are first set or change. */
    protected void onPacketParameters(int headerSize, int lengthOffset)
    {
    }

    /** @return {@code false} once the channel can no longer carry traffic */
    protected abstract boolean isOpen();

    /** @return {@code true} when no previous batch is still being written */
    protected abstract boolean isSendReady();

    /** Writes one batch, in order, without blocking. */
    protected abstract void transmit(List<byte[]> batch);

    /** Arms the next receive when none is outstanding. */
    protected abstract void onUpdate();

    /** Releases the socket and any I/O threads. */
    protected abstract void closeTransport();
}

package com.questrail.remotephysics.protocol.app.transport;

import java.util.Optional;

/**
 * PacketChannel
 * -----------------------------------------------------------------------------
 * Framework-agnostic port for carrying whole APP packets to and from the
 * remote engine.
 *
 * <p>Implementations do not know the message catalog. A stream-based channel
 * learns how to find message boundaries from
 * {@link #initializePacketParameters(int, int)}; a datagram-based channel
 * treats every datagram as one packet.</p>
 *
 * <h2>Queue discipline</h2>
 * <ul>
 *   <li>{@link #sendPacket(byte[])} only enqueues; it never blocks on I/O.</li>
 *   <li>{@link #update()} writes at most a bounded number of queued packets and
 *       arms the next receive. It is called by the channel's own poll thread
 *       when {@link #usesInternalThread()} is true, otherwise by the owner.</li>
 *   <li>Received packets wait in the incoming queue until polled.</li>
 * </ul>
 */
public interface PacketChannel extends AutoCloseable
{
    /**
     * Supplies the protocol header size and the offset of the 32-bit
     * big-endian total-length field within that header. Must be called before
     * traffic is processed.
     */
    void initializePacketParameters(int headerSize, int lengthOffset);

    /**
     * Queues one packet for sending.
     *
     * @return {@code true} if the packet was queued; {@code false} if the
     *         channel can no longer send (for example after a fatal socket error)
     */
    boolean sendPacket(byte[] packet);

    boolean hasIncomingPacket();

    /**
     * @return the oldest received packet, or empty if none is waiting
     */
    Optional<byte[]> pollIncomingPacket();

    /**
     * Performs one send/receive cycle.
     */
    void update();

    boolean usesInternalThread();

    /**
     * Starts the internal poll thread when configured to use one.
     */
    void start();

    @Override
    void close();
}

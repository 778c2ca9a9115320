package com.questrail.remotephysics.protocol.app.transport.tcp;

import java.util.Arrays;
import java.util.function.Consumer;

/**
 * StreamFrameAssembler
 * -----------------------------------------------------------------------------
 * Rebuilds discrete messages from a TCP byte stream using the total-length
 * field of each message header.
 *
 * <p>Reads arrive at arbitrary boundaries. On each chunk the assembler:</p>
 * <ol>
 *   <li>If a partial message is held in the overflow buffer, tops it off until
 *       its header is complete, reads the declared length, then tops it off
 *       until the whole message is present and emits it</li>
 *   <li>Emits every complete message found in the rest of the chunk, reading
 *       them directly from the chunk</li>
 *   <li>Copies any trailing partial message into the overflow buffer for the
 *       next chunk</li>
 * </ol>
 *
 * <p>Messages are emitted in stream order as freshly allocated arrays. The
 * assembler is not thread-safe; one instance belongs to one connection.</p>
 */
public final class StreamFrameAssembler
{
    private static final int INITIAL_OVERFLOW_CAPACITY = 64 * 1024;

    private final int headerSize;
    private final int lengthOffset;
    private final int maxFrameLength;

    private byte[] overflow;
    private int overflowLength;

    /**
     * @param headerSize     bytes in a message header
     * @param lengthOffset   offset of the 32-bit big-endian total-length field
     * @param maxFrameLength largest acceptable total length
     */
    public StreamFrameAssembler(int headerSize, int lengthOffset, int maxFrameLength)
    {
        if (headerSize <= 0 || lengthOffset < 0 || lengthOffset + 4 > headerSize) {
            throw new IllegalArgumentException(
                    "Invalid framing parameters: headerSize=" + headerSize + " lengthOffset=" + lengthOffset);
        }
        if (maxFrameLength < headerSize) {
            throw new IllegalArgumentException("maxFrameLength " + maxFrameLength + " below header size");
        }
        this.headerSize = headerSize;
        this.lengthOffset = lengthOffset;
        this.maxFrameLength = maxFrameLength;
        this.overflow = new byte[Math.min(INITIAL_OVERFLOW_CAPACITY, maxFrameLength)];
    }

    public void feed(byte[] chunk, Consumer<byte[]> out) throws StreamFramingException
    {
        feed(chunk, 0, chunk.length, out);
    }

    public void feed(byte[] chunk, int offset, int length, Consumer<byte[]> out) throws StreamFramingException
    {
        int pos = offset;
        final int end = offset + length;

        // 1) Complete the carried-over message first.
        if (overflowLength > 0) {
            if (overflowLength < headerSize) {
                pos += appendToOverflow(chunk, pos, Math.min(headerSize - overflowLength, end - pos));
                if (overflowLength < headerSize) {
                    return;
                }
            }

            final int frameLength = declaredLength(overflow, 0);
            pos += appendToOverflow(chunk, pos, Math.min(frameLength - overflowLength, end - pos));
            if (overflowLength < frameLength) {
                return;
            }

            out.accept(Arrays.copyOf(overflow, frameLength));
            overflowLength = 0;
        }

        // 2) Split complete messages straight out of the chunk.
        while (end - pos >= headerSize) {
            final int frameLength = declaredLength(chunk, pos);
            if (end - pos < frameLength) {
                break;
            }
            out.accept(Arrays.copyOfRange(chunk, pos, pos + frameLength));
            pos += frameLength;
        }

        // 3) Keep the tail for the next read.
        if (pos < end) {
            appendToOverflow(chunk, pos, end - pos);
        }
    }

    /**
     * @return bytes of an incomplete message currently held
     */
    public int buffered()
    {
        return overflowLength;
    }

    public void reset()
    {
        overflowLength = 0;
    }

    private int declaredLength(byte[] buf, int messageStart) throws StreamFramingException
    {
        final int p = messageStart + lengthOffset;
        final long length = ((long) (buf[p] & 0xFF) << 24)
                | ((buf[p + 1] & 0xFF) << 16)
                | ((buf[p + 2] & 0xFF) << 8)
                | (buf[p + 3] & 0xFF);

        if (length < headerSize || length > maxFrameLength) {
            throw new StreamFramingException(
                    "Declared message length " + length + " outside [" + headerSize + ", " + maxFrameLength + "]");
        }
        return (int) length;
    }

    private int appendToOverflow(byte[] src, int from, int n)
    {
        if (overflowLength + n > overflow.length) {
            int capacity = Math.max(overflow.length * 2, overflowLength + n);
            overflow = Arrays.copyOf(overflow, Math.min(capacity, maxFrameLength));
        }
        System.arraycopy(src, from, overflow, overflowLength, n);
        overflowLength += n;
        return n;
    }
}

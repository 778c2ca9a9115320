package com.questrail.remotephysics.protocol.app.model;

/**
 * AppHeader
 * -----------------------------------------------------------------------------
 * Fixed 24-byte header that precedes every APP message.
 *
 * <pre>
 *  offset  size  field
 *  0       2     version     (u16)
 *  2       2     msgType     (u16)
 *  4       4     msgIndex    (u32)
 *  8       4     length      (u32, header + body)
 *  12      4     timestamp   (f32)
 *  16      4     reserved    (u32, zero)
 *  20      4     reserved    (u32, zero)
 * </pre>
 *
 * <p>{@link #LENGTH_OFFSET} is the value stream transports must be told so
 * they can frame traffic without knowing the message catalog.</p>
 */
public record AppHeader(
        int version,
        int messageType,
        int messageIndex,
        int length,
        float timestamp
) {
    public static final int PROTOCOL_VERSION = 1;

    public static final int SIZE = 24;

    public static final int LENGTH_OFFSET = 8;

    public AppHeader {
        if (version < 0 || version > 0xFFFF) {
            throw new IllegalArgumentException("version out of u16 range: " + version);
        }
        if (messageType < 0 || messageType > 0xFFFF) {
            throw new IllegalArgumentException("messageType out of u16 range: " + messageType);
        }
    }
}

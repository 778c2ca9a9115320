package com.questrail.remotephysics.protocol.app.codec.impl;

import java.nio.charset.StandardCharsets;

/**
 * AppWireFormat
 * -----------------------------------------------------------------------------
 * Big-endian primitives for the APP wire format.
 *
 * <p>Every integer and float field of every message goes through this class.
 * Byte order is fixed by the shifts below and does not depend on the host;
 * floats are carried as their raw IEEE-754 bit pattern.</p>
 *
 * <p>Unsigned 32-bit fields are carried in Java {@code int}; callers that need
 * the numeric value use {@link Integer#toUnsignedLong(int)}.</p>
 */
public final class AppWireFormat
{
    private AppWireFormat()
    {
    }

    public static void putU16(byte[] buf, int offset, int value)
    {
        buf[offset]     = (byte) (value >>> 8);
        buf[offset + 1] = (byte) value;
    }

    public static int getU16(byte[] buf, int offset)
    {
        return ((buf[offset] & 0xFF) << 8)
                | (buf[offset + 1] & 0xFF);
    }

    public static void putU32(byte[] buf, int offset, int value)
    {
        buf[offset]     = (byte) (value >>> 24);
        buf[offset + 1] = (byte) (value >>> 16);
        buf[offset + 2] = (byte) (value >>> 8);
        buf[offset + 3] = (byte) value;
    }

    public static int getU32(byte[] buf, int offset)
    {
        return ((buf[offset] & 0xFF) << 24)
                | ((buf[offset + 1] & 0xFF) << 16)
                | ((buf[offset + 2] & 0xFF) << 8)
                | (buf[offset + 3] & 0xFF);
    }

    public static void putF32(byte[] buf, int offset, float value)
    {
        putU32(buf, offset, Float.floatToRawIntBits(value));
    }

    public static float getF32(byte[] buf, int offset)
    {
        return Float.intBitsToFloat(getU32(buf, offset));
    }

    /**
     * Writes {@code value} as UTF-8 into a fixed-width field.
     *
     * <p>Text longer than the field is cut at {@code width} bytes, backing off
     * so that no multi-byte character is split. There is no
     * length prefix and no terminator; bytes after the text are left as they
     * are (zero in a freshly allocated buffer).</p>
     *
     * @return number of text bytes written
     */
    public static int putFixedString(byte[] buf, int offset, int width, String value)
    {
        byte[] text = value.getBytes(StandardCharsets.UTF_8);
        int n = Math.min(text.length, width);
        if (n < text.length) {
            // Step back over continuation bytes to the start of the cut character.
            while (n > 0 && (text[n] & 0xC0) == 0x80) {
                n--;
            }
        }
        System.arraycopy(text, 0, buf, offset, n);
        return n;
    }

    /**
     * Reads a fixed-width text field, stopping at the first NUL byte or at
     * the end of the field.
     */
    public static String getFixedString(byte[] buf, int offset, int width)
    {
        int end = offset;
        int limit = offset + width;
        while (end < limit && buf[end] != 0) {
            end++;
        }
        return new String(buf, offset, end - offset, StandardCharsets.UTF_8);
    }
}

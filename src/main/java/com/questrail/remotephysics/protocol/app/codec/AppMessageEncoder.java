package com.questrail.remotephysics.protocol.app.codec;

import com.questrail.remotephysics.protocol.app.model.AppMessage;

/**
 * AppMessageEncoder
 * -----------------------------------------------------------------------------
 * Outbound boundary between a semantic {@link AppMessage} and the bytes handed
 * to a packet channel.
 *
 * <p>The encoder is responsible for:</p>
 * <ul>
 *   <li>Writing the 24-byte header, including a freshly computed length</li>
 *   <li>Writing the type-specific body in big-endian order</li>
 * </ul>
 *
 * <p>The encoder is <strong>not</strong> responsible for choosing the message
 * index or timestamp, nor for deciding which channel carries the result.</p>
 */
public interface AppMessageEncoder
{
    /**
     * Encode one message into a complete packet.
     *
     * @param message      the message body
     * @param messageIndex value of the header {@code msgIndex} field
     * @param timestamp    value of the header {@code timestamp} field
     * @return header and body, exactly {@code length} bytes long
     */
    byte[] encode(AppMessage message, int messageIndex, float timestamp);

    /**
     * @return the encoded size of {@code message}, header included
     */
    int encodedLength(AppMessage message);
}

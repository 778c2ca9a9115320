package com.questrail.remotephysics.protocol.app.codec;

import com.questrail.remotephysics.protocol.app.model.AppEnvelope;

import java.util.Optional;

/**
 * AppMessageDecoder
 * -----------------------------------------------------------------------------
 * Inbound boundary between one framed packet and a semantic message.
 *
 * <p>The input is always exactly one message: a reliable channel has already
 * split the stream on the header length, a best-effort channel delivers one
 * datagram per message.</p>
 *
 * <p>Decoding never throws. Packets with a foreign protocol version, too few
 * bytes, or an unknown type code are dropped and reported.</p>
 */
public interface AppMessageDecoder
{
    /**
     * @param packet raw bytes of one message, header included
     * @return the decoded message, or {@link Optional#empty()} if it was dropped
     */
    Optional<AppEnvelope> decode(byte[] packet);
}

package com.questrail.remotephysics.protocol.app.observability;

import java.time.Instant;

/**
 * An inbound packet that was dropped by the decoder.
 *
 * @param messageType raw type code from the header, or -1 if the header itself was unreadable
 * @param packetLength number of bytes received
 */
public record AppDropEvent(
    Instant timestamp,
    AppDropReason reason,
    int messageType,
    int packetLength,
    String detail
) {
}

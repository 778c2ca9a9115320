package com.questrail.remotephysics.protocol.app.internal.decode;

import com.questrail.remotephysics.protocol.app.observability.AppDropReason;

import java.util.Objects;

/**
 * Indicates that an inbound packet could not be translated into a valid
 * APP message.
 *
 * This typically reflects:
 * <ul>
 *   <li>A protocol version other than the local one</li>
 *   <li>Fewer bytes than the message type requires</li>
 *   <li>An unknown type code</li>
 *   <li>A declared length that disagrees with the received bytes</li>
 * </ul>
 *
 * <p>The exception never crosses the decoder boundary: the decoder catches it,
 * reports the drop and returns an empty result.</p>
 */
public final class AppDecodeException extends RuntimeException
{
    private final AppDropReason reason;

    public AppDecodeException(AppDropReason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public AppDecodeException(AppDropReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public AppDropReason reason() {
        return reason;
    }
}

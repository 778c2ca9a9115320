package com.questrail.remotephysics.protocol.app.observability;

/**
 * Why an inbound packet was discarded without being dispatched.
 */
public enum AppDropReason
{
    /** Header version differs from the local protocol version. */
    VERSION_MISMATCH,

    /** Fewer bytes than the message type (or its element counts) requires. */
    INSUFFICIENT_DATA,

    /** Type code is not part of the catalog. */
    UNKNOWN_TYPE,

    /** Structurally inconsistent content, e.g. a declared length that disagrees with the body. */
    MALFORMED
}

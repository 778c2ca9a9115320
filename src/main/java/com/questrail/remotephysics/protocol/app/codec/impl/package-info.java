/**
 * APP Codec Implementation
 * =============================================================================
 *
 * <pre>
 *   AppMessage
 *        → DefaultAppMessageEncoder (exact length computed, header + body written)
 *        → byte[]
 *
 *   byte[]
 *        → DefaultAppMessageDecoder (version, type, size checks, body parse)
 *        → AppEnvelope
 * </pre>
 *
 * <p>All integers and floats are big-endian through {@link
 * com.questrail.remotephysics.protocol.app.codec.impl.AppWireFormat}.</p>
 *
 * <p>Any failure while decoding results in the packet being dropped.</p>
 */
package com.questrail.remotephysics.protocol.app.codec.impl;

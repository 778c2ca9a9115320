/**
 * APP Codec Ports
 * =============================================================================
 *
 * <p>This package defines the <strong>codec boundary</strong> of the APP
 * protocol: the translation between semantic messages and the packets that
 * packet channels carry.</p>
 *
 * <h2>Architectural Placement</h2>
 * <p>The codec sits <strong>below</strong> the messenger and
 * <strong>above</strong> the packet channels:</p>
 *
 * <pre>
 *   byte[] packet (one whole message)
 *        → AppMessageDecoder   (version, size and layout rules applied here)
 *            → AppEnvelope     (header + semantic AppMessage)
 *                → AppMessenger dispatch
 *                    → listeners
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>The codec performs no I/O and holds no per-connection state.</li>
 *   <li>Stream reassembly is a transport concern; the decoder is always given
 *       exactly one message.</li>
 *   <li>All byte-level mechanics live exclusively in {@code codec.impl}.</li>
 * </ul>
 */
package com.questrail.remotephysics.protocol.app.codec;

/**
 * APP Transport Ports
 * =============================================================================
 *
 * These types define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty TCP, Netty UDP, or a
 * test double) and the {@code AppMessenger}.
 *
 * <h2>Why these ports exist</h2>
 * Netty carries all production I/O <strong>without</strong> its types leaking
 * into the messenger or the codec. Everything above the transport adapter sees
 * only:
 * <ul>
 *   <li>Whole packets as {@code byte[]}</li>
 *   <li>Send acceptance as a {@code boolean}</li>
 *   <li>Explicit update cycles</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O and packet framing only</li>
 *   <li>Not decode messages or interpret type codes</li>
 *   <li>Not reconnect or retry on their own</li>
 * </ul>
 */
package com.questrail.remotephysics.protocol.app.transport;

/**
 * Media Remote Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between a concrete networking implementation
 * (Netty TCP, a simulator, a test double) and the peer sessions.
 *
 * <p>Above this boundary only whole messages as {@code byte[]}, peer ids and
 * lifecycle notifications are visible. Netty types stay inside
 * {@code transport.tcp.netty}.</p>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Endpoint implementations MUST:
 * <ul>
 *   <li>Perform framing and I/O only</li>
 *   <li>Not decode envelopes or payloads</li>
 *   <li>Not reassemble transactions or run timers</li>
 * </ul>
 */
package com.questrail.mediaremote.protocol.transport;

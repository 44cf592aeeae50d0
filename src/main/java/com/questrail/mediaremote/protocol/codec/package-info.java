/**
 * Media Remote Codec
 * =============================================================================
 *
 * <p>Wraps typed payloads in tagged envelopes and unwraps them again.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] message (deframed by the transport)
 *        → EnvelopeWireFormat     (header fields and extension payload)
 *            → Envelope           (tag + payload bytes)
 *                → EnvelopeCodec  (catalog lookup)
 *                    → DecodedMessage.Typed | DecodedMessage.Opaque
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>An unregistered tag is never an error on the way in; it becomes
 *       {@link com.questrail.mediaremote.protocol.codec.DecodedMessage.Opaque}.</li>
 *   <li>Every shape violation surfaces as
 *       {@link com.questrail.mediaremote.protocol.codec.MalformedPayloadException}
 *       and rejects that one message only.</li>
 *   <li>Nothing in this package holds per-connection state.</li>
 * </ul>
 */
package com.questrail.mediaremote.protocol.codec;

package com.questrail.mediaremote.protocol.model;

/**
 * Typed content of a media remote envelope.
 *
 * <h2>Purpose</h2>
 * <p>
 * A {@code ProtocolPayload} is the decoded, semantically meaningful body of one
 * envelope. Session logic, routing and application callbacks reason about
 * payloads only; tags, field numbers and length prefixes are resolved below
 * this layer by the catalog and the envelope codec.
 * </p>
 *
 * <h2>Open catalog</h2>
 * <p>
 * Unlike a closed message taxonomy, the set of payload kinds is open: the
 * surrounding application registers its own payload types in the
 * {@code MessageCatalog} at startup. This interface is therefore
 * not sealed. Payloads whose tag is not registered never reach this type;
 * they surface as opaque bytes instead.
 * </p>
 *
 * <p>
 * Implementations must be immutable and must implement structural equality,
 * since callers compare decoded payloads against the ones they encoded.
 * </p>
 */
public interface ProtocolPayload
{
}

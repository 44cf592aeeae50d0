package com.questrail.mediaremote.protocol.codec;

/**
 * Serialized form of an {@link Envelope}.
 *
 * <p>Implementations are pure and thread-safe. Framing of consecutive
 * envelopes on a stream belongs to the transport, not to this interface.</p>
 */
public interface EnvelopeWireFormat
{
    byte[] encode(Envelope envelope);

    /**
     * @throws MalformedPayloadException if the bytes are not a well formed envelope
     */
    Envelope decode(byte[] bytes);
}

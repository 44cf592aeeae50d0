package com.questrail.mediaremote.protocol.catalog;

import com.questrail.mediaremote.protocol.model.ProtocolPayload;

import java.util.Objects;

/**
 * One row of the message catalog: a tag, the payload type registered for it
 * and the decode/encode function pair.
 *
 * @param tag     numeric extension tag
 * @param type    payload type produced by the decoder and accepted by the encoder
 * @param decoder bytes to payload
 * @param encoder payload to bytes
 */
public record CatalogEntry<T extends ProtocolPayload>(
        int tag,
        Class<T> type,
        PayloadDecoder<T> decoder,
        PayloadEncoder<T> encoder
) {
    public CatalogEntry {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(decoder, "decoder");
        Objects.requireNonNull(encoder, "encoder");
    }

    public T decode(byte[] bytes) {
        return decoder.decode(bytes);
    }

    /**
     * Encodes a payload after checking it is an instance of the registered type.
     *
     * @throws IllegalArgumentException if the payload has a different type
     */
    public byte[] encode(ProtocolPayload payload) {
        if (!type.isInstance(payload)) {
            throw new IllegalArgumentException(
                    "Tag " + tag + " expects " + type.getSimpleName()
                            + " but got " + payload.getClass().getSimpleName());
        }
        byte[] bytes = encoder.encode(type.cast(payload));
        return (bytes == null) ? new byte[0] : bytes;
    }
}

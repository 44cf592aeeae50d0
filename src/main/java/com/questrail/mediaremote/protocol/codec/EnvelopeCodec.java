package com.questrail.mediaremote.protocol.codec;

import com.questrail.mediaremote.protocol.catalog.CatalogEntry;
import com.questrail.mediaremote.protocol.catalog.MessageCatalog;
import com.questrail.mediaremote.protocol.model.ProtocolPayload;

import java.util.Objects;
import java.util.Optional;

/**
 * EnvelopeCodec
 * =============================================================================
 * Wraps a typed payload in an {@link Envelope} and unwraps it again, using the
 * {@link MessageCatalog} to resolve tag to decoder and payload type to tag.
 *
 * <h2>Unknown tags</h2>
 * Decoding an unregistered tag is not an error: the bytes come back as
 * {@link DecodedMessage.Opaque}. Only the strict {@code encode} methods raise
 * {@link UnknownTagException}; {@link #encodeOpaque(int, byte[])} is the
 * explicit pass-through.
 *
 * <h2>Failures</h2>
 * A registered decoder that throws anything other than
 * {@link MalformedPayloadException} has its exception wrapped as the cause of
 * one, so callers deal with a single rejection type per message.
 *
 * <h2>Thread Safety</h2>
 * Stateless apart from the immutable catalog; safe to share.
 */
public final class EnvelopeCodec
{
    private final MessageCatalog catalog;

    public EnvelopeCodec(MessageCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public MessageCatalog catalog() {
        return catalog;
    }

    /**
     * Encodes {@code payload} under an explicit tag.
     *
     * @throws UnknownTagException if the tag is not registered, or is registered
     *         for a different payload type
     */
    public Envelope encode(int tag, ProtocolPayload payload) {
        Objects.requireNonNull(payload, "payload");

        CatalogEntry<?> entry = catalog.lookup(tag)
                .orElseThrow(() -> new UnknownTagException(tag));

        if (!entry.type().isInstance(payload)) {
            throw new UnknownTagException(
                    "Tag " + tag + " is registered for " + entry.type().getSimpleName()
                            + ", not " + payload.getClass().getSimpleName());
        }
        return Envelope.of(tag, entry.encode(payload));
    }

    /**
     * Encodes {@code payload} under the tag registered for its runtime type.
     *
     * @throws UnknownTagException if the payload type is not registered
     */
    public Envelope encode(ProtocolPayload payload) {
        Objects.requireNonNull(payload, "payload");

        CatalogEntry<?> entry = catalog.lookup(payload.getClass())
                .orElseThrow(() -> new UnknownTagException(
                        "No catalog entry registered for " + payload.getClass().getSimpleName()));

        return Envelope.of(entry.tag(), entry.encode(payload));
    }

    /**
     * Wraps already-serialized bytes without consulting the catalog.
     *
     * @throws IllegalArgumentException if the tag is outside
     *         [{@link MessageCatalog#MIN_TAG}, {@link MessageCatalog#MAX_TAG}]
     */
    public Envelope encodeOpaque(int tag, byte[] bytes) {
        MessageCatalog.checkTag(tag);
        return Envelope.of(tag, Objects.requireNonNull(bytes, "bytes"));
    }

    /**
     * @throws MalformedPayloadException if a registered decoder rejects the bytes
     */
    public DecodedMessage decode(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");

        int tag = envelope.tag();
        String identifier = envelope.identifier().orElse(null);
        Integer errorCode = envelope.errorCode().isPresent() ? envelope.errorCode().getAsInt() : null;
        Optional<CatalogEntry<?>> entry = catalog.lookup(tag);

        if (entry.isEmpty()) {
            return new DecodedMessage.Opaque(tag, identifier, errorCode, envelope.payload());
        }

        ProtocolPayload payload;
        try {
            payload = entry.get().decode(envelope.payload());
        } catch (MalformedPayloadException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MalformedPayloadException(
                    "Decoder for tag " + tag + " failed: " + e.getMessage(), e);
        }

        if (payload == null) {
            throw new MalformedPayloadException("Decoder for tag " + tag + " returned no payload");
        }
        return new DecodedMessage.Typed(tag, identifier, errorCode, payload);
    }
}

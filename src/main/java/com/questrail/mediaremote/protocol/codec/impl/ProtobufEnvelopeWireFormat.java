package com.questrail.mediaremote.protocol.codec.impl;

import com.google.protobuf.WireFormat;
import com.questrail.mediaremote.protocol.catalog.MessageCatalog;
import com.questrail.mediaremote.protocol.codec.Envelope;
import com.questrail.mediaremote.protocol.codec.EnvelopeWireFormat;
import com.questrail.mediaremote.protocol.codec.MalformedPayloadException;

import java.io.ByteArrayOutputStream;
import java.util.HashMap;
import java.util.Map;

/**
 * ProtobufEnvelopeWireFormat
 * =============================================================================
 * Envelope encoding as a protobuf message with extension fields.
 *
 * <pre>
 *   1   type        varint, required (the payload tag)
 *   2   identifier  string, optional
 *   4   errorCode   varint, optional
 *   tag payload     length-delimited, field number equal to the type
 * </pre>
 *
 * <h2>Decoding rules</h2>
 * <ul>
 *   <li>A missing type field is malformed.</li>
 *   <li>A type below {@link MessageCatalog#MIN_TAG} is malformed; those
 *       field numbers are the header.</li>
 *   <li>A type above {@link MessageCatalog#MAX_TAG} is malformed.</li>
 *   <li>An absent payload field decodes as an empty payload.</li>
 *   <li>Repeated payload fields are concatenated (protobuf merge).</li>
 *   <li>Every other field is skipped.</li>
 * </ul>
 *
 * Length-delimited fields are buffered by number while scanning because the
 * type field is not guaranteed to precede the payload on the wire.
 */
public final class ProtobufEnvelopeWireFormat implements EnvelopeWireFormat
{
    static final int TYPE = 1;
    static final int IDENTIFIER = 2;
    static final int ERROR_CODE = 4;

    @Override
    public byte[] encode(Envelope envelope) {
        int tag = envelope.tag();
        if (tag < MessageCatalog.MIN_TAG) {
            throw new IllegalArgumentException(
                    "Envelope tag " + tag + " collides with header field numbers");
        }
        if (tag > MessageCatalog.MAX_TAG) {
            throw new IllegalArgumentException(
                    "Envelope tag " + tag + " exceeds the largest field number " + MessageCatalog.MAX_TAG);
        }

        return ProtobufFields.write(out -> {
            out.writeUInt32(TYPE, tag);
            if (envelope.identifier().isPresent()) {
                out.writeString(IDENTIFIER, envelope.identifier().get());
            }
            if (envelope.errorCode().isPresent()) {
                out.writeUInt32(ERROR_CODE, envelope.errorCode().getAsInt());
            }
            out.writeByteArray(tag, envelope.payload());
        });
    }

    @Override
    public Envelope decode(byte[] bytes) {
        Header header = new Header();
        Map<Integer, ByteArrayOutputStream> delimited = new HashMap<>();

        ProtobufFields.readFields(bytes, "envelope", (field, wireType, in) -> {
            switch (field) {
                case TYPE -> {
                    ProtobufFields.requireVarint(field, wireType, "envelope");
                    header.type = in.readUInt32();
                    header.hasType = true;
                }
                case IDENTIFIER -> {
                    ProtobufFields.requireLengthDelimited(field, wireType, "envelope");
                    header.identifier = in.readString();
                }
                case ERROR_CODE -> {
                    ProtobufFields.requireVarint(field, wireType, "envelope");
                    header.errorCode = in.readUInt32();
                }
                default -> {
                    if (field < MessageCatalog.MIN_TAG
                            || wireType != WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                        return false;
                    }
                    delimited.computeIfAbsent(field, f -> new ByteArrayOutputStream())
                             .writeBytes(in.readByteArray());
                }
            }
            return true;
        });

        if (!header.hasType) {
            throw new MalformedPayloadException("Envelope is missing its type field");
        }
        if (header.type < MessageCatalog.MIN_TAG) {
            throw new MalformedPayloadException(
                    "Envelope type " + Integer.toUnsignedString(header.type)
                            + " collides with header field numbers");
        }
        if (header.type > MessageCatalog.MAX_TAG) {
            throw new MalformedPayloadException(
                    "Envelope type " + header.type + " exceeds the largest field number");
        }

        ByteArrayOutputStream payload = delimited.get(header.type);
        return Envelope.of(
                header.type,
                header.identifier,
                header.errorCode,
                (payload == null) ? new byte[0] : payload.toByteArray());
    }

    private static final class Header {
        int type;
        boolean hasType;
        String identifier;
        Integer errorCode;
    }
}

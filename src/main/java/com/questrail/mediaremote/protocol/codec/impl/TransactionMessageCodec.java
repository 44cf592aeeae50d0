package com.questrail.mediaremote.protocol.codec.impl;

import com.questrail.mediaremote.protocol.catalog.PayloadDecoder;
import com.questrail.mediaremote.protocol.catalog.PayloadEncoder;
import com.questrail.mediaremote.protocol.codec.MalformedPayloadException;
import com.questrail.mediaremote.protocol.model.TransactionKey;
import com.questrail.mediaremote.protocol.model.TransactionMessage;
import com.questrail.mediaremote.protocol.model.TransactionPacket;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * TransactionMessageCodec
 * -----------------------------------------------------------------------------
 * Codec for the transaction carrier message.
 *
 * <pre>
 * TransactionMessage
 *   1 name               uint64, optional
 *   2 packets            TransactionPackets
 *
 * TransactionPackets
 *   1 packets            repeated TransactionPacket
 *
 * TransactionPacket
 *   1 key                TransactionKey (required)
 *   2 packetData         bytes
 *   3 identifier         string, optional
 *   4 totalLength        uint64
 *   5 totalWritePosition uint64
 *
 * TransactionKey
 *   1 identifier         string
 *   2 userData           bytes
 * </pre>
 *
 * <p>Repeated occurrences of the packets container are concatenated, which
 * matches protobuf merge semantics for embedded messages.</p>
 */
public final class TransactionMessageCodec
        implements PayloadDecoder<TransactionMessage>,
                   PayloadEncoder<TransactionMessage> {

    private static final String NAME = "TransactionMessage";

    @Override
    public TransactionMessage decode(byte[] bytes) {
        List<TransactionPacket> packets = new ArrayList<>();
        long[] name = new long[1];
        boolean[] hasName = new boolean[1];

        ProtobufFields.readFields(bytes, NAME, (field, wireType, in) -> {
            switch (field) {
                case 1 -> {
                    ProtobufFields.requireVarint(field, wireType, NAME);
                    name[0] = in.readUInt64();
                    hasName[0] = true;
                }
                case 2 -> {
                    ProtobufFields.requireLengthDelimited(field, wireType, NAME);
                    readPackets(in.readByteArray(), packets);
                }
                default -> {
                    return false;
                }
            }
            return true;
        });

        return new TransactionMessage(
                hasName[0] ? OptionalLong.of(name[0]) : OptionalLong.empty(),
                packets);
    }

    private static void readPackets(byte[] bytes, List<TransactionPacket> sink) {
        ProtobufFields.readFields(bytes, "TransactionPackets", (field, wireType, in) -> {
            if (field != 1) {
                return false;
            }
            ProtobufFields.requireLengthDelimited(field, wireType, "TransactionPackets");
            sink.add(readPacket(in.readByteArray()));
            return true;
        });
    }

    private static TransactionPacket readPacket(byte[] bytes) {
        PacketFields p = new PacketFields();

        ProtobufFields.readFields(bytes, "TransactionPacket", (field, wireType, in) -> {
            switch (field) {
                case 1 -> {
                    ProtobufFields.requireLengthDelimited(field, wireType, "TransactionPacket");
                    p.key = readKey(in.readByteArray());
                }
                case 2 -> {
                    ProtobufFields.requireLengthDelimited(field, wireType, "TransactionPacket");
                    p.data = in.readByteArray();
                }
                case 3 -> {
                    ProtobufFields.requireLengthDelimited(field, wireType, "TransactionPacket");
                    p.identifier = in.readString();
                }
                case 4 -> {
                    ProtobufFields.requireVarint(field, wireType, "TransactionPacket");
                    p.totalLength = in.readUInt64();
                }
                case 5 -> {
                    ProtobufFields.requireVarint(field, wireType, "TransactionPacket");
                    p.totalWritePosition = in.readUInt64();
                }
                default -> {
                    return false;
                }
            }
            return true;
        });

        if (p.key == null) {
            throw new MalformedPayloadException("TransactionPacket is missing its key");
        }
        return new TransactionPacket(p.key, p.data, p.identifier, p.totalLength, p.totalWritePosition);
    }

    private static TransactionKey readKey(byte[] bytes) {
        String[] identifier = {""};
        byte[][] userData = {new byte[0]};

        ProtobufFields.readFields(bytes, "TransactionKey", (field, wireType, in) -> {
            switch (field) {
                case 1 -> {
                    ProtobufFields.requireLengthDelimited(field, wireType, "TransactionKey");
                    identifier[0] = in.readString();
                }
                case 2 -> {
                    ProtobufFields.requireLengthDelimited(field, wireType, "TransactionKey");
                    userData[0] = in.readByteArray();
                }
                default -> {
                    return false;
                }
            }
            return true;
        });

        return TransactionKey.of(identifier[0], userData[0]);
    }

    @Override
    public byte[] encode(TransactionMessage payload) {
        byte[] packets = ProtobufFields.write(out -> {
            for (TransactionPacket packet : payload.packets()) {
                out.writeByteArray(1, encodePacket(packet));
            }
        });

        return ProtobufFields.write(out -> {
            if (payload.name().isPresent()) {
                out.writeUInt64(1, payload.name().getAsLong());
            }
            out.writeByteArray(2, packets);
        });
    }

    private static byte[] encodePacket(TransactionPacket packet) {
        byte[] key = ProtobufFields.write(out -> {
            out.writeString(1, packet.key().identifier());
            out.writeByteArray(2, packet.key().userData());
        });

        return ProtobufFields.write(out -> {
            out.writeByteArray(1, key);
            out.writeByteArray(2, packet.packetData());
            if (packet.identifier().isPresent()) {
                out.writeString(3, packet.identifier().get());
            }
            out.writeUInt64(4, packet.totalLength());
            out.writeUInt64(5, packet.totalWritePosition());
        });
    }

    private static final class PacketFields {
        TransactionKey key;
        byte[] data = new byte[0];
        String identifier;
        long totalLength;
        long totalWritePosition;
    }
}

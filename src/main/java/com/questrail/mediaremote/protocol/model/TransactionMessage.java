package com.questrail.mediaremote.protocol.model;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Transaction message.
 *
 * <p>
 * Carrier for one or more {@link TransactionPacket}s. The message itself is
 * never delivered to the application: its packets are fed to the transaction
 * reassembler and the reassembled blob is decoded as an envelope of its own.
 * </p>
 *
 * @param name    optional transaction name (a numeric kind chosen by the sender)
 * @param packets packets in the order they were sent
 */
public record TransactionMessage(
        OptionalLong name,
        List<TransactionPacket> packets
) implements ProtocolPayload
{
    public TransactionMessage {
        Objects.requireNonNull(name, "name");
        packets = List.copyOf(Objects.requireNonNull(packets, "packets"));
    }

    public static TransactionMessage of(List<TransactionPacket> packets) {
        return new TransactionMessage(OptionalLong.empty(), packets);
    }
}

package com.questrail.mediaremote.protocol.model;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * One fragment of a chunked transfer as it travels inside a
 * {@link TransactionMessage}.
 *
 * <p>
 * {@code totalLength} is the size of the whole reassembled blob and
 * {@code totalWritePosition} is the offset at which {@code packetData} must
 * be written. Both are unsigned 64-bit values on the wire and are kept as
 * {@code long} here; range validation belongs to the reassembler.
 * </p>
 */
public final class TransactionPacket
{
    private final TransactionKey key;
    private final byte[] packetData;
    private final String identifier;
    private final long totalLength;
    private final long totalWritePosition;

    /**
     * @param key                transaction key (required)
     * @param packetData         fragment bytes
     * @param identifier         optional packet identifier, may be {@code null}
     * @param totalLength        declared size of the reassembled blob
     * @param totalWritePosition offset of {@code packetData} in the blob
     */
    public TransactionPacket(TransactionKey key,
                             byte[] packetData,
                             String identifier,
                             long totalLength,
                             long totalWritePosition) {
        this.key = Objects.requireNonNull(key, "key");
        this.packetData = (packetData == null) ? new byte[0] : packetData.clone();
        this.identifier = identifier;
        this.totalLength = totalLength;
        this.totalWritePosition = totalWritePosition;
    }

    public TransactionKey key() {
        return key;
    }

    public byte[] packetData() {
        return packetData.clone();
    }

    public int packetLength() {
        return packetData.length;
    }

    public Optional<String> identifier() {
        return Optional.ofNullable(identifier);
    }

    public long totalLength() {
        return totalLength;
    }

    public long totalWritePosition() {
        return totalWritePosition;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransactionPacket that)) return false;
        return totalLength == that.totalLength
                && totalWritePosition == that.totalWritePosition
                && key.equals(that.key)
                && Arrays.equals(packetData, that.packetData)
                && Objects.equals(identifier, that.identifier);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(key, identifier, totalLength, totalWritePosition);
        return 31 * result + Arrays.hashCode(packetData);
    }

    @Override
    public String toString() {
        return "TransactionPacket[" +
                "key=" + key +
                ", length=" + packetData.length +
                ", totalLength=" + totalLength +
                ", writePosition=" + totalWritePosition +
                ']';
    }
}

package com.questrail.mediaremote.protocol.internal.reassembly;

import com.questrail.mediaremote.protocol.model.TransactionKey;
import com.questrail.mediaremote.protocol.model.TransactionPacket;

import java.util.Arrays;
import java.util.Objects;

/**
 * One positional piece of a transaction, as seen by the reassembler.
 *
 * <p>
 * {@code declaredTotalLength} and {@code writePosition} are unsigned 64-bit
 * values on the wire. Values above {@link Long#MAX_VALUE} arrive here as
 * negative numbers and are rejected by the reassembler as out of bounds.
 * </p>
 */
public final class TransactionFragment
{
    private final TransactionKey key;
    private final byte[] bytes;
    private final long declaredTotalLength;
    private final long writePosition;

    public TransactionFragment(TransactionKey key,
                               byte[] bytes,
                               long declaredTotalLength,
                               long writePosition) {
        this.key = Objects.requireNonNull(key, "key");
        this.bytes = Objects.requireNonNull(bytes, "bytes").clone();
        this.declaredTotalLength = declaredTotalLength;
        this.writePosition = writePosition;
    }

    public static TransactionFragment fromPacket(TransactionPacket packet) {
        Objects.requireNonNull(packet, "packet");
        return new TransactionFragment(
                packet.key(),
                packet.packetData(),
                packet.totalLength(),
                packet.totalWritePosition());
    }

    public TransactionPacket toPacket() {
        return new TransactionPacket(key, bytes, null, declaredTotalLength, writePosition);
    }

    public TransactionKey key() {
        return key;
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    /** Package access without a copy; callers must not modify the array. */
    byte[] rawBytes() {
        return bytes;
    }

    public int length() {
        return bytes.length;
    }

    public long declaredTotalLength() {
        return declaredTotalLength;
    }

    public long writePosition() {
        return writePosition;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransactionFragment that)) return false;
        return declaredTotalLength == that.declaredTotalLength
                && writePosition == that.writePosition
                && key.equals(that.key)
                && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(key, declaredTotalLength, writePosition) + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "TransactionFragment[" + key
                + ", offset=" + writePosition
                + ", length=" + bytes.length
                + ", total=" + declaredTotalLength + "]";
    }
}

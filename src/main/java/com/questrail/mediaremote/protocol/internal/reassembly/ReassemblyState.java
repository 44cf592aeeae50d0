package com.questrail.mediaremote.protocol.internal.reassembly;

import java.util.BitSet;

/**
 * Accumulation buffer for one transaction. Owned by
 * {@link TransactionReassembler} and only touched under its lock.
 *
 * <p>
 * {@code filled} marks every offset written so far, so duplicate and
 * overlapping fragments can be checked byte for byte and the gap-free prefix
 * is {@code filled.nextClearBit(0)}.
 * </p>
 */
final class ReassemblyState
{
    private final int declaredTotalLength;
    private final byte[] buffer;
    private final BitSet filled;
    private long lastActivityNanos;

    ReassemblyState(int declaredTotalLength, long nowNanos) {
        this.declaredTotalLength = declaredTotalLength;
        this.buffer = new byte[declaredTotalLength];
        this.filled = new BitSet(declaredTotalLength);
        this.lastActivityNanos = nowNanos;
    }

    int declaredTotalLength() {
        return declaredTotalLength;
    }

    /**
     * Returns the first offset in {@code [offset, offset + bytes.length)} whose
     * existing byte differs from {@code bytes}, or {@code -1} if every filled
     * offset in the range agrees.
     */
    int firstConflict(int offset, byte[] bytes) {
        int end = offset + bytes.length;
        for (int i = filled.nextSetBit(offset); i >= 0 && i < end; i = filled.nextSetBit(i + 1)) {
            if (buffer[i] != bytes[i - offset]) {
                return i;
            }
        }
        return -1;
    }

    void write(int offset, byte[] bytes, long nowNanos) {
        System.arraycopy(bytes, 0, buffer, offset, bytes.length);
        filled.set(offset, offset + bytes.length);
        lastActivityNanos = nowNanos;
    }

    int contiguousBytes() {
        return filled.nextClearBit(0);
    }

    boolean isComplete() {
        return contiguousBytes() >= declaredTotalLength;
    }

    /**
     * Hands the buffer over to the caller. Only valid once complete.
     */
    byte[] buffer() {
        return buffer;
    }

    int retainedBytes() {
        return buffer.length;
    }

    long lastActivityNanos() {
        return lastActivityNanos;
    }
}

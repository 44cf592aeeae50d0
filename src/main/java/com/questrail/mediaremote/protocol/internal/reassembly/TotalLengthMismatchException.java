package com.questrail.mediaremote.protocol.internal.reassembly;

import com.questrail.mediaremote.protocol.model.TransactionKey;

public final class TotalLengthMismatchException extends TransactionAbortedException
{
    private final long expected;
    private final long actual;

    public TotalLengthMismatchException(TransactionKey key, long expected, long actual) {
        super(key, AbortReason.TOTAL_LENGTH_MISMATCH,
                "Transaction " + key + " declared total length " + actual
                        + " after " + expected);
        this.expected = expected;
        this.actual = actual;
    }

    public long expected() {
        return expected;
    }

    public long actual() {
        return actual;
    }
}

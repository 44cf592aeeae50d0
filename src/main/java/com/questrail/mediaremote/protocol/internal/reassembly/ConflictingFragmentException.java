package com.questrail.mediaremote.protocol.internal.reassembly;

import com.questrail.mediaremote.protocol.model.TransactionKey;

/**
 * An overlapping fragment disagreed with bytes already written.
 */
public final class ConflictingFragmentException extends TransactionAbortedException
{
    private final long offset;

    public ConflictingFragmentException(TransactionKey key, long offset) {
        super(key, AbortReason.CONFLICTING_FRAGMENT,
                "Transaction " + key + " received conflicting bytes at offset " + offset);
        this.offset = offset;
    }

    /**
     * @return first offset at which the fragment disagreed with the buffer
     */
    public long offset() {
        return offset;
    }
}

package com.questrail.mediaremote.protocol.internal.reassembly;

import com.questrail.mediaremote.protocol.model.TransactionKey;

public final class FragmentOutOfBoundsException extends TransactionAbortedException
{
    public FragmentOutOfBoundsException(TransactionKey key, String message) {
        super(key, AbortReason.FRAGMENT_OUT_OF_BOUNDS, "Transaction " + key + ": " + message);
    }
}

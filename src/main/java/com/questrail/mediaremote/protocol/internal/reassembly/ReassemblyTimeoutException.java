package com.questrail.mediaremote.protocol.internal.reassembly;

import com.questrail.mediaremote.protocol.model.TransactionKey;

import java.time.Duration;

/**
 * Fails the completion future of a transaction evicted by TTL expiry.
 */
public final class ReassemblyTimeoutException extends TransactionAbortedException
{
    public ReassemblyTimeoutException(TransactionKey key, Duration ttl) {
        super(key, AbortReason.TIMEOUT,
                "Transaction " + key + " saw no fragment for longer than " + ttl);
    }
}

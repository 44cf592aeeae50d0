package com.questrail.mediaremote.protocol.internal.reassembly;

import com.questrail.mediaremote.protocol.MediaRemoteProtocolException;
import com.questrail.mediaremote.protocol.model.TransactionKey;

import java.util.Objects;

/**
 * A transaction was discarded before it completed.
 *
 * <p>
 * By the time this exception is thrown (or used to fail a completion future)
 * the transaction's state has already been removed and its buffer released.
 * Only the transaction is affected; the connection carries on.
 * </p>
 */
public class TransactionAbortedException extends MediaRemoteProtocolException
{
    private final TransactionKey key;
    private final AbortReason reason;

    public TransactionAbortedException(TransactionKey key, AbortReason reason, String message) {
        super(message);
        this.key = Objects.requireNonNull(key, "key");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public TransactionKey key() {
        return key;
    }

    public AbortReason reason() {
        return reason;
    }
}

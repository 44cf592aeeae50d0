package com.questrail.mediaremote.protocol.observability;

import com.questrail.mediaremote.protocol.internal.reassembly.AbortReason;
import com.questrail.mediaremote.protocol.model.TransactionKey;
import com.questrail.mediaremote.protocol.session.PeerId;

import java.time.Instant;

/**
 * Record of a discarded transaction. Its buffer has already been released.
 */
public record TransactionAbortedEvent(
    Instant timestamp,
    PeerId peer,
    TransactionKey key,
    AbortReason reason,
    String detail
) {
}

package com.questrail.mediaremote.protocol.observability;

import com.questrail.mediaremote.protocol.model.TransactionKey;
import com.questrail.mediaremote.protocol.session.PeerId;

import java.time.Instant;

public record TransactionCompletedEvent(
    Instant timestamp,
    PeerId peer,
    TransactionKey key,
    int length
) {
}

package com.questrail.mediaremote.protocol.observability;

import com.questrail.mediaremote.protocol.internal.interest.UpdateInterestSet;
import com.questrail.mediaremote.protocol.session.PeerId;

import java.time.Instant;

public record InterestChangedEvent(
    Instant timestamp,
    PeerId peer,
    UpdateInterestSet previous,
    UpdateInterestSet current
) {
}

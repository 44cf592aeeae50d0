package com.questrail.mediaremote.protocol.observability;

import com.questrail.mediaremote.protocol.internal.devices.NegotiationResult;
import com.questrail.mediaremote.protocol.session.PeerId;

import java.time.Instant;

public record DeviceSetChangedEvent(
    Instant timestamp,
    PeerId peer,
    NegotiationResult result
) {
}

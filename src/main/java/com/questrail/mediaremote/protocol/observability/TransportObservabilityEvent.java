package com.questrail.mediaremote.protocol.observability;

import com.questrail.mediaremote.protocol.session.PeerId;

import java.time.Instant;

/**
 * Transport lifecycle record.
 *
 * @param peer the peer concerned, or {@code null} for endpoint-wide events
 */
public record TransportObservabilityEvent(
    Instant timestamp,
    Kind kind,
    PeerId peer,
    String detail
) {
    public enum Kind {
        ENDPOINT_STARTED,
        ENDPOINT_STOPPED,
        PEER_CONNECTED,
        PEER_DISCONNECTED
    }
}

package com.questrail.mediaremote.protocol.observability;

import com.questrail.mediaremote.protocol.session.PeerId;

import java.time.Instant;
import java.util.OptionalInt;

/**
 * Record of an inbound message that could not be decoded.
 *
 * @param tag   tag of the rejected envelope, empty if the envelope itself was unreadable
 * @param cause the decode failure
 */
public record MessageRejectedEvent(
    Instant timestamp,
    PeerId peer,
    OptionalInt tag,
    String reason,
    Throwable cause
) {
}

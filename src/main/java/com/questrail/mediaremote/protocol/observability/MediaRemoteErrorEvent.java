package com.questrail.mediaremote.protocol.observability;

import java.time.Instant;

/**
 * Record representing an unexpected failure in the protocol stack.
 */
public record MediaRemoteErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}

package com.questrail.mediaremote.protocol.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for event timestamps.
 *
 * <p>
 * May jump with NTP or manual adjustment, so it MUST NOT drive reassembly
 * expiry.
 * </p>
 */
public interface WallClock
{
    Instant now();
}

package com.questrail.mediaremote.protocol.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for reassembly bookkeeping.
 *
 * <h2>Binding invariant</h2>
 * Transaction TTLs and expiry sweeps MUST be measured on a monotonic time
 * source. Wall-clock time is permitted only for timestamps on observability
 * events.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick value in nanoseconds. Values
     * are only meaningful relative to each other.
     */
    long nowNanos();
}

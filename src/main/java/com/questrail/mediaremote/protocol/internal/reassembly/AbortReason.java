package com.questrail.mediaremote.protocol.internal.reassembly;

/**
 * Why an accumulating transaction was discarded.
 */
public enum AbortReason
{
    /** A fragment declared a different total length than the first one. */
    TOTAL_LENGTH_MISMATCH,

    /** A fragment carried different bytes at an offset that was already filled. */
    CONFLICTING_FRAGMENT,

    /** A fragment fell outside the declared total, or the total exceeded the limit. */
    FRAGMENT_OUT_OF_BOUNDS,

    /** No fragment arrived within the configured TTL. */
    TIMEOUT,

    /** The peer aborted the transfer. */
    CANCELLED,

    /** The connection carrying the transfer went away. */
    CONNECTION_CLOSED
}

package com.questrail.mediaremote.protocol.internal.time;

/**
 * Cancellation handle for a scheduled task, such as a session's periodic
 * reassembly expiry sweep.
 */
public interface Cancellable
{
    /**
     * @return {@code true} if the task was cancelled by this call; {@code false}
     *         if it had already run or was cancelled before
     */
    boolean cancel();
}

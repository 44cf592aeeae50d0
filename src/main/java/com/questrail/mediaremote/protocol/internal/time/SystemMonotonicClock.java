package com.questrail.mediaremote.protocol.internal.time;

/**
 * {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <p>Unaffected by NTP or manual clock changes, which makes it suitable for
 * TTL measurement. Tests use a manually advanced clock instead.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}

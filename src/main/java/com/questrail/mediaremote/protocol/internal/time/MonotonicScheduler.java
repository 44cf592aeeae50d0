package com.questrail.mediaremote.protocol.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Scheduling surface used for reassembly expiry sweeps.
 *
 * <h2>Binding invariant</h2>
 * Deadlines are expressed in monotonic ticks or durations, never in
 * wall-clock instants.
 */
public interface MonotonicScheduler
{
    /**
     * Schedules {@code task} to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos deadline on the {@link MonotonicClock#nowNanos()} scale
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long deadline = clock.nowNanos() + delay.toNanos();
        return scheduleAtNanos(deadline, task);
    }

    /**
     * Runs {@code task} every {@code period}, first after one period, until the
     * returned handle is cancelled.
     *
     * <p>Each run reschedules the next one relative to the clock at the time it
     * runs, so a slow task delays later runs instead of bunching them up.</p>
     */
    default Cancellable scheduleRepeating(Duration period, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(period, "period");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("period must be > 0");
        }

        RepeatingTask repeating = new RepeatingTask(this, period, clock, task);
        repeating.scheduleNext();
        return repeating;
    }

    /**
     * Self-rescheduling wrapper behind {@link #scheduleRepeating}.
     */
    final class RepeatingTask implements Cancellable, Runnable
    {
        private final MonotonicScheduler scheduler;
        private final Duration period;
        private final MonotonicClock clock;
        private final Runnable task;

        private Cancellable current;
        private boolean cancelled;

        private RepeatingTask(MonotonicScheduler scheduler,
                              Duration period,
                              MonotonicClock clock,
                              Runnable task) {
            this.scheduler = scheduler;
            this.period = period;
            this.clock = clock;
            this.task = task;
        }

        private synchronized void scheduleNext() {
            if (!cancelled) {
                current = scheduler.scheduleAfter(period, clock, this);
            }
        }

        @Override
        public void run() {
            synchronized (this) {
                if (cancelled) {
                    return;
                }
            }
            try {
                task.run();
            } finally {
                scheduleNext();
            }
        }

        @Override
        public synchronized boolean cancel() {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            if (current != null) {
                current.cancel();
            }
            return true;
        }
    }
}

package com.questrail.mediaremote.protocol.internal.time;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a
 * {@link ScheduledExecutorService}.
 *
 * <h2>Deadlines</h2>
 * <p>Monotonic deadlines are turned into relative delays against the supplied
 * {@link MonotonicClock} at scheduling time. Callers must compute deadlines on
 * the same clock. A deadline already in the past runs immediately.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>An executor passed to the constructor stays owned by the caller.
 * {@link #singleThreaded(String, MonotonicClock)} creates an executor that this
 * scheduler owns and shuts down in {@link #close()}.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler, AutoCloseable {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;
    private final boolean ownsExecutor;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this(executor, clock, false);
    }

    private ScheduledExecutorScheduler(ScheduledExecutorService executor,
                                       MonotonicClock clock,
                                       boolean ownsExecutor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * Creates a scheduler over a private single daemon thread.
     *
     * @param threadName name prefix of the scheduler thread
     */
    public static ScheduledExecutorScheduler singleThreaded(String threadName, MonotonicClock clock) {
        Objects.requireNonNull(threadName, "threadName");
        AtomicInteger counter = new AtomicInteger();
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        return new ScheduledExecutorScheduler(executor, clock, true);
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);

        // Do not interrupt a sweep that is already running.
        return () -> future.cancel(false);
    }

    /**
     * Shuts the executor down if this scheduler created it, waiting briefly for
     * a running task; otherwise does nothing.
     */
    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

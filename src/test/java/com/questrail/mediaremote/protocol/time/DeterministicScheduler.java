package com.questrail.mediaremote.protocol.time;

import com.questrail.mediaremote.protocol.internal.time.Cancellable;
import com.questrail.mediaremote.protocol.internal.time.MonotonicClock;
import com.questrail.mediaremote.protocol.internal.time.MonotonicScheduler;

import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deterministic scheduler driven by a ManualMonotonicClock.
 *
 * Tasks execute ONLY when {@link #runDueTasks()} is called. Tasks scheduled
 * while running are picked up in the same call if they are already due.
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private final MonotonicClock clock;
    private final PriorityQueue<Scheduled> queue = new PriorityQueue<>();
    private long sequence;

    public DeterministicScheduler(MonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Scheduled scheduled = new Scheduled(deadlineNanos, sequence++, task);
        queue.add(scheduled);
        return scheduled;
    }

    /**
     * Run all tasks whose deadlines are <= current clock time.
     */
    public void runDueTasks() {
        while (true) {
            Scheduled next;
            synchronized (this) {
                if (queue.isEmpty() || queue.peek().deadlineNanos > clock.nowNanos()) {
                    return;
                }
                next = queue.poll();
            }
            if (next.done.compareAndSet(false, true)) {
                next.task.run();
            }
        }
    }

    /**
     * Number of tasks that are queued and not cancelled.
     */
    public synchronized int pendingTasks() {
        return (int) queue.stream().filter(s -> !s.done.get()).count();
    }

    private static final class Scheduled implements Comparable<Scheduled>, Cancellable {
        private final long deadlineNanos;
        private final long order;
        private final Runnable task;
        private final AtomicBoolean done = new AtomicBoolean(false);

        private Scheduled(long deadlineNanos, long order, Runnable task) {
            this.deadlineNanos = deadlineNanos;
            this.order = order;
            this.task = task;
        }

        @Override
        public boolean cancel() {
            return done.compareAndSet(false, true);
        }

        @Override
        public int compareTo(Scheduled o) {
            int byDeadline = Long.compare(this.deadlineNanos, o.deadlineNanos);
            return byDeadline != 0 ? byDeadline : Long.compare(this.order, o.order);
        }
    }
}

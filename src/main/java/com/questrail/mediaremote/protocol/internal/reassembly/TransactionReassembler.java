package com.questrail.mediaremote.protocol.internal.reassembly;

import com.questrail.mediaremote.protocol.internal.time.MonotonicClock;
import com.questrail.mediaremote.protocol.model.TransactionKey;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * TransactionReassembler
 * =============================================================================
 * Accumulates positional fragments per {@link TransactionKey} until the
 * declared total length is covered, then hands back the assembled blob
 * exactly once.
 *
 * <h2>State machine (per key)</h2>
 * <pre>
 *   Idle ──first fragment──▶ Accumulating ──covered──▶ Complete
 *                                  │
 *                                  └── mismatch / conflict / bounds /
 *                                      timeout / cancel / close ──▶ Aborted
 * </pre>
 * Complete and Aborted are terminal. An aborted key is forgotten, so a later
 * fragment with that key starts a new transaction. A completed key is
 * remembered until it has been quiet for the TTL; fragments arriving for it in
 * that window are retransmissions and yield {@link ReassemblyOutcome.AlreadyComplete}.
 *
 * <h2>Writes</h2>
 * Fragments are written at their declared offset, so arrival order within a
 * transaction does not matter. Re-writing identical bytes is a no-op;
 * different bytes at an already written offset abort the transaction.
 *
 * <h2>Expiry</h2>
 * {@link #expire(long)} aborts every transaction whose last fragment is older
 * than the TTL. The TTL counts from the most recent fragment, not from
 * creation, so a slow but steady transfer is not cut off. The same sweep
 * forgets completed keys and fails completion futures that have waited a full
 * TTL for a transaction that never started.
 *
 * <h2>Resource release</h2>
 * Every abort path removes the state, and with it the only reference to the
 * buffer, before the exception is thrown or the completion future is failed.
 * No partial result is ever handed out.
 *
 * <h2>Thread Safety</h2>
 * All public methods are {@code synchronized}. Inbound fragments arrive on the
 * connection's event loop while expiry runs on the scheduler thread; the lock
 * guarantees two fragments of one key are never applied concurrently.
 */
public final class TransactionReassembler
{
    private final MonotonicClock clock;
    private final Duration ttl;
    private final long ttlNanos;
    private final int maxTransactionLength;

    private final Map<TransactionKey, ReassemblyState> states = new HashMap<>();
    private final Map<TransactionKey, Waiter> waiters = new HashMap<>();
    // completed key -> last fragment seen for it
    private final Map<TransactionKey, Long> completed = new HashMap<>();

    private record Waiter(CompletableFuture<byte[]> future, long registeredAtNanos) {}

    /**
     * @param clock                monotonic time source for TTL bookkeeping
     * @param ttl                  maximum silence before a transaction is aborted
     * @param maxTransactionLength largest declared total length accepted
     */
    public TransactionReassembler(MonotonicClock clock, Duration ttl, int maxTransactionLength) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
        if (maxTransactionLength < 0) {
            throw new IllegalArgumentException("maxTransactionLength must be >= 0");
        }
        this.ttlNanos = ttl.toNanos();
        this.maxTransactionLength = maxTransactionLength;
    }

    /**
     * Applies one fragment.
     *
     * @return {@link ReassemblyOutcome.Complete} with the assembled blob if this
     *         fragment covered the last gap, {@link ReassemblyOutcome.AlreadyComplete}
     *         if the key completed recently, otherwise {@link ReassemblyOutcome.Pending}
     * @throws TotalLengthMismatchException  if the declared total differs from the first fragment's
     * @throws ConflictingFragmentException  if the fragment disagrees with bytes already written
     * @throws FragmentOutOfBoundsException  if the fragment does not fit the declared total,
     *                                       or the total exceeds the configured maximum
     */
    public synchronized ReassemblyOutcome submit(TransactionFragment fragment) {
        Objects.requireNonNull(fragment, "fragment");

        TransactionKey key = fragment.key();
        long now = clock.nowNanos();

        if (completed.containsKey(key)) {
            completed.put(key, now);
            return new ReassemblyOutcome.AlreadyComplete(key);
        }

        ReassemblyState state = states.get(key);

        if (state != null && fragment.declaredTotalLength() != state.declaredTotalLength()) {
            TotalLengthMismatchException failure = new TotalLengthMismatchException(
                    key, state.declaredTotalLength(), fragment.declaredTotalLength());
            abort(key, failure);
            throw failure;
        }

        checkBounds(fragment);

        if (state == null) {
            state = new ReassemblyState((int) fragment.declaredTotalLength(), now);
            states.put(key, state);
        }

        int offset = (int) fragment.writePosition();
        byte[] bytes = fragment.rawBytes();

        int conflict = state.firstConflict(offset, bytes);
        if (conflict >= 0) {
            ConflictingFragmentException failure = new ConflictingFragmentException(key, conflict);
            abort(key, failure);
            throw failure;
        }

        state.write(offset, bytes, now);

        if (!state.isComplete()) {
            return new ReassemblyOutcome.Pending(key, state.contiguousBytes(), state.declaredTotalLength());
        }

        states.remove(key);
        completed.put(key, now);
        byte[] blob = state.buffer();

        Waiter waiter = waiters.remove(key);
        if (waiter != null) {
            waiter.future().complete(blob.clone());
        }
        return new ReassemblyOutcome.Complete(key, blob);
    }

    private void checkBounds(TransactionFragment fragment) {
        TransactionKey key = fragment.key();
        long total = fragment.declaredTotalLength();
        long position = fragment.writePosition();
        int length = fragment.length();

        String problem = null;
        if (total < 0 || total > maxTransactionLength) {
            problem = "declared total length " + Long.toUnsignedString(total)
                    + " exceeds the limit of " + maxTransactionLength;
        } else if (position < 0 || position > total - length) {
            problem = "fragment [" + Long.toUnsignedString(position) + ", +" + length
                    + ") does not fit declared total length " + total;
        }

        if (problem != null) {
            FragmentOutOfBoundsException failure = new FragmentOutOfBoundsException(key, problem);
            abort(key, failure);
            throw failure;
        }
    }

    /**
     * Aborts every transaction with no fragment for longer than the TTL,
     * forgets completed keys quiet for as long, and fails completion futures
     * that waited longer than the TTL without their transaction starting.
     *
     * @param nowNanos current time on the reassembler's clock
     * @return keys of the evicted transactions
     */
    public synchronized List<TransactionKey> expire(long nowNanos) {
        List<TransactionKey> evicted = new ArrayList<>();

        Iterator<Map.Entry<TransactionKey, ReassemblyState>> it = states.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<TransactionKey, ReassemblyState> entry = it.next();
            if (nowNanos - entry.getValue().lastActivityNanos() > ttlNanos) {
                it.remove();
                evicted.add(entry.getKey());
            }
        }

        completed.values().removeIf(lastSeen -> nowNanos - lastSeen > ttlNanos);

        List<TransactionKey> timedOut = new ArrayList<>(evicted);
        for (Map.Entry<TransactionKey, Waiter> entry : waiters.entrySet()) {
            TransactionKey key = entry.getKey();
            if (!states.containsKey(key) && !evicted.contains(key)
                    && nowNanos - entry.getValue().registeredAtNanos() > ttlNanos) {
                timedOut.add(key);
            }
        }
        for (TransactionKey key : timedOut) {
            failWaiter(key, new ReassemblyTimeoutException(key, ttl));
        }
        return evicted;
    }

    public List<TransactionKey> expire() {
        return expire(clock.nowNanos());
    }

    /**
     * Discards one transaction at the peer's request.
     *
     * @return {@code true} if the transaction was accumulating
     */
    public synchronized boolean cancel(TransactionKey key) {
        Objects.requireNonNull(key, "key");
        boolean existed = states.containsKey(key);
        abort(key, new TransactionAbortedException(
                key, AbortReason.CANCELLED, "Transaction " + key + " cancelled by peer"));
        return existed;
    }

    /**
     * Discards every transaction, typically on connection teardown. Pending
     * completion futures fail with {@link AbortReason#CONNECTION_CLOSED}.
     *
     * @return keys of the transactions that were accumulating
     */
    public synchronized List<TransactionKey> cancelAll() {
        List<TransactionKey> cancelled = new ArrayList<>(states.keySet());
        states.clear();
        completed.clear();

        List<TransactionKey> waiting = new ArrayList<>(waiters.keySet());
        for (TransactionKey key : waiting) {
            failWaiter(key, new TransactionAbortedException(
                    key, AbortReason.CONNECTION_CLOSED, "Connection closed during transaction " + key));
        }
        return cancelled;
    }

    /**
     * Returns a future completed with the assembled blob of {@code key}, or
     * failed with a {@link TransactionAbortedException} if it aborts.
     *
     * <p>The future may be requested before the first fragment arrives. It is
     * released on completion, abort or {@link #cancelAll()}, and fails with a
     * {@link ReassemblyTimeoutException} if no fragment for the key arrives
     * within the TTL of the first request.</p>
     */
    public synchronized CompletableFuture<byte[]> completion(TransactionKey key) {
        Objects.requireNonNull(key, "key");
        long now = clock.nowNanos();
        return waiters.computeIfAbsent(key, k -> new Waiter(new CompletableFuture<>(), now)).future().copy();
    }

    public synchronized int pendingCount() {
        return states.size();
    }

    public synchronized boolean isPending(TransactionKey key) {
        return states.containsKey(key);
    }

    /**
     * Number of completed keys still remembered for retransmission filtering.
     */
    public synchronized int completedCount() {
        return completed.size();
    }

    public synchronized int waiterCount() {
        return waiters.size();
    }

    /**
     * Total bytes held by accumulating transactions.
     */
    public synchronized long retainedBytes() {
        long total = 0;
        for (ReassemblyState state : states.values()) {
            total += state.retainedBytes();
        }
        return total;
    }

    public Duration ttl() {
        return ttl;
    }

    private void abort(TransactionKey key, TransactionAbortedException failure) {
        states.remove(key);
        failWaiter(key, failure);
    }

    private void failWaiter(TransactionKey key, TransactionAbortedException failure) {
        Waiter waiter = waiters.remove(key);
        if (waiter != null) {
            waiter.future().completeExceptionally(failure);
        }
    }
}

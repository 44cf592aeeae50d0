package com.questrail.mediaremote.protocol.internal.reassembly;

import com.questrail.mediaremote.protocol.model.TransactionKey;
import com.questrail.mediaremote.protocol.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class TransactionReassemblerTest {

    private static final Duration TTL = Duration.ofSeconds(5);
    private static final TransactionKey XFER = TransactionKey.of("xfer-1");

    private ManualMonotonicClock clock;
    private TransactionReassembler reassembler;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        reassembler = new TransactionReassembler(clock, TTL, 1024);
    }

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    private static TransactionFragment fragment(TransactionKey key, String data, long total, long offset) {
        return new TransactionFragment(key, ascii(data), total, offset);
    }

    // -------------------------------------------------------------------------
    // Assembly
    // -------------------------------------------------------------------------

    @Test
    void outOfOrderFragmentsAssembleOnce() {
        ReassemblyOutcome first = reassembler.submit(fragment(XFER, "def", 9, 3));
        ReassemblyOutcome second = reassembler.submit(fragment(XFER, "abc", 9, 0));
        ReassemblyOutcome third = reassembler.submit(fragment(XFER, "ghi", 9, 6));

        ReassemblyOutcome.Pending p1 = assertInstanceOf(ReassemblyOutcome.Pending.class, first);
        assertEquals(0, p1.contiguousBytes());
        ReassemblyOutcome.Pending p2 = assertInstanceOf(ReassemblyOutcome.Pending.class, second);
        assertEquals(6, p2.contiguousBytes());

        ReassemblyOutcome.Complete done = assertInstanceOf(ReassemblyOutcome.Complete.class, third);
        assertEquals("abcdefghi", new String(done.blob(), StandardCharsets.US_ASCII));
        assertEquals(XFER, done.key());

        assertFalse(reassembler.isPending(XFER));
        assertEquals(0, reassembler.retainedBytes());
    }

    @Test
    void everyArrivalOrderYieldsTheSameBlob() {
        List<TransactionFragment> parts = List.of(
                fragment(XFER, "ab", 7, 0),
                fragment(XFER, "cde", 7, 2),
                fragment(XFER, "fg", 7, 5));

        for (List<TransactionFragment> order : permutations(parts)) {
            TransactionReassembler fresh = new TransactionReassembler(clock, TTL, 1024);
            assertInstanceOf(ReassemblyOutcome.Pending.class, fresh.submit(order.get(0)));
            assertInstanceOf(ReassemblyOutcome.Pending.class, fresh.submit(order.get(1)));
            ReassemblyOutcome.Complete done =
                    assertInstanceOf(ReassemblyOutcome.Complete.class, fresh.submit(order.get(2)));
            assertEquals("abcdefg", new String(done.blob(), StandardCharsets.US_ASCII));
            assertEquals(0, fresh.pendingCount());
        }
    }

    @Test
    void singleFragmentCoveringEverythingCompletesImmediately() {
        ReassemblyOutcome outcome = reassembler.submit(fragment(XFER, "whole", 5, 0));

        assertEquals(5, assertInstanceOf(ReassemblyOutcome.Complete.class, outcome).length());
    }

    @Test
    void emptyTransactionCompletes() {
        ReassemblyOutcome outcome = reassembler.submit(new TransactionFragment(XFER, new byte[0], 0, 0));

        assertEquals(0, assertInstanceOf(ReassemblyOutcome.Complete.class, outcome).length());
    }

    @Test
    void overlappingFragmentsWithEqualBytesAreAccepted() {
        reassembler.submit(fragment(XFER, "abcd", 6, 0));
        ReassemblyOutcome outcome = reassembler.submit(fragment(XFER, "cdef", 6, 2));

        assertEquals("abcdef",
                new String(assertInstanceOf(ReassemblyOutcome.Complete.class, outcome).blob(),
                        StandardCharsets.US_ASCII));
    }

    @Test
    void duplicateFragmentIsANoOp() {
        reassembler.submit(fragment(XFER, "abc", 9, 0));
        ReassemblyOutcome again = reassembler.submit(fragment(XFER, "abc", 9, 0));

        assertEquals(3, assertInstanceOf(ReassemblyOutcome.Pending.class, again).contiguousBytes());
        assertEquals(1, reassembler.pendingCount());
    }

    @Test
    void keysAreIndependent() {
        TransactionKey other = TransactionKey.of("xfer-2");
        TransactionKey sameIdOtherUserData = TransactionKey.of("xfer-1", new byte[] {1});

        reassembler.submit(fragment(XFER, "abc", 6, 0));
        reassembler.submit(fragment(other, "xyz", 6, 0));
        reassembler.submit(fragment(sameIdOtherUserData, "123", 6, 0));

        assertEquals(3, reassembler.pendingCount());
        assertEquals(18, reassembler.retainedBytes());

        ReassemblyOutcome done = reassembler.submit(fragment(other, "uvw", 6, 3));
        assertEquals("xyzuvw", new String(
                assertInstanceOf(ReassemblyOutcome.Complete.class, done).blob(), StandardCharsets.US_ASCII));
        assertTrue(reassembler.isPending(XFER));
        assertTrue(reassembler.isPending(sameIdOtherUserData));
    }

    @Test
    void repeatedSingleFragmentTransactionCompletesOnce() {
        assertInstanceOf(ReassemblyOutcome.Complete.class, reassembler.submit(fragment(XFER, "abc", 3, 0)));

        ReassemblyOutcome again = reassembler.submit(fragment(XFER, "abc", 3, 0));

        assertEquals(XFER, assertInstanceOf(ReassemblyOutcome.AlreadyComplete.class, again).key());
        assertEquals(0, reassembler.pendingCount());
        assertEquals(0, reassembler.retainedBytes());
    }

    @Test
    void lateFragmentOfCompletedTransactionAllocatesNothing() {
        reassembler.submit(fragment(XFER, "abc", 6, 0));
        reassembler.submit(fragment(XFER, "def", 6, 3));

        ReassemblyOutcome late = reassembler.submit(fragment(XFER, "def", 6, 3));

        assertInstanceOf(ReassemblyOutcome.AlreadyComplete.class, late);
        assertEquals(0, reassembler.pendingCount());
        assertEquals(0, reassembler.retainedBytes());

        clock.advance(TTL.plusSeconds(1));
        assertTrue(reassembler.expire().isEmpty(), "nothing to time out");
    }

    @Test
    void completedKeyIsForgottenAfterQuietTtl() {
        reassembler.submit(fragment(XFER, "abc", 3, 0));
        assertEquals(1, reassembler.completedCount());

        clock.advance(Duration.ofSeconds(4));
        assertInstanceOf(ReassemblyOutcome.AlreadyComplete.class, reassembler.submit(fragment(XFER, "abc", 3, 0)));
        clock.advance(Duration.ofSeconds(4));
        reassembler.expire();
        assertEquals(1, reassembler.completedCount(), "a retransmission extends the window");

        clock.advance(TTL);
        reassembler.expire();
        assertEquals(0, reassembler.completedCount());

        ReassemblyOutcome reused = reassembler.submit(fragment(XFER, "xy", 4, 0));
        assertInstanceOf(ReassemblyOutcome.Pending.class, reused);
        assertEquals(4, reassembler.retainedBytes());
    }

    @Test
    void cancelAllForgetsCompletedKeys() {
        reassembler.submit(fragment(XFER, "abc", 3, 0));

        reassembler.cancelAll();

        assertEquals(0, reassembler.completedCount());
        assertInstanceOf(ReassemblyOutcome.Complete.class, reassembler.submit(fragment(XFER, "abc", 3, 0)));
    }

    // -------------------------------------------------------------------------
    // Aborts
    // -------------------------------------------------------------------------

    @Test
    void totalLengthMismatchAbortsAndReleases() {
        reassembler.submit(fragment(XFER, "abc", 9, 0));

        TotalLengthMismatchException ex = assertThrows(TotalLengthMismatchException.class,
                () -> reassembler.submit(fragment(XFER, "def", 10, 3)));

        assertEquals(AbortReason.TOTAL_LENGTH_MISMATCH, ex.reason());
        assertEquals(9, ex.expected());
        assertEquals(10, ex.actual());
        assertFalse(reassembler.isPending(XFER));
        assertEquals(0, reassembler.retainedBytes());
    }

    @Test
    void conflictingBytesAbort() {
        reassembler.submit(fragment(XFER, "abc", 9, 0));

        ConflictingFragmentException ex = assertThrows(ConflictingFragmentException.class,
                () -> reassembler.submit(fragment(XFER, "abX", 9, 0)));

        assertEquals(AbortReason.CONFLICTING_FRAGMENT, ex.reason());
        assertEquals(2, ex.offset());
        assertEquals(0, reassembler.pendingCount());
    }

    @Test
    void fragmentPastDeclaredEndIsRejected() {
        FragmentOutOfBoundsException ex = assertThrows(FragmentOutOfBoundsException.class,
                () -> reassembler.submit(fragment(XFER, "ghij", 9, 6)));

        assertEquals(AbortReason.FRAGMENT_OUT_OF_BOUNDS, ex.reason());
        assertEquals(0, reassembler.pendingCount());
    }

    @Test
    void outOfBoundsFragmentAbortsExistingTransaction() {
        reassembler.submit(fragment(XFER, "abc", 9, 0));

        assertThrows(FragmentOutOfBoundsException.class,
                () -> reassembler.submit(fragment(XFER, "z", 9, 9)));

        assertFalse(reassembler.isPending(XFER));
    }

    @Test
    void declaredTotalAboveLimitIsRejected() {
        assertThrows(FragmentOutOfBoundsException.class,
                () -> reassembler.submit(fragment(XFER, "a", 4096, 0)));
        assertEquals(0, reassembler.retainedBytes());
    }

    @Test
    void negativeOffsetIsRejected() {
        assertThrows(FragmentOutOfBoundsException.class,
                () -> reassembler.submit(fragment(XFER, "a", 9, -1)));
    }

    // -------------------------------------------------------------------------
    // Expiry
    // -------------------------------------------------------------------------

    @Test
    void staleTransactionIsEvictedAfterTtl() {
        reassembler.submit(fragment(XFER, "abc", 9, 0));

        clock.advance(TTL);
        assertTrue(reassembler.expire().isEmpty(), "exactly TTL old is still alive");

        clock.advanceNanos(1);
        assertEquals(List.of(XFER), reassembler.expire());
        assertFalse(reassembler.isPending(XFER));
        assertEquals(0, reassembler.retainedBytes());
    }

    @Test
    void ttlCountsFromLastFragment() {
        reassembler.submit(fragment(XFER, "abc", 9, 0));
        clock.advance(Duration.ofSeconds(4));
        reassembler.submit(fragment(XFER, "def", 9, 3));
        clock.advance(Duration.ofSeconds(4));

        assertTrue(reassembler.expire().isEmpty());
        ReassemblyOutcome outcome = reassembler.submit(fragment(XFER, "ghi", 9, 6));
        assertInstanceOf(ReassemblyOutcome.Complete.class, outcome);
    }

    @Test
    void fragmentAfterEvictionStartsFresh() {
        reassembler.submit(fragment(XFER, "abc", 9, 0));
        clock.advance(TTL.plusSeconds(1));
        reassembler.expire();

        ReassemblyOutcome outcome = reassembler.submit(fragment(XFER, "def", 9, 3));

        assertEquals(0, assertInstanceOf(ReassemblyOutcome.Pending.class, outcome).contiguousBytes());
    }

    // -------------------------------------------------------------------------
    // Completion futures
    // -------------------------------------------------------------------------

    @Test
    void completionFutureReceivesBlob() throws Exception {
        CompletableFuture<byte[]> future = reassembler.completion(XFER);
        assertFalse(future.isDone());

        reassembler.submit(fragment(XFER, "ab", 4, 2));
        reassembler.submit(fragment(XFER, "cd", 4, 0));

        assertEquals("cdab", new String(future.get(), StandardCharsets.US_ASCII));
    }

    @Test
    void completionFutureFailsOnAbort() {
        CompletableFuture<byte[]> future = reassembler.completion(XFER);
        reassembler.submit(fragment(XFER, "abc", 9, 0));

        assertThrows(ConflictingFragmentException.class,
                () -> reassembler.submit(fragment(XFER, "xyz", 9, 0)));

        ExecutionException ex = assertThrows(ExecutionException.class, future::get);
        assertEquals(AbortReason.CONFLICTING_FRAGMENT,
                assertInstanceOf(TransactionAbortedException.class, ex.getCause()).reason());
    }

    @Test
    void completionFutureFailsOnTimeout() {
        CompletableFuture<byte[]> future = reassembler.completion(XFER);
        reassembler.submit(fragment(XFER, "abc", 9, 0));

        clock.advance(TTL.plusMillis(1));
        reassembler.expire();

        ExecutionException ex = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(ReassemblyTimeoutException.class, ex.getCause());
    }

    @Test
    void waiterForTransactionThatNeverStartsTimesOut() {
        TransactionKey never = TransactionKey.of("never");
        CompletableFuture<byte[]> future = reassembler.completion(never);

        clock.advance(TTL);
        reassembler.expire();
        assertFalse(future.isDone());

        clock.advanceNanos(1);
        assertTrue(reassembler.expire().isEmpty(), "no transaction was evicted");

        ExecutionException ex = assertThrows(ExecutionException.class, future::get);
        assertEquals(AbortReason.TIMEOUT,
                assertInstanceOf(ReassemblyTimeoutException.class, ex.getCause()).reason());
        assertEquals(0, reassembler.waiterCount());
    }

    @Test
    void waiterWithActiveTransactionFollowsTransactionTtl() {
        CompletableFuture<byte[]> future = reassembler.completion(XFER);
        clock.advance(Duration.ofSeconds(4));
        reassembler.submit(fragment(XFER, "abc", 9, 0));

        clock.advance(Duration.ofSeconds(4));
        reassembler.expire();

        assertFalse(future.isDone());
        assertEquals(1, reassembler.waiterCount());
    }

    @Test
    void cancellingTheReturnedFutureDoesNotDetachOtherWaiters() throws Exception {
        CompletableFuture<byte[]> first = reassembler.completion(XFER);
        CompletableFuture<byte[]> second = reassembler.completion(XFER);
        first.cancel(false);

        reassembler.submit(fragment(XFER, "ok", 2, 0));

        assertEquals("ok", new String(second.get(), StandardCharsets.US_ASCII));
    }

    // -------------------------------------------------------------------------
    // Cancellation
    // -------------------------------------------------------------------------

    @Test
    void cancelDiscardsOneTransaction() {
        TransactionKey other = TransactionKey.of("xfer-2");
        reassembler.submit(fragment(XFER, "abc", 9, 0));
        reassembler.submit(fragment(other, "abc", 9, 0));

        assertTrue(reassembler.cancel(XFER));
        assertFalse(reassembler.cancel(XFER));

        assertFalse(reassembler.isPending(XFER));
        assertTrue(reassembler.isPending(other));
    }

    @Test
    void cancelAllFailsWaitersWithConnectionClosed() {
        CompletableFuture<byte[]> waiting = reassembler.completion(TransactionKey.of("never-started"));
        reassembler.submit(fragment(XFER, "abc", 9, 0));

        assertEquals(List.of(XFER), reassembler.cancelAll());

        assertEquals(0, reassembler.pendingCount());
        assertEquals(0, reassembler.retainedBytes());
        ExecutionException ex = assertThrows(ExecutionException.class, waiting::get);
        assertEquals(AbortReason.CONNECTION_CLOSED,
                assertInstanceOf(TransactionAbortedException.class, ex.getCause()).reason());
    }

    @Test
    void invalidConstructionIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new TransactionReassembler(clock, Duration.ZERO, 10));
        assertThrows(IllegalArgumentException.class,
                () -> new TransactionReassembler(clock, TTL, -1));
    }

    private static <T> List<List<T>> permutations(List<T> items) {
        if (items.size() <= 1) {
            return List.of(items);
        }
        List<List<T>> result = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            List<T> rest = new ArrayList<>(items);
            T head = rest.remove(i);
            for (List<T> tail : permutations(rest)) {
                List<T> perm = new ArrayList<>();
                perm.add(head);
                perm.addAll(tail);
                result.add(perm);
            }
        }
        return result;
    }
}

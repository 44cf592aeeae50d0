package com.questrail.mediaremote.protocol.internal.reassembly;

import com.questrail.mediaremote.protocol.model.TransactionKey;

import java.util.Objects;

/**
 * Result of submitting one fragment that did not abort its transaction.
 */
public sealed interface ReassemblyOutcome permits ReassemblyOutcome.Pending, ReassemblyOutcome.Complete,
        ReassemblyOutcome.AlreadyComplete
{
    TransactionKey key();

    /**
     * The transaction is still accumulating.
     *
     * @param contiguousBytes     length of the gap-free prefix written so far
     * @param declaredTotalLength size the transaction will have once complete
     */
    record Pending(TransactionKey key, long contiguousBytes, long declaredTotalLength)
            implements ReassemblyOutcome
    {
        public Pending {
            Objects.requireNonNull(key, "key");
        }
    }

    /**
     * The key completed recently and this fragment was ignored as a retransmission.
     */
    record AlreadyComplete(TransactionKey key) implements ReassemblyOutcome
    {
        public AlreadyComplete {
            Objects.requireNonNull(key, "key");
        }
    }

    /**
     * The transaction completed with this fragment. Its state is already gone.
     */
    final class Complete implements ReassemblyOutcome
    {
        private final TransactionKey key;
        private final byte[] blob;

        Complete(TransactionKey key, byte[] blob) {
            this.key = Objects.requireNonNull(key, "key");
            this.blob = Objects.requireNonNull(blob, "blob");
        }

        @Override
        public TransactionKey key() {
            return key;
        }

        public byte[] blob() {
            return blob.clone();
        }

        public int length() {
            return blob.length;
        }

        @Override
        public String toString() {
            return "Complete[" + key + ", length=" + blob.length + "]";
        }
    }
}

package com.questrail.mediaremote.protocol.internal.reassembly;

import com.questrail.mediaremote.protocol.model.TransactionKey;
import com.questrail.mediaremote.protocol.model.TransactionMessage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Outbound half of the chunked transfer scheme: splits a blob into
 * positional fragments that a {@link TransactionReassembler} puts back
 * together.
 */
public final class TransactionFragmenter
{
    private TransactionFragmenter() {}

    /**
     * Splits {@code blob} into fragments of at most {@code maxFragmentSize}
     * bytes, in offset order. An empty blob yields a single empty fragment so
     * the receiver still sees the transaction complete.
     */
    public static List<TransactionFragment> split(TransactionKey key, byte[] blob, int maxFragmentSize) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(blob, "blob");
        if (maxFragmentSize <= 0) {
            throw new IllegalArgumentException("maxFragmentSize must be > 0");
        }

        if (blob.length == 0) {
            return List.of(new TransactionFragment(key, blob, 0, 0));
        }

        List<TransactionFragment> fragments = new ArrayList<>();
        for (int offset = 0; offset < blob.length; offset += maxFragmentSize) {
            int end = Math.min(blob.length, offset + maxFragmentSize);
            fragments.add(new TransactionFragment(
                    key, Arrays.copyOfRange(blob, offset, end), blob.length, offset));
        }
        return fragments;
    }

    /**
     * Wraps each fragment in its own carrier message, one packet per message.
     */
    public static List<TransactionMessage> carriers(List<TransactionFragment> fragments) {
        List<TransactionMessage> messages = new ArrayList<>(fragments.size());
        for (TransactionFragment fragment : fragments) {
            messages.add(TransactionMessage.of(List.of(fragment.toPacket())));
        }
        return messages;
    }
}

package com.questrail.mediaremote.protocol.internal.interest;

import com.questrail.mediaremote.protocol.model.ClientUpdatesConfig;
import com.questrail.mediaremote.protocol.model.UpdateCategory;

import java.util.Objects;

/**
 * Tracks one peer's {@link UpdateInterestSet}.
 *
 * <p>
 * A pure gate: senders ask {@link #isInterested(UpdateCategory)} before
 * emitting a push notification. Suppressed notifications are not buffered.
 * </p>
 */
public final class UpdateInterestTracker
{
    private UpdateInterestSet current = UpdateInterestSet.none();

    /**
     * Merges the categories present in {@code config} into the current set.
     *
     * @return the set after the merge
     */
    public synchronized UpdateInterestSet apply(ClientUpdatesConfig config) {
        current = current.apply(Objects.requireNonNull(config, "config"));
        return current;
    }

    public synchronized boolean isInterested(UpdateCategory category) {
        return current.isInterested(category);
    }

    public synchronized UpdateInterestSet current() {
        return current;
    }
}

package com.questrail.mediaremote.protocol.session;

import com.questrail.mediaremote.protocol.model.UpdateCategory;

/**
 * Consulted by senders before pushing an update of a category to a peer.
 * A pure gate: nothing is queued for peers that are not interested.
 */
@FunctionalInterface
public interface NotificationGate
{
    boolean isInterested(PeerId peer, UpdateCategory category);
}

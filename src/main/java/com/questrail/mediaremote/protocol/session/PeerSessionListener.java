package com.questrail.mediaremote.protocol.session;

import com.questrail.mediaremote.protocol.internal.devices.NegotiationResult;
import com.questrail.mediaremote.protocol.internal.interest.UpdateInterestSet;

/**
 * Session state callbacks. Only called when something actually changed.
 */
public interface PeerSessionListener
{
    PeerSessionListener NONE = new PeerSessionListener() {};

    default void onInterestChanged(PeerId peer, UpdateInterestSet previous, UpdateInterestSet current) {
    }

    /**
     * @param result per-scope changes, with minimal deltas for notifications
     */
    default void onDeviceSetChanged(PeerId peer, NegotiationResult result) {
    }
}

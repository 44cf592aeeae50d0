package com.questrail.mediaremote.protocol.session;

import com.questrail.mediaremote.protocol.codec.DecodedMessage;

/**
 * Application callback for decoded inbound messages.
 *
 * <p>Invoked once per top-level message, whether it arrived whole or was
 * reassembled from a transaction. Transaction carriers themselves are never
 * delivered.</p>
 */
@FunctionalInterface
public interface PayloadListener
{
    void onPayload(PeerId peer, DecodedMessage message);
}

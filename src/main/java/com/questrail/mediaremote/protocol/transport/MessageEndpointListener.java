package com.questrail.mediaremote.protocol.transport;

import com.questrail.mediaremote.protocol.session.PeerId;

import java.net.SocketAddress;

/**
 * MessageEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link MessageEndpoint}.
 *
 * <p>Callbacks for one peer are serialized and arrive in wire order
 * (connected, messages, disconnected). Callbacks for different peers may
 * run concurrently.</p>
 */
public interface MessageEndpointListener
{
    void onTransportUp();

    /**
     * @param cause failure that brought the transport down, or {@code null}
     *              for an orderly stop
     */
    void onTransportDown(Throwable cause);

    void onPeerConnected(PeerId peer, SocketAddress remote);

    /**
     * @param cause connection failure, or {@code null} for an orderly close
     */
    void onPeerDisconnected(PeerId peer, Throwable cause);

    /**
     * One whole deframed message. The array belongs to the listener.
     */
    void onMessage(PeerId peer, byte[] message);
}

package com.questrail.mediaremote.protocol.transport;

import com.questrail.mediaremote.protocol.session.PeerId;

import java.net.SocketAddress;

/**
 * MessageEndpoint
 * -----------------------------------------------------------------------------
 * Port for a connection-oriented, message-framed transport.
 *
 * <p>The endpoint owns framing: every byte array it delivers or accepts is one
 * whole envelope. It never looks inside one. Everything above it sees only
 * {@link PeerId}s, {@code byte[]} messages and lifecycle callbacks.</p>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test double.</p>
 */
public interface MessageEndpoint
{
    /**
     * Start accepting connections.
     *
     * <p>On success the listener receives
     * {@link MessageEndpointListener#onTransportUp()} exactly once.</p>
     */
    void start();

    /**
     * Close every connection and release transport resources. Each open
     * connection is reported through
     * {@link MessageEndpointListener#onPeerDisconnected(PeerId, Throwable)}.
     */
    void stop();

    /**
     * Send one message to a connected peer. Messages to unknown peers are dropped.
     *
     * @return {@code true} if the peer was connected and the write was issued
     */
    boolean send(PeerId peer, byte[] message);

    /**
     * Close the connection of one peer.
     */
    void disconnect(PeerId peer);

    /**
     * Local bound address, or {@code null} while not started.
     */
    SocketAddress localAddress();

    /**
     * Must be called before {@link #start()}.
     */
    void setListener(MessageEndpointListener listener);
}

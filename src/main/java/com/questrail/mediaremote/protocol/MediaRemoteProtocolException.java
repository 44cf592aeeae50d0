package com.questrail.mediaremote.protocol;

/**
 * Base type for every protocol-level failure raised by the envelope and
 * transaction layers.
 *
 * <p>
 * None of these failures is fatal to a connection. A subclass describes
 * exactly one rejected message or one aborted transaction; the transport
 * layer decides whether repeated violations warrant disconnecting a peer.
 * </p>
 */
public class MediaRemoteProtocolException extends RuntimeException
{
    public MediaRemoteProtocolException(String message) {
        super(message);
    }

    public MediaRemoteProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}

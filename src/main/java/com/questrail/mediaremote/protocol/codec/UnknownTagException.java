package com.questrail.mediaremote.protocol.codec;

import com.questrail.mediaremote.protocol.MediaRemoteProtocolException;

/**
 * Raised by strict encoding when a tag (or payload type) has no catalog entry.
 *
 * <p>
 * Decoding never raises this: an unregistered tag on the inbound path is
 * expected from newer peers and is surfaced as opaque bytes.
 * </p>
 */
public final class UnknownTagException extends MediaRemoteProtocolException
{
    private final int tag;

    public UnknownTagException(int tag) {
        super("No catalog entry registered for tag " + tag);
        this.tag = tag;
    }

    public UnknownTagException(String message) {
        super(message);
        this.tag = -1;
    }

    /**
     * @return the offending tag, or {@code -1} if the failure was a payload type lookup
     */
    public int tag() {
        return tag;
    }
}

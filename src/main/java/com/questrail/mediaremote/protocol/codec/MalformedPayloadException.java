package com.questrail.mediaremote.protocol.codec;

import com.questrail.mediaremote.protocol.MediaRemoteProtocolException;

/**
 * Indicates that envelope or payload bytes do not parse according to the
 * declared shape of the message.
 *
 * This typically reflects:
 * <ul>
 *   <li>Truncated or otherwise invalid field-tagged bytes</li>
 *   <li>A required sub-message that is missing</li>
 *   <li>An enum value outside its numbered range</li>
 *   <li>A field carried with the wrong wire type</li>
 * </ul>
 *
 * The single message is rejected; the connection stays up.
 */
public final class MalformedPayloadException extends MediaRemoteProtocolException
{
    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}

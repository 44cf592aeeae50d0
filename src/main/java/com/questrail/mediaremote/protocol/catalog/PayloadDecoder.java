package com.questrail.mediaremote.protocol.catalog;

import com.questrail.mediaremote.protocol.model.ProtocolPayload;

/**
 * Decodes the payload bytes of one envelope into a typed payload.
 *
 * <p>
 * Implementations throw
 * {@link com.questrail.mediaremote.protocol.codec.MalformedPayloadException}
 * when the bytes do not match the payload's shape.
 * </p>
 */
@FunctionalInterface
public interface PayloadDecoder<T extends ProtocolPayload>
{
    T decode(byte[] bytes);
}

package com.questrail.mediaremote.protocol.catalog;

import com.questrail.mediaremote.protocol.model.ProtocolPayload;

/**
 * Encodes a typed payload into the bytes carried by an envelope.
 */
@FunctionalInterface
public interface PayloadEncoder<T extends ProtocolPayload>
{
    byte[] encode(T payload);
}

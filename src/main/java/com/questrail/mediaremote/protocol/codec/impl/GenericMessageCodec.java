package com.questrail.mediaremote.protocol.codec.impl;

import com.questrail.mediaremote.protocol.catalog.PayloadDecoder;
import com.questrail.mediaremote.protocol.catalog.PayloadEncoder;
import com.questrail.mediaremote.protocol.model.GenericMessage;

/**
 * Codec for {@link GenericMessage}. The message has no fields; any fields a
 * newer peer sends are skipped, but the bytes must still be well formed.
 */
public final class GenericMessageCodec
        implements PayloadDecoder<GenericMessage>,
                   PayloadEncoder<GenericMessage> {

    @Override
    public GenericMessage decode(byte[] bytes) {
        ProtobufFields.readFields(bytes, "GenericMessage", (field, wireType, in) -> false);
        return new GenericMessage();
    }

    @Override
    public byte[] encode(GenericMessage payload) {
        return new byte[0];
    }
}

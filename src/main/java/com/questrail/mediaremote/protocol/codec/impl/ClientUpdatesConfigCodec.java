package com.questrail.mediaremote.protocol.codec.impl;

import com.questrail.mediaremote.protocol.catalog.PayloadDecoder;
import com.questrail.mediaremote.protocol.catalog.PayloadEncoder;
import com.questrail.mediaremote.protocol.model.ClientUpdatesConfig;
import com.questrail.mediaremote.protocol.model.FlagState;
import com.questrail.mediaremote.protocol.model.UpdateCategory;

import java.util.Optional;

/**
 * Codec for {@link ClientUpdatesConfig}.
 *
 * <p>Wire layout: one optional bool per {@link UpdateCategory}, numbered by
 * {@link UpdateCategory#fieldNumber()}. Only fields present in the message
 * are written, so an {@link FlagState#UNSPECIFIED} category stays absent on
 * the wire and the receiver keeps its previous value.</p>
 */
public final class ClientUpdatesConfigCodec
        implements PayloadDecoder<ClientUpdatesConfig>,
                   PayloadEncoder<ClientUpdatesConfig> {

    private static final String NAME = "ClientUpdatesConfig";

    @Override
    public ClientUpdatesConfig decode(byte[] bytes) {
        ClientUpdatesConfig.Builder builder = ClientUpdatesConfig.builder();

        ProtobufFields.readFields(bytes, NAME, (field, wireType, in) -> {
            Optional<UpdateCategory> category = UpdateCategory.fromFieldNumber(field);
            if (category.isEmpty()) {
                return false;
            }
            ProtobufFields.requireVarint(field, wireType, NAME);
            builder.with(category.get(), in.readBool());
            return true;
        });

        return builder.build();
    }

    @Override
    public byte[] encode(ClientUpdatesConfig payload) {
        return ProtobufFields.write(out -> {
            for (UpdateCategory category : UpdateCategory.values()) {
                FlagState state = payload.state(category);
                if (state.isPresent()) {
                    out.writeBool(category.fieldNumber(), state == FlagState.ENABLED);
                }
            }
        });
    }
}

package com.questrail.mediaremote.protocol.codec.impl;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.questrail.mediaremote.protocol.catalog.PayloadDecoder;
import com.questrail.mediaremote.protocol.catalog.PayloadEncoder;
import com.questrail.mediaremote.protocol.codec.MalformedPayloadException;
import com.questrail.mediaremote.protocol.model.ModifyOutputContextRequest;
import com.questrail.mediaremote.protocol.model.OutputContextType;

import java.io.IOException;
import java.util.List;

/**
 * Codec for {@link ModifyOutputContextRequest}.
 *
 * <pre>
 *   1 type                   varint (enum)
 *   2 addingDevices          repeated string
 *   3 removingDevices        repeated string
 *   4 settingDevices         repeated string
 *   5 clusterAwareAdding     repeated string
 *   6 clusterAwareRemoving   repeated string
 *   7 clusterAwareSetting    repeated string
 * </pre>
 */
public final class ModifyOutputContextRequestCodec
        implements PayloadDecoder<ModifyOutputContextRequest>,
                   PayloadEncoder<ModifyOutputContextRequest> {

    private static final String NAME = "ModifyOutputContextRequest";

    static final int TYPE = 1;
    static final int ADDING = 2;
    static final int REMOVING = 3;
    static final int SETTING = 4;
    static final int CLUSTER_ADDING = 5;
    static final int CLUSTER_REMOVING = 6;
    static final int CLUSTER_SETTING = 7;

    @Override
    public ModifyOutputContextRequest decode(byte[] bytes) {
        ModifyOutputContextRequest.Builder builder = ModifyOutputContextRequest.builder();

        ProtobufFields.readFields(bytes, NAME, (field, wireType, in) -> {
            switch (field) {
                case TYPE -> {
                    ProtobufFields.requireVarint(field, wireType, NAME);
                    int raw = in.readEnum();
                    builder.type(OutputContextType.fromWireValue(raw).orElseThrow(
                            () -> new MalformedPayloadException(
                                    NAME + " type " + raw + " is outside the numbered range")));
                }
                case ADDING -> builder.adding(readString(field, wireType, in));
                case REMOVING -> builder.removing(readString(field, wireType, in));
                case SETTING -> builder.setting(readString(field, wireType, in));
                case CLUSTER_ADDING -> builder.clusterAwareAdding(readString(field, wireType, in));
                case CLUSTER_REMOVING -> builder.clusterAwareRemoving(readString(field, wireType, in));
                case CLUSTER_SETTING -> builder.clusterAwareSetting(readString(field, wireType, in));
                default -> {
                    return false;
                }
            }
            return true;
        });

        return builder.build();
    }

    @Override
    public byte[] encode(ModifyOutputContextRequest payload) {
        return ProtobufFields.write(out -> {
            if (payload.type() != null) {
                out.writeEnum(TYPE, payload.type().wireValue());
            }
            writeStrings(out, ADDING, payload.adding());
            writeStrings(out, REMOVING, payload.removing());
            writeStrings(out, SETTING, payload.setting());
            writeStrings(out, CLUSTER_ADDING, payload.clusterAwareAdding());
            writeStrings(out, CLUSTER_REMOVING, payload.clusterAwareRemoving());
            writeStrings(out, CLUSTER_SETTING, payload.clusterAwareSetting());
        });
    }

    private static String readString(int field, int wireType, CodedInputStream in) throws IOException {
        ProtobufFields.requireLengthDelimited(field, wireType, NAME);
        return in.readString();
    }

    private static void writeStrings(CodedOutputStream out, int field, List<String> values) throws IOException {
        for (String value : values) {
            out.writeString(field, value);
        }
    }
}

package com.questrail.mediaremote.protocol.codec.impl;

import com.google.protobuf.CodedOutputStream;
import com.questrail.mediaremote.protocol.codec.MalformedPayloadException;
import com.questrail.mediaremote.protocol.model.ClientUpdatesConfig;
import com.questrail.mediaremote.protocol.model.FlagState;
import com.questrail.mediaremote.protocol.model.GenericMessage;
import com.questrail.mediaremote.protocol.model.ModifyOutputContextRequest;
import com.questrail.mediaremote.protocol.model.OutputContextType;
import com.questrail.mediaremote.protocol.model.TransactionKey;
import com.questrail.mediaremote.protocol.model.TransactionMessage;
import com.questrail.mediaremote.protocol.model.TransactionPacket;
import com.questrail.mediaremote.protocol.model.UpdateCategory;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StandardPayloadCodecsTest {

    @FunctionalInterface
    interface Writes {
        void to(CodedOutputStream out) throws IOException;
    }

    private static byte[] raw(Writes writes) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        CodedOutputStream out = CodedOutputStream.newInstance(bytes);
        writes.to(out);
        out.flush();
        return bytes.toByteArray();
    }

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    // -------------------------------------------------------------------------
    // GenericMessage
    // -------------------------------------------------------------------------

    @Test
    void genericMessageIsEmptyOnTheWireAndIgnoresUnknownFields() throws IOException {
        GenericMessageCodec codec = new GenericMessageCodec();

        assertEquals(0, codec.encode(new GenericMessage()).length);
        assertEquals(new GenericMessage(), codec.decode(raw(out -> out.writeString(9, "future"))));
    }

    // -------------------------------------------------------------------------
    // ClientUpdatesConfig
    // -------------------------------------------------------------------------

    @Test
    void absentCategoriesStayUnspecified() throws IOException {
        ClientUpdatesConfig decoded = new ClientUpdatesConfigCodec().decode(raw(out -> {
            out.writeBool(2, true);
            out.writeBool(3, false);
        }));

        assertEquals(FlagState.ENABLED, decoded.state(UpdateCategory.NOW_PLAYING));
        assertEquals(FlagState.DISABLED, decoded.state(UpdateCategory.VOLUME));
        assertEquals(FlagState.UNSPECIFIED, decoded.state(UpdateCategory.ARTWORK));
        assertEquals(FlagState.UNSPECIFIED, decoded.state(UpdateCategory.KEYBOARD));
        assertEquals(Set.of(UpdateCategory.NOW_PLAYING, UpdateCategory.VOLUME), decoded.presentCategories());
    }

    @Test
    void onlyPresentCategoriesAreWritten() {
        ClientUpdatesConfigCodec codec = new ClientUpdatesConfigCodec();

        assertTrue(ClientUpdatesConfig.empty().isEmpty());
        assertEquals(0, codec.encode(ClientUpdatesConfig.empty()).length);
        // One field: key 0x18 (field 3, varint), value 0.
        assertArrayEquals(new byte[] {0x18, 0x00},
                codec.encode(ClientUpdatesConfig.builder().volume(false).build()));
    }

    @Test
    void categoryWithWrongWireTypeIsMalformed() throws IOException {
        byte[] bytes = raw(out -> out.writeString(1, "yes"));

        assertThrows(MalformedPayloadException.class, () -> new ClientUpdatesConfigCodec().decode(bytes));
    }

    // -------------------------------------------------------------------------
    // ModifyOutputContextRequest
    // -------------------------------------------------------------------------

    @Test
    void deviceListsKeepWireOrder() throws IOException {
        ModifyOutputContextRequest decoded = new ModifyOutputContextRequestCodec().decode(raw(out -> {
            out.writeEnum(1, 1);
            out.writeString(4, "A");
            out.writeString(2, "C");
            out.writeString(4, "B");
            out.writeString(7, "X");
        }));

        assertEquals(OutputContextType.SHARED_AUDIO_PRESENTATION, decoded.typeIfPresent().orElseThrow());
        assertEquals(List.of("A", "B"), decoded.setting());
        assertEquals(List.of("C"), decoded.adding());
        assertEquals(List.of("X"), decoded.clusterAwareSetting());
        assertTrue(decoded.removing().isEmpty());
    }

    @Test
    void requestWithoutTypeRoundTrips() {
        ModifyOutputContextRequestCodec codec = new ModifyOutputContextRequestCodec();
        ModifyOutputContextRequest request = ModifyOutputContextRequest.builder()
                .removing("A", "B")
                .build();

        ModifyOutputContextRequest decoded = codec.decode(codec.encode(request));

        assertEquals(request, decoded);
        assertTrue(decoded.typeIfPresent().isEmpty());
    }

    @Test
    void unknownOutputContextTypeIsMalformed() throws IOException {
        byte[] bytes = raw(out -> out.writeEnum(1, 42));

        assertThrows(MalformedPayloadException.class,
                () -> new ModifyOutputContextRequestCodec().decode(bytes));
    }

    // -------------------------------------------------------------------------
    // TransactionMessage
    // -------------------------------------------------------------------------

    @Test
    void packetsKeepTheirKeyAndOffsets() {
        TransactionMessageCodec codec = new TransactionMessageCodec();
        TransactionKey key = TransactionKey.of("xfer-1", ascii("meta"));
        TransactionMessage message = TransactionMessage.of(List.of(
                new TransactionPacket(key, ascii("ghi"), null, 9, 6),
                new TransactionPacket(key, ascii("abc"), "first", 9, 0)));

        TransactionMessage decoded = codec.decode(codec.encode(message));

        assertEquals(message, decoded);
        assertTrue(decoded.name().isEmpty());
        TransactionPacket last = decoded.packets().get(0);
        assertEquals(6, last.totalWritePosition());
        assertEquals(9, last.totalLength());
        assertArrayEquals(ascii("meta"), last.key().userData());
        assertEquals("first", decoded.packets().get(1).identifier().orElseThrow());
    }

    @Test
    void repeatedPacketContainersAreConcatenated() throws IOException {
        TransactionMessageCodec codec = new TransactionMessageCodec();
        TransactionKey key = TransactionKey.of("xfer-2");
        byte[] first = codec.encode(TransactionMessage.of(List.of(
                new TransactionPacket(key, ascii("ab"), null, 4, 0))));
        byte[] second = codec.encode(TransactionMessage.of(List.of(
                new TransactionPacket(key, ascii("cd"), null, 4, 2))));

        ByteArrayOutputStream joined = new ByteArrayOutputStream();
        joined.write(first);
        joined.write(second);

        TransactionMessage decoded = codec.decode(joined.toByteArray());

        assertEquals(2, decoded.packets().size());
        assertEquals(2, decoded.packets().get(1).totalWritePosition());
    }

    @Test
    void packetWithoutKeyIsMalformed() throws IOException {
        byte[] packet = raw(out -> {
            out.writeByteArray(2, ascii("abc"));
            out.writeUInt64(4, 3);
        });
        byte[] container = raw(out -> out.writeByteArray(1, packet));
        byte[] message = raw(out -> out.writeByteArray(2, container));

        assertThrows(MalformedPayloadException.class, () -> new TransactionMessageCodec().decode(message));
    }
}

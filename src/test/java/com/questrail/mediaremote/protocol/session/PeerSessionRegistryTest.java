package com.questrail.mediaremote.protocol.session;

import com.questrail.mediaremote.protocol.catalog.StandardMessageCatalog;
import com.questrail.mediaremote.protocol.codec.EnvelopeCodec;
import com.questrail.mediaremote.protocol.codec.impl.ProtobufEnvelopeWireFormat;
import com.questrail.mediaremote.protocol.model.ClientUpdatesConfig;
import com.questrail.mediaremote.protocol.model.UpdateCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PeerSessionRegistryTest {

    private static final PeerId A = PeerId.of("10.0.0.2:1000");
    private static final PeerId B = PeerId.of("10.0.0.3:1000");

    private final EnvelopeCodec codec = new EnvelopeCodec(StandardMessageCatalog.create());
    private final ProtobufEnvelopeWireFormat wire = new ProtobufEnvelopeWireFormat();

    private List<PeerSession> created;
    private PeerSessionRegistry registry;

    @BeforeEach
    void setUp() {
        created = new ArrayList<>();
        registry = new PeerSessionRegistry(peer -> {
            PeerSession session = PeerSession.builder(peer)
                    .withCodec(codec)
                    .withWireFormat(wire)
                    .build();
            created.add(session);
            return session;
        });
    }

    @Test
    void openedSessionIsFoundByPeer() {
        PeerSession session = registry.open(A);

        assertSame(session, registry.get(A).orElseThrow());
        assertTrue(registry.get(B).isEmpty());
        assertEquals(1, registry.size());
    }

    @Test
    void secondOpenForSamePeerFailsAndKeepsTheFirst() {
        PeerSession first = registry.open(A);

        assertThrows(IllegalStateException.class, () -> registry.open(A));

        assertSame(first, registry.get(A).orElseThrow());
        assertFalse(first.isClosed());
        assertTrue(created.get(1).isClosed());
    }

    @Test
    void closeRemovesAndClosesSession() {
        PeerSession session = registry.open(A);

        assertTrue(registry.close(A));
        assertFalse(registry.close(A));

        assertTrue(session.isClosed());
        assertEquals(0, registry.size());
    }

    @Test
    void closeAllClosesEverySession() {
        registry.open(A);
        registry.open(B);

        registry.closeAll();

        assertEquals(0, registry.size());
        created.forEach(s -> assertTrue(s.isClosed()));
    }

    @Test
    void notificationGateFollowsEachPeersInterest() {
        registry.open(A).onEnvelope(wire.encode(codec.encode(
                ClientUpdatesConfig.builder().nowPlaying(true).build())));
        registry.open(B);

        NotificationGate gate = registry;
        assertTrue(gate.isInterested(A, UpdateCategory.NOW_PLAYING));
        assertFalse(gate.isInterested(B, UpdateCategory.NOW_PLAYING));
        assertFalse(gate.isInterested(PeerId.of("unknown:1"), UpdateCategory.NOW_PLAYING));
    }

    @Test
    void peerIdMustNotBeBlank() {
        assertThrows(IllegalArgumentException.class, () -> PeerId.of(""));
    }
}

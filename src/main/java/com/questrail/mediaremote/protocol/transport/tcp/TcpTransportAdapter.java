package com.questrail.mediaremote.protocol.transport.tcp;

import com.questrail.mediaremote.protocol.config.MediaRemoteRuntimeConfig;
import com.questrail.mediaremote.protocol.internal.time.MonotonicClock;
import com.questrail.mediaremote.protocol.internal.time.MonotonicScheduler;
import com.questrail.mediaremote.protocol.internal.time.WallClock;
import com.questrail.mediaremote.protocol.model.ProtocolPayload;
import com.questrail.mediaremote.protocol.model.TransactionKey;
import com.questrail.mediaremote.protocol.model.UpdateCategory;
import com.questrail.mediaremote.protocol.observability.MediaRemoteObservabilitySink;
import com.questrail.mediaremote.protocol.observability.TransportObservabilityEvent;
import com.questrail.mediaremote.protocol.session.PeerId;
import com.questrail.mediaremote.protocol.session.PeerSession;
import com.questrail.mediaremote.protocol.session.PeerSessionRegistry;
import com.questrail.mediaremote.protocol.transport.MessageEndpoint;
import com.questrail.mediaremote.protocol.transport.MessageEndpointListener;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * TcpTransportAdapter
 * =============================================================================
 * Translation layer between a {@link MessageEndpoint} and the peer sessions.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   MessageEndpoint
 *        → onPeerConnected   → PeerSessionRegistry.open (+ expiry sweeps)
 *        → onMessage         → PeerSession.onEnvelope
 *        → onPeerDisconnected → PeerSessionRegistry.close
 * </pre>
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   payload → PeerSession.encode / fragment → MessageEndpoint.send
 * </pre>
 *
 * <h2>Violation policy</h2>
 * Sessions never close a connection themselves. When
 * {@link MediaRemoteRuntimeConfig#maxViolationsPerPeer()} is non-zero this
 * adapter disconnects a peer whose session reaches that many violations.
 */
public class TcpTransportAdapter implements MessageEndpointListener {

    private final MessageEndpoint endpoint;
    private final PeerSessionRegistry registry;
    private final MediaRemoteRuntimeConfig config;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final MediaRemoteObservabilitySink sink;
    private final WallClock wallClock;

    public TcpTransportAdapter(MessageEndpoint endpoint,
                               PeerSessionRegistry registry,
                               MediaRemoteRuntimeConfig config,
                               MonotonicScheduler scheduler,
                               MonotonicClock clock,
                               MediaRemoteObservabilitySink sink,
                               WallClock wallClock) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.config = Objects.requireNonNull(config, "config");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.endpoint.setListener(this);
    }

    // -------------------------------------------------------------------------
    // Transport Listener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        report(TransportObservabilityEvent.Kind.ENDPOINT_STARTED, null,
                "listening on " + endpoint.localAddress());
    }

    @Override
    public void onTransportDown(Throwable cause) {
        registry.closeAll();
        report(TransportObservabilityEvent.Kind.ENDPOINT_STOPPED, null,
                cause == null ? "stopped" : String.valueOf(cause));
    }

    @Override
    public void onPeerConnected(PeerId peer, SocketAddress remote) {
        PeerSession session = registry.open(peer);
        session.startExpirySweeps(scheduler, clock, config.expirySweepInterval());
        report(TransportObservabilityEvent.Kind.PEER_CONNECTED, peer, String.valueOf(remote));
    }

    @Override
    public void onPeerDisconnected(PeerId peer, Throwable cause) {
        registry.close(peer);
        report(TransportObservabilityEvent.Kind.PEER_DISCONNECTED, peer,
                cause == null ? "closed" : String.valueOf(cause));
    }

    @Override
    public void onMessage(PeerId peer, byte[] message) {
        Optional<PeerSession> session = registry.get(peer);
        if (session.isEmpty()) {
            // Raced with a disconnect; nothing left to feed.
            return;
        }

        PeerSession s = session.get();
        s.onEnvelope(message);

        int limit = config.maxViolationsPerPeer();
        if (limit > 0 && s.violationCount() >= limit) {
            endpoint.disconnect(peer);
        }
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    /**
     * Sends one payload to a connected peer.
     *
     * @return {@code false} if the peer has no session or the endpoint dropped the message
     */
    public boolean send(PeerId peer, ProtocolPayload payload) {
        Objects.requireNonNull(payload, "payload");

        Optional<PeerSession> session = registry.get(peer);
        if (session.isEmpty()) {
            return false;
        }
        return endpoint.send(peer, session.get().encode(payload));
    }

    /**
     * Sends a push update only if the peer subscribed to its category.
     */
    public boolean sendIfInterested(PeerId peer, UpdateCategory category, ProtocolPayload payload) {
        if (!registry.isInterested(peer, category)) {
            return false;
        }
        return send(peer, payload);
    }

    /**
     * Sends a large blob as a chunked transaction, one carrier per fragment.
     *
     * @return {@code false} if the peer has no session or any fragment was dropped
     */
    public boolean sendChunked(PeerId peer, TransactionKey key, byte[] blob) {
        Optional<PeerSession> session = registry.get(peer);
        if (session.isEmpty()) {
            return false;
        }

        boolean allSent = true;
        for (byte[] carrier : session.get().fragment(key, blob, config.maxFragmentSize())) {
            allSent &= endpoint.send(peer, carrier);
        }
        return allSent;
    }

    private void report(TransportObservabilityEvent.Kind kind, PeerId peer, String detail) {
        sink.onTransportEvent(new TransportObservabilityEvent(wallClock.now(), kind, peer, detail));
    }
}

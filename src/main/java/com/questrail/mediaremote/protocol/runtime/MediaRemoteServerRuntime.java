package com.questrail.mediaremote.protocol.runtime;

import com.questrail.mediaremote.protocol.catalog.MessageCatalog;
import com.questrail.mediaremote.protocol.catalog.StandardMessageCatalog;
import com.questrail.mediaremote.protocol.codec.EnvelopeCodec;
import com.questrail.mediaremote.protocol.codec.EnvelopeWireFormat;
import com.questrail.mediaremote.protocol.codec.impl.ProtobufEnvelopeWireFormat;
import com.questrail.mediaremote.protocol.config.MediaRemoteRuntimeConfig;
import com.questrail.mediaremote.protocol.internal.time.MonotonicClock;
import com.questrail.mediaremote.protocol.internal.time.MonotonicScheduler;
import com.questrail.mediaremote.protocol.internal.time.ScheduledExecutorScheduler;
import com.questrail.mediaremote.protocol.internal.time.SystemMonotonicClock;
import com.questrail.mediaremote.protocol.internal.time.SystemWallClock;
import com.questrail.mediaremote.protocol.internal.time.WallClock;
import com.questrail.mediaremote.protocol.observability.MediaRemoteObservabilitySink;
import com.questrail.mediaremote.protocol.observability.NullObservabilitySink;
import com.questrail.mediaremote.protocol.session.NotificationGate;
import com.questrail.mediaremote.protocol.session.PayloadListener;
import com.questrail.mediaremote.protocol.session.PeerSession;
import com.questrail.mediaremote.protocol.session.PeerSessionListener;
import com.questrail.mediaremote.protocol.session.PeerSessionRegistry;
import com.questrail.mediaremote.protocol.transport.MessageEndpoint;
import com.questrail.mediaremote.protocol.transport.tcp.TcpTransportAdapter;
import com.questrail.mediaremote.protocol.transport.tcp.netty.NettyTcpMessageEndpoint;

import java.net.SocketAddress;
import java.util.Objects;

/**
 * MediaRemoteServerRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a media remote server.
 *
 * <h2>Architectural Role</h2>
 * Wiring only. It builds the shared, stateless pieces once (catalog, codec,
 * wire format), hands the registry a factory for per-peer sessions, and
 * connects the registry to the transport through {@link TcpTransportAdapter}.
 * No protocol semantics live here.
 *
 * <h2>Defaults</h2>
 * Without overrides the runtime uses the standard catalog, a Netty TCP
 * endpoint on {@link MediaRemoteRuntimeConfig#bindAddress()}, the system
 * clocks and a private single-threaded scheduler for expiry sweeps. Tests
 * substitute the endpoint, clock and scheduler.
 */
public final class MediaRemoteServerRuntime {
    private final MessageEndpoint endpoint;
    private final PeerSessionRegistry registry;
    private final TcpTransportAdapter adapter;
    private final AutoCloseable ownedScheduler;

    private MediaRemoteServerRuntime(MessageEndpoint endpoint,
                                     PeerSessionRegistry registry,
                                     TcpTransportAdapter adapter,
                                     AutoCloseable ownedScheduler) {
        this.endpoint = endpoint;
        this.registry = registry;
        this.adapter = adapter;
        this.ownedScheduler = ownedScheduler;
    }

    public void start() {
        endpoint.start();
    }

    /**
     * Stops the endpoint (which closes every session) and then the scheduler.
     */
    public void stop() {
        endpoint.stop();
        registry.closeAll();
        if (ownedScheduler != null) {
            try {
                ownedScheduler.close();
            } catch (Exception e) {
                throw new IllegalStateException("Failed to stop the expiry scheduler", e);
            }
        }
    }

    public SocketAddress localAddress() {
        return endpoint.localAddress();
    }

    public PeerSessionRegistry sessions() {
        return registry;
    }

    public NotificationGate notificationGate() {
        return registry;
    }

    public TcpTransportAdapter transport() {
        return adapter;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private MediaRemoteRuntimeConfig config = MediaRemoteRuntimeConfig.defaults();
        private MessageCatalog catalog;
        private EnvelopeWireFormat wireFormat = new ProtobufEnvelopeWireFormat();
        private MessageEndpoint endpoint;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private PayloadListener payloadListener = (peer, message) -> { };
        private PeerSessionListener sessionListener = PeerSessionListener.NONE;
        private MediaRemoteObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withConfig(MediaRemoteRuntimeConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Catalog to decode with. Defaults to {@link StandardMessageCatalog#create()}.
         */
        public Builder withCatalog(MessageCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder withWireFormat(EnvelopeWireFormat wireFormat) {
            this.wireFormat = wireFormat;
            return this;
        }

        /**
         * Transport to use instead of a Netty endpoint on the configured bind address.
         */
        public Builder withEndpoint(MessageEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Scheduler for expiry sweeps. The caller keeps ownership.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withPayloadListener(PayloadListener listener) {
            this.payloadListener = listener;
            return this;
        }

        public Builder withSessionListener(PeerSessionListener listener) {
            this.sessionListener = listener;
            return this;
        }

        public Builder withObservabilitySink(MediaRemoteObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public MediaRemoteServerRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(wireFormat, "wireFormat");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(payloadListener, "payloadListener");
            Objects.requireNonNull(sessionListener, "sessionListener");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            // 1. Shared, stateless protocol pieces
            EnvelopeCodec codec = new EnvelopeCodec(catalog != null ? catalog : StandardMessageCatalog.create());

            // 2. One session per peer, nothing shared between them
            PeerSessionRegistry registry = new PeerSessionRegistry(peer -> PeerSession.builder(peer)
                    .withCodec(codec)
                    .withWireFormat(wireFormat)
                    .withConfig(config)
                    .withClock(clock)
                    .withWallClock(wallClock)
                    .withPayloadListener(payloadListener)
                    .withSessionListener(sessionListener)
                    .withObservabilitySink(observabilitySink)
                    .build());

            // 3. Timing
            MonotonicScheduler sweepScheduler = scheduler;
            ScheduledExecutorScheduler owned = null;
            if (sweepScheduler == null) {
                owned = ScheduledExecutorScheduler.singleThreaded("mediaremote-expiry", clock);
                sweepScheduler = owned;
            }

            // 4. Transport
            MessageEndpoint ep = (endpoint != null) ? endpoint : new NettyTcpMessageEndpoint(config.bindAddress(), config.maxFrameLength());
            TcpTransportAdapter adapter = new TcpTransportAdapter(
                    ep, registry, config, sweepScheduler, clock, observabilitySink, wallClock);

            return new MediaRemoteServerRuntime(ep, registry, adapter, owned);
        }
    }
}

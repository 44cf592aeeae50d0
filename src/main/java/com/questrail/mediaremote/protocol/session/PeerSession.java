package com.questrail.mediaremote.protocol.session;

import com.questrail.mediaremote.protocol.codec.DecodedMessage;
import com.questrail.mediaremote.protocol.codec.Envelope;
import com.questrail.mediaremote.protocol.codec.EnvelopeCodec;
import com.questrail.mediaremote.protocol.codec.EnvelopeWireFormat;
import com.questrail.mediaremote.protocol.codec.MalformedPayloadException;
import com.questrail.mediaremote.protocol.config.MediaRemoteRuntimeConfig;
import com.questrail.mediaremote.protocol.internal.devices.DeviceSetNegotiator;
import com.questrail.mediaremote.protocol.internal.devices.NegotiationResult;
import com.questrail.mediaremote.protocol.internal.interest.UpdateInterestSet;
import com.questrail.mediaremote.protocol.internal.interest.UpdateInterestTracker;
import com.questrail.mediaremote.protocol.internal.reassembly.AbortReason;
import com.questrail.mediaremote.protocol.internal.reassembly.ReassemblyOutcome;
import com.questrail.mediaremote.protocol.internal.reassembly.TransactionAbortedException;
import com.questrail.mediaremote.protocol.internal.reassembly.TransactionFragment;
import com.questrail.mediaremote.protocol.internal.reassembly.TransactionFragmenter;
import com.questrail.mediaremote.protocol.internal.reassembly.TransactionReassembler;
import com.questrail.mediaremote.protocol.internal.time.Cancellable;
import com.questrail.mediaremote.protocol.internal.time.MonotonicClock;
import com.questrail.mediaremote.protocol.internal.time.MonotonicScheduler;
import com.questrail.mediaremote.protocol.internal.time.SystemMonotonicClock;
import com.questrail.mediaremote.protocol.internal.time.SystemWallClock;
import com.questrail.mediaremote.protocol.internal.time.WallClock;
import com.questrail.mediaremote.protocol.model.ClientUpdatesConfig;
import com.questrail.mediaremote.protocol.model.ModifyOutputContextRequest;
import com.questrail.mediaremote.protocol.model.ProtocolPayload;
import com.questrail.mediaremote.protocol.model.TransactionKey;
import com.questrail.mediaremote.protocol.model.TransactionMessage;
import com.questrail.mediaremote.protocol.model.TransactionPacket;
import com.questrail.mediaremote.protocol.model.UpdateCategory;
import com.questrail.mediaremote.protocol.observability.DeviceSetChangedEvent;
import com.questrail.mediaremote.protocol.observability.InterestChangedEvent;
import com.questrail.mediaremote.protocol.observability.MediaRemoteErrorEvent;
import com.questrail.mediaremote.protocol.observability.MediaRemoteObservabilitySink;
import com.questrail.mediaremote.protocol.observability.MessageRejectedEvent;
import com.questrail.mediaremote.protocol.observability.NullObservabilitySink;
import com.questrail.mediaremote.protocol.observability.TransactionAbortedEvent;
import com.questrail.mediaremote.protocol.observability.TransactionCompletedEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * PeerSession
 * =============================================================================
 * Per-connection context: owns one peer's reassembly, interest and device
 * state and routes each decoded payload to it.
 *
 * <h2>Inbound data flow</h2>
 * <pre>
 *   bytes ─▶ EnvelopeWireFormat ─▶ EnvelopeCodec ─▶ DecodedMessage
 *              │
 *              ├─ TransactionMessage ─▶ TransactionReassembler ─▶ blob
 *              │                                     └──▶ (second decode pass)
 *              ├─ ClientUpdatesConfig ─▶ UpdateInterestTracker ─▶ deliver
 *              ├─ ModifyOutputContextRequest ─▶ DeviceSetNegotiator ─▶ deliver
 *              └─ anything else (typed or opaque) ─▶ deliver
 * </pre>
 *
 * <h2>Errors</h2>
 * Nothing here closes the connection. A malformed message is rejected on its
 * own; a transaction violation aborts that transaction only. Both are
 * reported to the observability sink and counted in
 * {@link #violationCount()} so the transport may decide to drop a peer that
 * misbehaves repeatedly.
 *
 * <h2>Execution model</h2>
 * Inbound calls are expected from one thread at a time (the connection's
 * event loop) so that messages are handled in arrival order. Expiry sweeps
 * may run on a scheduler thread; the owned components serialize their own
 * state.
 *
 * <h2>Isolation</h2>
 * Nothing is shared between sessions. Each peer gets its own reassembler,
 * tracker and negotiator.
 */
public final class PeerSession implements AutoCloseable
{
    private final PeerId peer;
    private final EnvelopeCodec codec;
    private final EnvelopeWireFormat wireFormat;
    private final TransactionReassembler reassembler;
    private final UpdateInterestTracker interest = new UpdateInterestTracker();
    private final DeviceSetNegotiator devices = new DeviceSetNegotiator();
    private final PayloadListener payloadListener;
    private final PeerSessionListener sessionListener;
    private final MediaRemoteObservabilitySink sink;
    private final WallClock wallClock;

    private final AtomicLong violations = new AtomicLong();

    private volatile Cancellable expirySweep;
    private volatile boolean closed;

    private PeerSession(Builder b) {
        this.peer = Objects.requireNonNull(b.peer, "peer");
        this.codec = Objects.requireNonNull(b.codec, "codec");
        this.wireFormat = Objects.requireNonNull(b.wireFormat, "wireFormat");
        this.payloadListener = Objects.requireNonNull(b.payloadListener, "payloadListener");
        this.sessionListener = Objects.requireNonNull(b.sessionListener, "sessionListener");
        this.sink = Objects.requireNonNull(b.sink, "sink");
        this.wallClock = Objects.requireNonNull(b.wallClock, "wallClock");
        this.reassembler = new TransactionReassembler(
                Objects.requireNonNull(b.clock, "clock"),
                b.config.reassemblyTtl(),
                b.config.maxTransactionLength());
    }

    public PeerId peer() {
        return peer;
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    /**
     * Handles one deframed envelope.
     */
    public void onEnvelope(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (closed) {
            return;
        }

        Envelope envelope;
        try {
            envelope = wireFormat.decode(bytes);
        } catch (MalformedPayloadException e) {
            reject(OptionalInt.empty(), e);
            return;
        }
        onEnvelope(envelope);
    }

    public void onEnvelope(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        if (closed) {
            return;
        }

        DecodedMessage decoded;
        try {
            decoded = codec.decode(envelope);
        } catch (MalformedPayloadException e) {
            reject(OptionalInt.of(envelope.tag()), e);
            return;
        }
        route(decoded);
    }

    /**
     * Handles one fragment that the transport classified as such, or that was
     * unpacked from a transaction carrier.
     */
    public void onFragment(TransactionFragment fragment) {
        Objects.requireNonNull(fragment, "fragment");
        if (closed) {
            return;
        }

        ReassemblyOutcome outcome;
        try {
            outcome = reassembler.submit(fragment);
        } catch (TransactionAbortedException e) {
            violations.incrementAndGet();
            reportAborted(e.key(), e.reason(), e.getMessage());
            return;
        }

        if (outcome instanceof ReassemblyOutcome.Complete complete) {
            sink.onTransactionCompleted(new TransactionCompletedEvent(
                    wallClock.now(), peer, complete.key(), complete.length()));
            // The reassembled blob is itself an envelope.
            onEnvelope(complete.blob());
        }
    }

    private void route(DecodedMessage decoded) {
        if (decoded instanceof DecodedMessage.Typed typed) {
            ProtocolPayload payload = typed.payload();

            if (payload instanceof TransactionMessage transaction) {
                for (TransactionPacket packet : transaction.packets()) {
                    onFragment(TransactionFragment.fromPacket(packet));
                }
                return;
            }
            if (payload instanceof ClientUpdatesConfig config) {
                applyInterest(config);
            } else if (payload instanceof ModifyOutputContextRequest request) {
                applyDevices(request);
            }
        }
        deliver(decoded);
    }

    private void applyInterest(ClientUpdatesConfig config) {
        UpdateInterestSet previous = interest.current();
        UpdateInterestSet current = interest.apply(config);
        if (!current.equals(previous)) {
            sink.onInterestChanged(new InterestChangedEvent(wallClock.now(), peer, previous, current));
            notifyListener(() -> sessionListener.onInterestChanged(peer, previous, current));
        }
    }

    private void applyDevices(ModifyOutputContextRequest request) {
        NegotiationResult result = devices.apply(request);
        if (result.changed()) {
            sink.onDeviceSetChanged(new DeviceSetChangedEvent(wallClock.now(), peer, result));
            notifyListener(() -> sessionListener.onDeviceSetChanged(peer, result));
        }
    }

    private void deliver(DecodedMessage decoded) {
        notifyListener(() -> payloadListener.onPayload(peer, decoded));
    }

    /**
     * Listener failures are application defects; they are reported and must
     * not take the connection down.
     */
    private void notifyListener(Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            sink.onError(new MediaRemoteErrorEvent(
                    wallClock.now(), "Listener failed for peer " + peer, e));
        }
    }

    private void reject(OptionalInt tag, MalformedPayloadException e) {
        violations.incrementAndGet();
        sink.onMessageRejected(new MessageRejectedEvent(wallClock.now(), peer, tag, e.getMessage(), e));
    }

    private void reportAborted(TransactionKey key, AbortReason reason, String detail) {
        sink.onTransactionAborted(new TransactionAbortedEvent(wallClock.now(), peer, key, reason, detail));
    }

    // -------------------------------------------------------------------------
    // Transaction lifecycle
    // -------------------------------------------------------------------------

    /**
     * Aborts transactions that have been silent for longer than the TTL.
     *
     * @return keys of the evicted transactions
     */
    public List<TransactionKey> expireTransactions() {
        List<TransactionKey> evicted = reassembler.expire();
        for (TransactionKey key : evicted) {
            reportAborted(key, AbortReason.TIMEOUT, "no fragment within " + reassembler.ttl());
        }
        return evicted;
    }

    /**
     * Runs {@link #expireTransactions()} every {@code interval} until the session closes.
     */
    public void startExpirySweeps(MonotonicScheduler scheduler, MonotonicClock clock, Duration interval) {
        Objects.requireNonNull(scheduler, "scheduler");
        if (closed || expirySweep != null) {
            throw new IllegalStateException("Expiry sweeps cannot be started for " + peer);
        }
        expirySweep = scheduler.scheduleRepeating(interval, clock, this::expireTransactions);
    }

    /**
     * Discards one transaction on explicit request from the peer.
     */
    public boolean cancelTransaction(TransactionKey key) {
        boolean cancelled = reassembler.cancel(key);
        if (cancelled) {
            reportAborted(key, AbortReason.CANCELLED, "cancelled by peer");
        }
        return cancelled;
    }

    /**
     * Connection teardown: stops sweeps and discards every open transaction.
     * Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        Cancellable sweep = expirySweep;
        if (sweep != null) {
            sweep.cancel();
        }
        for (TransactionKey key : reassembler.cancelAll()) {
            reportAborted(key, AbortReason.CONNECTION_CLOSED, "connection closed");
        }
    }

    public boolean isClosed() {
        return closed;
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    /**
     * Encodes one payload to envelope bytes ready for framing.
     */
    public byte[] encode(ProtocolPayload payload) {
        return wireFormat.encode(codec.encode(payload));
    }

    /**
     * Splits a large blob into transaction carrier envelopes, in send order.
     */
    public List<byte[]> fragment(TransactionKey key, byte[] blob, int maxFragmentSize) {
        List<TransactionFragment> fragments = TransactionFragmenter.split(key, blob, maxFragmentSize);
        List<byte[]> messages = new ArrayList<>(fragments.size());
        for (TransactionMessage carrier : TransactionFragmenter.carriers(fragments)) {
            messages.add(encode(carrier));
        }
        return messages;
    }

    // -------------------------------------------------------------------------
    // Queries
    // -------------------------------------------------------------------------

    public boolean isInterested(UpdateCategory category) {
        return interest.isInterested(category);
    }

    public UpdateInterestSet interest() {
        return interest.current();
    }

    public Set<String> endpointDevices() {
        return devices.endpointDevices();
    }

    public Set<String> clusterDevices() {
        return devices.clusterDevices();
    }

    public long violationCount() {
        return violations.get();
    }

    public int pendingTransactionCount() {
        return reassembler.pendingCount();
    }

    public long retainedTransactionBytes() {
        return reassembler.retainedBytes();
    }

    TransactionReassembler reassembler() {
        return reassembler;
    }

    @Override
    public String toString() {
        return "PeerSession[" + peer + (closed ? ", closed" : "") + "]";
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static Builder builder(PeerId peer) {
        return new Builder(peer);
    }

    public static final class Builder {
        private final PeerId peer;
        private EnvelopeCodec codec;
        private EnvelopeWireFormat wireFormat;
        private MediaRemoteRuntimeConfig config = MediaRemoteRuntimeConfig.defaults();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private PayloadListener payloadListener = (p, m) -> { };
        private PeerSessionListener sessionListener = PeerSessionListener.NONE;
        private MediaRemoteObservabilitySink sink = NullObservabilitySink.INSTANCE;

        private Builder(PeerId peer) {
            this.peer = peer;
        }

        public Builder withCodec(EnvelopeCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder withWireFormat(EnvelopeWireFormat wireFormat) {
            this.wireFormat = wireFormat;
            return this;
        }

        public Builder withConfig(MediaRemoteRuntimeConfig config) {
            this.config = Objects.requireNonNull(config, "config");
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

        public Builder withPayloadListener(PayloadListener payloadListener) {
            this.payloadListener = payloadListener;
            return this;
        }

        public Builder withSessionListener(PeerSessionListener sessionListener) {
            this.sessionListener = sessionListener;
            return this;
        }

        public Builder withObservabilitySink(MediaRemoteObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        public PeerSession build() {
            return new PeerSession(this);
        }
    }
}

package com.questrail.mediaremote.protocol.config;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for the media remote runtime.
 *
 * @param reassemblyTtl        silence after which an accumulating transaction is aborted
 * @param expirySweepInterval  how often each session looks for expired transactions
 * @param maxTransactionLength largest declared total length a peer may announce
 * @param maxFragmentSize      largest fragment produced when splitting outbound payloads
 * @param bindAddress          address the TCP endpoint listens on
 * @param maxViolationsPerPeer protocol violations after which a peer is disconnected;
 *                             {@code 0} keeps misbehaving peers connected
 * @param maxFrameLength       largest inbound frame the TCP endpoint accepts; a longer
 *                             length prefix closes the connection
 */
public record MediaRemoteRuntimeConfig(
    Duration reassemblyTtl,
    Duration expirySweepInterval,
    int maxTransactionLength,
    int maxFragmentSize,
    InetSocketAddress bindAddress,
    int maxViolationsPerPeer,
    int maxFrameLength
) {
    public static final Duration DEFAULT_REASSEMBLY_TTL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_EXPIRY_SWEEP_INTERVAL = Duration.ofSeconds(1);
    public static final int DEFAULT_MAX_TRANSACTION_LENGTH = 16 * 1024 * 1024;
    public static final int DEFAULT_MAX_FRAGMENT_SIZE = 64 * 1024;
    // Room for carrier headers around a maximal fragment.
    public static final int DEFAULT_MAX_FRAME_LENGTH = DEFAULT_MAX_TRANSACTION_LENGTH + 64 * 1024;

    public MediaRemoteRuntimeConfig {
        Objects.requireNonNull(reassemblyTtl, "reassemblyTtl");
        Objects.requireNonNull(expirySweepInterval, "expirySweepInterval");
        Objects.requireNonNull(bindAddress, "bindAddress");

        requirePositive(reassemblyTtl, "reassemblyTtl");
        requirePositive(expirySweepInterval, "expirySweepInterval");
        if (maxTransactionLength <= 0) {
            throw new IllegalArgumentException("maxTransactionLength must be > 0");
        }
        if (maxFragmentSize <= 0) {
            throw new IllegalArgumentException("maxFragmentSize must be > 0");
        }
        if (maxViolationsPerPeer < 0) {
            throw new IllegalArgumentException("maxViolationsPerPeer must be >= 0");
        }
        if (maxFrameLength <= 0) {
            throw new IllegalArgumentException("maxFrameLength must be > 0");
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be > 0 (was " + value + ")");
        }
    }

    public static MediaRemoteRuntimeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration reassemblyTtl = DEFAULT_REASSEMBLY_TTL;
        private Duration expirySweepInterval = DEFAULT_EXPIRY_SWEEP_INTERVAL;
        private int maxTransactionLength = DEFAULT_MAX_TRANSACTION_LENGTH;
        private int maxFragmentSize = DEFAULT_MAX_FRAGMENT_SIZE;
        private InetSocketAddress bindAddress = new InetSocketAddress(0);
        private int maxViolationsPerPeer = 0;
        private int maxFrameLength = DEFAULT_MAX_FRAME_LENGTH;

        public Builder withReassemblyTtl(Duration reassemblyTtl) {
            this.reassemblyTtl = reassemblyTtl;
            return this;
        }

        public Builder withExpirySweepInterval(Duration expirySweepInterval) {
            this.expirySweepInterval = expirySweepInterval;
            return this;
        }

        public Builder withMaxTransactionLength(int maxTransactionLength) {
            this.maxTransactionLength = maxTransactionLength;
            return this;
        }

        public Builder withMaxFragmentSize(int maxFragmentSize) {
            this.maxFragmentSize = maxFragmentSize;
            return this;
        }

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withMaxViolationsPerPeer(int maxViolationsPerPeer) {
            this.maxViolationsPerPeer = maxViolationsPerPeer;
            return this;
        }

        public Builder withMaxFrameLength(int maxFrameLength) {
            this.maxFrameLength = maxFrameLength;
            return this;
        }

        public MediaRemoteRuntimeConfig build() {
            return new MediaRemoteRuntimeConfig(
                    reassemblyTtl,
                    expirySweepInterval,
                    maxTransactionLength,
                    maxFragmentSize,
                    bindAddress,
                    maxViolationsPerPeer,
                    maxFrameLength);
        }
    }
}

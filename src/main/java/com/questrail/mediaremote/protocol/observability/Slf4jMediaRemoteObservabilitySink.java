package com.questrail.mediaremote.protocol.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of MediaRemoteObservabilitySink that emits logs via SLF4J.
 *
 * <p>Completions and subscription changes log at DEBUG, aborted transactions and
 * rejected messages at WARN, transport lifecycle at INFO, failures at ERROR.</p>
 */
public final class Slf4jMediaRemoteObservabilitySink implements MediaRemoteObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jMediaRemoteObservabilitySink.class);

    @Override
    public void onTransactionCompleted(TransactionCompletedEvent event) {
        log.debug("{}: transaction {} complete ({} bytes)",
            event.peer(), event.key(), event.length());
    }

    @Override
    public void onTransactionAborted(TransactionAbortedEvent event) {
        log.warn("{}: transaction {} aborted ({}): {}",
            event.peer(), event.key(), event.reason(), event.detail());
    }

    @Override
    public void onMessageRejected(MessageRejectedEvent event) {
        if (event.tag().isPresent()) {
            log.warn("{}: rejected message with tag {}: {}",
                event.peer(), event.tag().getAsInt(), event.reason());
        } else {
            log.warn("{}: rejected unreadable envelope: {}", event.peer(), event.reason());
        }
        log.debug("Rejection cause", event.cause());
    }

    @Override
    public void onInterestChanged(InterestChangedEvent event) {
        log.debug("{}: update interest {} -> {}",
            event.peer(), event.previous().enabled(), event.current().enabled());
    }

    @Override
    public void onDeviceSetChanged(DeviceSetChangedEvent event) {
        log.debug("{}: endpoint devices {}, cluster devices {}",
            event.peer(), event.result().endpoint(), event.result().cluster());
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        if (event.peer() == null) {
            log.info("Transport {}: {}", event.kind(), event.detail());
        } else {
            log.info("Transport {} {}: {}", event.kind(), event.peer(), event.detail());
        }
    }

    @Override
    public void onError(MediaRemoteErrorEvent event) {
        log.error("MediaRemote error: {}", event.message(), event.cause());
    }
}

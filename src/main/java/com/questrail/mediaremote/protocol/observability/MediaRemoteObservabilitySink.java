package com.questrail.mediaremote.protocol.observability;

/**
 * Receives protocol events from peer sessions and the transport.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Methods are called on the thread that produced the event (a connection
 * event loop or the expiry scheduler) and must not block.</p>
 */
public interface MediaRemoteObservabilitySink {

    /**
     * A chunked transfer was fully reassembled.
     */
    void onTransactionCompleted(TransactionCompletedEvent event);

    /**
     * A chunked transfer was discarded: protocol violation, TTL expiry,
     * cancellation or connection teardown.
     */
    void onTransactionAborted(TransactionAbortedEvent event);

    /**
     * One inbound message was rejected; the connection stays up.
     */
    void onMessageRejected(MessageRejectedEvent event);

    void onInterestChanged(InterestChangedEvent event);

    void onDeviceSetChanged(DeviceSetChangedEvent event);

    /**
     * Transport lifecycle: endpoint started or stopped, peer connected or disconnected.
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * An unexpected failure, for example a listener that threw.
     */
    void onError(MediaRemoteErrorEvent event);
}

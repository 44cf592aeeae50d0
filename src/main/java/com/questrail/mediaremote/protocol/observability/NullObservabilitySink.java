package com.questrail.mediaremote.protocol.observability;

/**
 * No-op implementation of MediaRemoteObservabilitySink.
 */
public final class NullObservabilitySink implements MediaRemoteObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTransactionCompleted(TransactionCompletedEvent event) {}

    @Override
    public void onTransactionAborted(TransactionAbortedEvent event) {}

    @Override
    public void onMessageRejected(MessageRejectedEvent event) {}

    @Override
    public void onInterestChanged(InterestChangedEvent event) {}

    @Override
    public void onDeviceSetChanged(DeviceSetChangedEvent event) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onError(MediaRemoteErrorEvent event) {}
}

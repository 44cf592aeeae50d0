package com.questrail.mediaremote.protocol.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements MediaRemoteObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onTransactionCompleted(TransactionCompletedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransactionAborted(TransactionAbortedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onMessageRejected(MessageRejectedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onInterestChanged(InterestChangedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onDeviceSetChanged(DeviceSetChangedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(TransportObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(MediaRemoteErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}

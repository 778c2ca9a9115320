package com.questrail.remotephysics.protocol.app.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements AppObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onMessageDropped(AppDropEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(AppTransportEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(AppErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<AppDropEvent> getDrops() {
        return ofType(AppDropEvent.class);
    }

    public synchronized List<AppErrorEvent> getErrors() {
        return ofType(AppErrorEvent.class);
    }

    public synchronized List<AppTransportEvent> getTransportEvents() {
        return ofType(AppTransportEvent.class);
    }

    public synchronized boolean hasTransportState(AppTransportEvent.State state) {
        return getTransportEvents().stream().anyMatch(e -> e.state() == state);
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    private <T> List<T> ofType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}

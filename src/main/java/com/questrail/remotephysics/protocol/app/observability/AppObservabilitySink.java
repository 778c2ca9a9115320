package com.questrail.remotephysics.protocol.app.observability;

/**
 * Main interface for receiving APP observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Sinks are called from codec, channel and messenger threads alike and
 * must be thread-safe. They must not throw.</p>
 */
public interface AppObservabilitySink {
    /**
     * Called when an inbound packet is discarded by the decoder.
     * @param event the drop details
     */
    void onMessageDropped(AppDropEvent event);

    /**
     * Called when a packet channel connects, disconnects or closes.
     * @param event the transport event
     */
    void onTransportEvent(AppTransportEvent event);

    /**
     * Called when an error or anomaly occurs in the APP stack.
     * @param event the error event
     */
    void onError(AppErrorEvent event);
}

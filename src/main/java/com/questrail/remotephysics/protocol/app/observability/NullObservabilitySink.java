package com.questrail.remotephysics.protocol.app.observability;

/**
 * No-op implementation of AppObservabilitySink.
 */
public final class NullObservabilitySink implements AppObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onMessageDropped(AppDropEvent event) {}

    @Override
    public void onTransportEvent(AppTransportEvent event) {}

    @Override
    public void onError(AppErrorEvent event) {}
}

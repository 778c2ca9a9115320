package com.questrail.remotephysics.protocol.app.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of AppObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jAppObservabilitySink implements AppObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jAppObservabilitySink.class);

    @Override
    public void onMessageDropped(AppDropEvent event) {
        if (event.reason() == AppDropReason.UNKNOWN_TYPE) {
            log.debug("APP message type {} ignored ({} bytes)", event.messageType(), event.packetLength());
            return;
        }
        log.warn("APP message dropped: {} type={} length={} {}",
            event.reason(),
            event.messageType(),
            event.packetLength(),
            event.detail());
    }

    @Override
    public void onTransportEvent(AppTransportEvent event) {
        if (event.cause() != null) {
            log.warn("APP Transport {}: {} ({})", event.channel(), event.state(), event.cause().toString());
        }
        else {
            log.info("APP Transport {}: {}", event.channel(), event.state());
        }
    }

    @Override
    public void onError(AppErrorEvent event) {
        log.error("APP Error: {}", event.message(), event.cause());
    }
}

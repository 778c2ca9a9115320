package com.questrail.remotephysics.api;

/**
 * Notified when the remote engine rejects a message.
 *
 * <p>The referenced index is the {@code msgIndex} header value of the
 * offending outbound message. Remote errors are never raised locally as
 * exceptions.</p>
 */
@FunctionalInterface
public interface RemoteEngineErrorListener {
    void onRemoteEngineError(int messageIndex, String reason);
}

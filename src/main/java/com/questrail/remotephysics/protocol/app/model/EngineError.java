package com.questrail.remotephysics.protocol.app.model;

import java.util.Objects;

/**
 * Error report from the remote engine.
 *
 * <p>{@code referencedIndex} is the {@code msgIndex} of the message that the
 * engine could not process. The reason occupies a fixed 256-byte field on the
 * wire; longer text is truncated on encode.</p>
 */
public record EngineError(int referencedIndex, String reason) implements AppMessage
{
    public EngineError {
        Objects.requireNonNull(reason, "reason");
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.ERROR;
    }
}

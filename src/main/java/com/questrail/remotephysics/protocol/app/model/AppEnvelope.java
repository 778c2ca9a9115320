package com.questrail.remotephysics.protocol.app.model;

import java.util.Objects;

/**
 * A decoded message together with the header it arrived with.
 */
public record AppEnvelope(AppHeader header, AppMessage message)
{
    public AppEnvelope {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(message, "message");
    }
}

package com.questrail.remotephysics.protocol.app.transport.tcp;

/**
 * Thrown when a byte stream declares a message length that cannot be valid.
 *
 * <p>Once this happens the message boundaries of the stream are lost and the
 * connection cannot be resynchronized.</p>
 */
public final class StreamFramingException extends Exception
{
    public StreamFramingException(String message)
    {
        super(message);
    }
}

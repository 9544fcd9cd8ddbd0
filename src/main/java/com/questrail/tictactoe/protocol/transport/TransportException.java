package com.questrail.tictactoe.protocol.transport;

/**
 * A stream could not be established, written, or accepted in time.
 */
public final class TransportException extends RuntimeException
{
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}

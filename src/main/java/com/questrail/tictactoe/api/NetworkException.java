package com.questrail.tictactoe.api;

/**
 * Raised to the caller of an operation that needed the peer when the peer is
 * gone: send failure, closed channel, or role handshake timeout.
 */
public final class NetworkException extends GameException
{
    public NetworkException(String message)
    {
        super(message);
    }

    public NetworkException(String message, Throwable cause)
    {
        super(message, cause);
    }
}

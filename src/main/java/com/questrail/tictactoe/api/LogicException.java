package com.questrail.tictactoe.api;

/**
 * Indicates a programming or protocol error rather than a user mistake,
 * for example a move outside the grid or a message for the wrong symbol.
 *
 * <p>Never retried. Whoever detects it propagates it; a channel whose handler
 * raises it is closed.</p>
 */
public final class LogicException extends GameException
{
    public LogicException(String message)
    {
        super(message);
    }

    public LogicException(String message, Throwable cause)
    {
        super(message, cause);
    }
}

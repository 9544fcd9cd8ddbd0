package com.questrail.tictactoe.api;

/**
 * Root of the game's unchecked exception hierarchy.
 *
 * <ul>
 *   <li>{@link InvalidMoveException}: recoverable rule violation, stays local</li>
 *   <li>{@link LogicException}: a bug or protocol violation, fatal to the session</li>
 *   <li>{@link NetworkException}: the peer is unreachable or the channel is closed</li>
 * </ul>
 */
public class GameException extends RuntimeException
{
    public GameException(String message)
    {
        super(message);
    }

    public GameException(String message, Throwable cause)
    {
        super(message, cause);
    }
}

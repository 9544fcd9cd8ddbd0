package com.questrail.tictactoe.api;

import java.util.Objects;

/**
 * A move that breaks a game rule: wrong turn, occupied cell, or finished game.
 */
public final class InvalidMoveException extends GameException
{
    private final MoveError error;

    public InvalidMoveException(MoveError error)
    {
        super(Objects.requireNonNull(error, "error").description());
        this.error = error;
    }

    public MoveError error()
    {
        return error;
    }
}

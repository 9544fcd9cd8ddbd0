package com.questrail.tictactoe.api;

/**
 * Recoverable rule violations. The offending participant is re-prompted.
 */
public enum MoveError
{
    NOT_YOUR_TURN("Not your turn"),
    CELL_OCCUPIED("Cell occupied"),
    GAME_OVER("Game over");

    private final String description;

    MoveError(String description)
    {
        this.description = description;
    }

    public String description()
    {
        return description;
    }
}

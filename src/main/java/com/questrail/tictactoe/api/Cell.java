package com.questrail.tictactoe.api;

/**
 * Grid coordinate, zero-based.
 */
public record Cell(int row, int col)
{
    public boolean inBounds()
    {
        return row >= 0 && row < BoardSnapshot.SIZE && col >= 0 && col < BoardSnapshot.SIZE;
    }
}

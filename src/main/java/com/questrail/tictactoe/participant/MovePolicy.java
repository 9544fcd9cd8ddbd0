package com.questrail.tictactoe.participant;

import com.questrail.tictactoe.api.BoardSnapshot;
import com.questrail.tictactoe.api.Cell;
import com.questrail.tictactoe.api.Symbol;

import java.util.Optional;

/**
 * Chooses a cell for {@code player} on {@code board}.
 */
@FunctionalInterface
public interface MovePolicy
{
    /**
     * @return the chosen empty cell, or empty if the board has none
     */
    Optional<Cell> chooseMove(BoardSnapshot board, Symbol player);
}

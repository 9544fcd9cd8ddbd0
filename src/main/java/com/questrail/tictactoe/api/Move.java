package com.questrail.tictactoe.api;

import java.util.Objects;

/**
 * A request by {@code player} to mark the cell at ({@code row}, {@code col}).
 *
 * <p>Coordinates are not range-checked here; bounds are a rule of the board and
 * an out-of-range move is reported by the board as a {@link LogicException}.</p>
 */
public record Move(Symbol player, int row, int col)
{
    public Move {
        Objects.requireNonNull(player, "player");
    }
}

package com.questrail.tictactoe.core;

import com.questrail.tictactoe.api.BoardSnapshot;
import com.questrail.tictactoe.api.Cell;
import com.questrail.tictactoe.api.InvalidMoveException;
import com.questrail.tictactoe.api.LogicException;
import com.questrail.tictactoe.api.Move;
import com.questrail.tictactoe.api.MoveError;
import com.questrail.tictactoe.api.Symbol;

import java.util.Objects;
import java.util.Optional;

/**
 * Board
 * -----------------------------------------------------------------------------
 * Mutable game state: the grid, the symbol whose turn it is, and the winner.
 *
 * <p>Changed only through {@link #apply(Move)} (authoritative play) or
 * {@link #restore(BoardSnapshot, Symbol, Symbol)} (mirroring a peer). Not
 * thread-safe; {@link TurnEngine} serializes access.</p>
 */
public final class Board
{
    private BoardSnapshot cells = BoardSnapshot.empty();
    private Symbol currentPlayer = Symbol.X;
    private Symbol winner;

    /**
     * Validate and apply {@code move}, then advance the turn.
     *
     * <p>Checks run in this order and the first failure wins:</p>
     * <ol>
     *   <li>the mover owns the current turn, else {@link MoveError#NOT_YOUR_TURN}</li>
     *   <li>the cell is on the grid, else {@link LogicException}</li>
     *   <li>the cell is empty, else {@link MoveError#CELL_OCCUPIED}</li>
     *   <li>nobody has won yet, else {@link MoveError#GAME_OVER}</li>
     * </ol>
     *
     * @throws InvalidMoveException for a recoverable rule violation; state is unchanged
     * @throws LogicException if the cell is outside the grid; state is unchanged
     */
    public void apply(Move move)
    {
        Objects.requireNonNull(move, "move");

        if (move.player() != currentPlayer) {
            throw new InvalidMoveException(MoveError.NOT_YOUR_TURN);
        }

        Cell cell = new Cell(move.row(), move.col());
        if (!cell.inBounds()) {
            throw new LogicException("Move (" + move.row() + ", " + move.col() + ") is outside the board");
        }

        if (!cells.isEmpty(cell.row(), cell.col())) {
            throw new InvalidMoveException(MoveError.CELL_OCCUPIED);
        }

        if (winner != null) {
            throw new InvalidMoveException(MoveError.GAME_OVER);
        }

        cells = cells.with(cell, move.player());
        winner = cells.winner().orElse(null);
        currentPlayer = currentPlayer.opponent();
    }

    /**
     * Replace the whole state with one received from the authoritative peer.
     */
    public void restore(BoardSnapshot snapshot, Symbol currentPlayer, Symbol winner)
    {
        this.cells = Objects.requireNonNull(snapshot, "snapshot");
        this.currentPlayer = Objects.requireNonNull(currentPlayer, "currentPlayer");
        this.winner = winner;
    }

    public BoardSnapshot snapshot()
    {
        return cells;
    }

    public Symbol currentPlayer()
    {
        return currentPlayer;
    }

    public Optional<Symbol> winner()
    {
        return Optional.ofNullable(winner);
    }

    public boolean isFinished()
    {
        return winner != null || cells.isFull();
    }
}

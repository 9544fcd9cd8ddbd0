package com.questrail.tictactoe.participant;

import com.questrail.tictactoe.api.BoardSnapshot;
import com.questrail.tictactoe.api.Cell;
import com.questrail.tictactoe.api.Symbol;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class MovePolicyTest
{
    private static final Symbol X = Symbol.X;
    private static final Symbol O = Symbol.O;

    private final MinimaxMovePolicy minimax = new MinimaxMovePolicy();

    private static List<Symbol> row(Symbol... cells)
    {
        return Arrays.asList(cells);
    }

    /**
     * Plays a full game between two policies and returns the final board.
     */
    private static BoardSnapshot play(MovePolicy xPolicy, MovePolicy oPolicy)
    {
        BoardSnapshot board = BoardSnapshot.empty();
        Symbol toMove = X;
        int moves = 0;
        while (!board.isFinished()) {
            MovePolicy policy = toMove == X ? xPolicy : oPolicy;
            Cell cell = policy.chooseMove(board, toMove).orElseThrow();
            assertTrue(board.isEmpty(cell.row(), cell.col()));
            board = board.with(cell, toMove);
            toMove = toMove.opponent();
            moves++;
        }
        assertTrue(moves <= 9);
        return board;
    }

    @Test
    void minimaxTakesAnImmediateWin()
    {
        BoardSnapshot board = BoardSnapshot.ofRows(List.of(
                row(X, X, null),
                row(O, O, null),
                row(null, null, null)));

        assertEquals(Optional.of(new Cell(0, 2)), minimax.chooseMove(board, X));
        assertEquals(Optional.of(new Cell(1, 2)), minimax.chooseMove(board, O));
    }

    @Test
    void minimaxBlocksTheOpponent()
    {
        BoardSnapshot board = BoardSnapshot.ofRows(List.of(
                row(X, null, null),
                row(null, O, null),
                row(null, null, X)));
        BoardSnapshot threatened = board.with(new Cell(0, 1), X);

        assertEquals(Optional.of(new Cell(0, 2)), minimax.chooseMove(threatened, O));
    }

    @Test
    void minimaxIsDeterministicOnTies()
    {
        assertEquals(Optional.of(new Cell(0, 0)), minimax.chooseMove(BoardSnapshot.empty(), X));
    }

    @Test
    void nothingToChooseOnAFinishedBoard()
    {
        BoardSnapshot full = BoardSnapshot.ofRows(List.of(
                row(X, O, X),
                row(X, O, O),
                row(O, X, X)));

        assertTrue(minimax.chooseMove(full, X).isEmpty());
        assertTrue(new RandomMovePolicy(new Random(1)).chooseMove(full, X).isEmpty());
    }

    @Test
    void minimaxAgainstMinimaxIsADraw()
    {
        BoardSnapshot end = play(minimax, minimax);

        assertTrue(end.isDraw(), end.toString());
    }

    @Test
    void minimaxNeverLosesToRandom()
    {
        for (long seed = 0; seed < 20; seed++) {
            RandomMovePolicy random = new RandomMovePolicy(new Random(seed));
            assertNotEquals(Optional.of(O), play(minimax, random).winner(), "seed " + seed);
            assertNotEquals(Optional.of(X), play(random, minimax).winner(), "seed " + seed);
        }
    }

    @Test
    void randomAgainstRandomFinishesWithinNineMoves()
    {
        for (long seed = 0; seed < 100; seed++) {
            Random r = new Random(seed);
            BoardSnapshot end = play(new RandomMovePolicy(r), new RandomMovePolicy(r));
            assertTrue(end.winner().isPresent() || end.isDraw());
            assertTrue(end.occupiedCount() <= 9);
        }
    }
}

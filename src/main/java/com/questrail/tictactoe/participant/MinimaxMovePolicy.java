package com.questrail.tictactoe.participant;

import com.questrail.tictactoe.api.BoardSnapshot;
import com.questrail.tictactoe.api.Cell;
import com.questrail.tictactoe.api.Symbol;

import java.util.Optional;

/**
 * Optimal play by minimax with alpha-beta pruning.
 *
 * <p>Faster wins score higher and slower losses score lower. Ties go to the
 * first cell in row-major order, so the policy is deterministic.</p>
 */
public final class MinimaxMovePolicy implements MovePolicy
{
    private static final int WIN = 10;

    @Override
    public Optional<Cell> chooseMove(BoardSnapshot board, Symbol player)
    {
        if (board.isFinished()) {
            return Optional.empty();
        }

        Cell best = null;
        int bestScore = Integer.MIN_VALUE;
        int alpha = Integer.MIN_VALUE + 1;
        int beta = Integer.MAX_VALUE;

        for (Cell cell : board.emptyCells()) {
            int score = -negamax(board.with(cell, player), player.opponent(), 1, -beta, -alpha);
            if (score > bestScore) {
                bestScore = score;
                best = cell;
            }
            alpha = Math.max(alpha, score);
        }
        return Optional.ofNullable(best);
    }

    // Score from the point of view of toMove.
    private int negamax(BoardSnapshot board, Symbol toMove, int depth, int alpha, int beta)
    {
        Optional<Symbol> winner = board.winner();
        if (winner.isPresent()) {
            return winner.get() == toMove ? WIN - depth : depth - WIN;
        }
        if (board.isFull()) {
            return 0;
        }

        int best = Integer.MIN_VALUE + 1;
        for (Cell cell : board.emptyCells()) {
            int score = -negamax(board.with(cell, toMove), toMove.opponent(), depth + 1, -beta, -alpha);
            if (score > best) {
                best = score;
            }
            if (best > alpha) {
                alpha = best;
            }
            if (alpha >= beta) {
                break;
            }
        }
        return best;
    }
}

package com.questrail.tictactoe.participant;

import com.questrail.tictactoe.api.BoardSnapshot;
import com.questrail.tictactoe.api.Cell;
import com.questrail.tictactoe.api.Symbol;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Picks uniformly among the empty cells.
 */
public final class RandomMovePolicy implements MovePolicy
{
    private final Random random;

    public RandomMovePolicy()
    {
        this(new Random());
    }

    public RandomMovePolicy(Random random)
    {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public Optional<Cell> chooseMove(BoardSnapshot board, Symbol player)
    {
        List<Cell> free = board.emptyCells();
        if (free.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(free.get(random.nextInt(free.size())));
    }
}

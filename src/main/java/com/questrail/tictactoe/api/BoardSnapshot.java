package com.questrail.tictactoe.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * BoardSnapshot
 * -----------------------------------------------------------------------------
 * Immutable copy of the 3×3 grid. Empty cells are {@code null}.
 *
 * <p>Snapshots are what crosses every boundary: bus events, wire messages and
 * move policies all see snapshots, never the live {@code Board}.</p>
 */
public final class BoardSnapshot
{
    public static final int SIZE = 3;

    // 3 rows, 3 columns, 2 diagonals
    private static final int[][] LINES = {
            {0, 1, 2}, {3, 4, 5}, {6, 7, 8},
            {0, 3, 6}, {1, 4, 7}, {2, 5, 8},
            {0, 4, 8}, {2, 4, 6}
    };

    private static final BoardSnapshot EMPTY = new BoardSnapshot(new Symbol[SIZE * SIZE]);

    private final Symbol[] cells;

    private BoardSnapshot(Symbol[] cells)
    {
        this.cells = cells;
    }

    public static BoardSnapshot empty()
    {
        return EMPTY;
    }

    /**
     * Builds a snapshot from row-major rows; {@code null} entries are empty cells.
     *
     * @throws IllegalArgumentException if the shape is not 3×3
     */
    public static BoardSnapshot ofRows(List<? extends List<Symbol>> rows)
    {
        Objects.requireNonNull(rows, "rows");
        if (rows.size() != SIZE) {
            throw new IllegalArgumentException("Board must have " + SIZE + " rows (was " + rows.size() + ")");
        }
        Symbol[] cells = new Symbol[SIZE * SIZE];
        for (int r = 0; r < SIZE; r++) {
            List<Symbol> row = Objects.requireNonNull(rows.get(r), "row");
            if (row.size() != SIZE) {
                throw new IllegalArgumentException("Row " + r + " must have " + SIZE + " cells (was " + row.size() + ")");
            }
            for (int c = 0; c < SIZE; c++) {
                cells[r * SIZE + c] = row.get(c);
            }
        }
        return new BoardSnapshot(cells);
    }

    /**
     * Returns the symbol at the cell, or {@code null} if it is empty.
     *
     * @throws IndexOutOfBoundsException if the cell is outside the grid
     */
    public Symbol at(int row, int col)
    {
        if (!new Cell(row, col).inBounds()) {
            throw new IndexOutOfBoundsException("Cell (" + row + ", " + col + ") is outside the board");
        }
        return cells[row * SIZE + col];
    }

    public boolean isEmpty(int row, int col)
    {
        return at(row, col) == null;
    }

    /**
     * Returns a copy of this snapshot with {@code symbol} placed at the cell.
     */
    public BoardSnapshot with(Cell cell, Symbol symbol)
    {
        Objects.requireNonNull(symbol, "symbol");
        at(cell.row(), cell.col());
        Symbol[] copy = cells.clone();
        copy[cell.row() * SIZE + cell.col()] = symbol;
        return new BoardSnapshot(copy);
    }

    /**
     * A line wins if its three cells are non-empty and equal.
     */
    public Optional<Symbol> winner()
    {
        for (int[] line : LINES) {
            Symbol first = cells[line[0]];
            if (first != null && first == cells[line[1]] && first == cells[line[2]]) {
                return Optional.of(first);
            }
        }
        return Optional.empty();
    }

    public boolean isFull()
    {
        for (Symbol s : cells) {
            if (s == null) {
                return false;
            }
        }
        return true;
    }

    public boolean isDraw()
    {
        return isFull() && winner().isEmpty();
    }

    public boolean isFinished()
    {
        return isFull() || winner().isPresent();
    }

    /**
     * Empty cells in row-major order.
     */
    public List<Cell> emptyCells()
    {
        List<Cell> free = new ArrayList<>();
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] == null) {
                free.add(new Cell(i / SIZE, i % SIZE));
            }
        }
        return free;
    }

    public int occupiedCount()
    {
        int n = 0;
        for (Symbol s : cells) {
            if (s != null) {
                n++;
            }
        }
        return n;
    }

    /**
     * Row-major rows; inner lists may contain {@code null}.
     */
    public List<List<Symbol>> rows()
    {
        List<List<Symbol>> rows = new ArrayList<>(SIZE);
        for (int r = 0; r < SIZE; r++) {
            rows.add(Collections.unmodifiableList(Arrays.asList(Arrays.copyOfRange(cells, r * SIZE, (r + 1) * SIZE))));
        }
        return Collections.unmodifiableList(rows);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof BoardSnapshot that)) return false;
        return Arrays.equals(cells, that.cells);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(cells);
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder("BoardSnapshot[");
        for (int i = 0; i < cells.length; i++) {
            if (i > 0 && i % SIZE == 0) {
                sb.append('/');
            }
            sb.append(cells[i] == null ? "." : cells[i].name());
        }
        return sb.append(']').toString();
    }
}

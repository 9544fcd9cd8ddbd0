package com.questrail.tictactoe.api;

/**
 * The two marks a participant can own.
 *
 * <p>{@link #X} always opens the game; turns alternate strictly afterwards.</p>
 */
public enum Symbol
{
    X,
    O;

    /**
     * Returns the symbol owned by the other participant.
     */
    public Symbol opponent()
    {
        return this == X ? O : X;
    }

    /**
     * Parses the wire/text form ({@code "X"} or {@code "O"}).
     *
     * @throws IllegalArgumentException if {@code text} names no symbol
     */
    public static Symbol parse(String text)
    {
        if ("X".equals(text)) {
            return X;
        }
        if ("O".equals(text)) {
            return O;
        }
        throw new IllegalArgumentException("Unknown symbol: " + text);
    }
}

package com.questrail.tictactoe.protocol.model;

import com.questrail.tictactoe.api.BoardSnapshot;
import com.questrail.tictactoe.api.Symbol;

import java.util.Objects;

/**
 * Full authoritative state after a move (or at game start).
 *
 * @param winner {@code null} while the game is undecided
 */
public record StateUpdate(BoardSnapshot board, Symbol currentPlayer, Symbol winner) implements ProtocolMessage
{
    public StateUpdate {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(currentPlayer, "currentPlayer");
    }

    @Override
    public String type()
    {
        return MessageTypes.STATE_UPDATE;
    }
}

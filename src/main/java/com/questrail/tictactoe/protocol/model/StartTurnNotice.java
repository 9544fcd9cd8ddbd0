package com.questrail.tictactoe.protocol.model;

import com.questrail.tictactoe.api.BoardSnapshot;
import com.questrail.tictactoe.api.Symbol;

import java.util.Objects;

/**
 * The relay peer's symbol may move now.
 */
public record StartTurnNotice(Symbol player, BoardSnapshot board) implements ProtocolMessage
{
    public StartTurnNotice {
        Objects.requireNonNull(player, "player");
        Objects.requireNonNull(board, "board");
    }

    @Override
    public String type()
    {
        return MessageTypes.START_TURN;
    }
}

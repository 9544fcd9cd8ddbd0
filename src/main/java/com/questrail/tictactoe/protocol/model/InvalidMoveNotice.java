package com.questrail.tictactoe.protocol.model;

import com.questrail.tictactoe.api.MoveError;
import com.questrail.tictactoe.api.Symbol;

import java.util.Objects;

/**
 * The authoritative engine rejected a relayed {@link MoveRequest}.
 */
public record InvalidMoveNotice(Symbol player, int row, int col, MoveError error, String message)
        implements ProtocolMessage
{
    public InvalidMoveNotice {
        Objects.requireNonNull(player, "player");
        Objects.requireNonNull(error, "error");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String type()
    {
        return MessageTypes.INVALID_MOVE;
    }
}

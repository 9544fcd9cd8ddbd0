package com.questrail.tictactoe.protocol.model;

import com.questrail.tictactoe.api.Symbol;

import java.util.Objects;

/**
 * A move made on the relay peer, to be applied by the authoritative peer.
 */
public record MoveRequest(Symbol player, int row, int col) implements ProtocolMessage
{
    public MoveRequest {
        Objects.requireNonNull(player, "player");
    }

    @Override
    public String type()
    {
        return MessageTypes.MOVE_REQUEST;
    }
}

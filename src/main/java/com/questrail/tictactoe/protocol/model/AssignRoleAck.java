package com.questrail.tictactoe.protocol.model;

import com.questrail.tictactoe.api.Symbol;

import java.util.Objects;

/**
 * Confirms an {@link AssignRole}; echoes the adopted symbol so both peers can
 * check they agree.
 */
public record AssignRoleAck(Symbol symbol) implements ProtocolMessage
{
    public AssignRoleAck {
        Objects.requireNonNull(symbol, "symbol");
    }

    @Override
    public String type()
    {
        return MessageTypes.ASSIGN_ROLE_ACK;
    }
}

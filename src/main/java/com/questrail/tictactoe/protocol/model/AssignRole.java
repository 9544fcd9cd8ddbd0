package com.questrail.tictactoe.protocol.model;

import com.questrail.tictactoe.api.Symbol;

import java.util.Objects;

/**
 * Tells the peer which symbol it owns. Sent once, before any gameplay message.
 */
public record AssignRole(Symbol symbol) implements ProtocolMessage
{
    public AssignRole {
        Objects.requireNonNull(symbol, "symbol");
    }

    @Override
    public String type()
    {
        return MessageTypes.ASSIGN_ROLE;
    }
}

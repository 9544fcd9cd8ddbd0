package com.questrail.tictactoe.protocol.internal.encode;

import com.questrail.tictactoe.api.BoardSnapshot;
import com.questrail.tictactoe.api.Symbol;
import com.questrail.tictactoe.protocol.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ProtocolMessageEncoder
 * ============================================================================
 * Converts a semantic {@link ProtocolMessage} into a wire-adjacent {@link Frame}.
 *
 * <h2>Architectural Role</h2>
 * The outbound pipeline is:
 *
 * <pre>
 *   ProtocolMessage  ->  Frame  ->  byte[]
 *         (this)        (frame encoder)
 * </pre>
 *
 * <h2>Field conventions</h2>
 * <ul>
 *   <li>Symbols are written as {@code "X"} / {@code "O"}</li>
 *   <li>Boards are three rows of three cells, empty cells as JSON {@code null}</li>
 *   <li>Error kinds are written as the {@code MoveError} constant name</li>
 * </ul>
 */
public final class ProtocolMessageEncoder
{
    public Frame encode(ProtocolMessage message)
    {
        Objects.requireNonNull(message, "message");

        if (message instanceof AssignRole m) {
            return Frame.builder(m.type())
                    .put("symbol", symbol(m.symbol()))
                    .build();
        }
        else if (message instanceof AssignRoleAck m) {
            return Frame.builder(m.type())
                    .put("symbol", symbol(m.symbol()))
                    .build();
        }
        else if (message instanceof MoveRequest m) {
            return Frame.builder(m.type())
                    .put("player", symbol(m.player()))
                    .put("row", m.row())
                    .put("col", m.col())
                    .build();
        }
        else if (message instanceof StateUpdate m) {
            return Frame.builder(m.type())
                    .put("board", board(m.board()))
                    .put("current_player", symbol(m.currentPlayer()))
                    .put("winner", m.winner() == null ? null : symbol(m.winner()))
                    .build();
        }
        else if (message instanceof StartTurnNotice m) {
            return Frame.builder(m.type())
                    .put("player", symbol(m.player()))
                    .put("board", board(m.board()))
                    .build();
        }
        else if (message instanceof InvalidMoveNotice m) {
            return Frame.builder(m.type())
                    .put("player", symbol(m.player()))
                    .put("row", m.row())
                    .put("col", m.col())
                    .put("error", m.error().name())
                    .put("message", m.message())
                    .build();
        }

        // Unreachable while ProtocolMessage stays sealed.
        throw new IllegalArgumentException("Unsupported message: " + message.getClass().getName());
    }

    private static String symbol(Symbol symbol)
    {
        return symbol.name();
    }

    private static List<List<String>> board(BoardSnapshot board)
    {
        List<List<String>> rows = new ArrayList<>(BoardSnapshot.SIZE);
        for (List<Symbol> row : board.rows()) {
            List<String> cells = new ArrayList<>(BoardSnapshot.SIZE);
            for (Symbol cell : row) {
                cells.add(cell == null ? null : symbol(cell));
            }
            rows.add(cells);
        }
        return rows;
    }
}

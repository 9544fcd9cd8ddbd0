package com.questrail.tictactoe.protocol.internal.decode;

import com.questrail.tictactoe.api.BoardSnapshot;
import com.questrail.tictactoe.api.MoveError;
import com.questrail.tictactoe.api.Symbol;
import com.questrail.tictactoe.protocol.model.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * ProtocolMessageDecoder
 * ============================================================================
 * Converts a {@link Frame} into a semantic {@link ProtocolMessage}.
 *
 * <h2>Architectural Role</h2>
 * This class is the boundary between JSON shapes and protocol meaning. The
 * network participants reason exclusively about {@link ProtocolMessage}.
 *
 * <h2>Strictness</h2>
 * Every message type has an exact field set. Decoding fails with
 * {@link ProtocolDecodeException} if:
 * <ul>
 *   <li>the type is unknown (including the reserved close type)</li>
 *   <li>a field is missing or not declared for the type</li>
 *   <li>a field has the wrong JSON type or an illegal value</li>
 * </ul>
 *
 * <h2>What this decoder does NOT do</h2>
 * <ul>
 *   <li>Parse JSON (see {@code DefaultFrameDecoder})</li>
 *   <li>Check game rules such as turn order or occupied cells</li>
 * </ul>
 */
public final class ProtocolMessageDecoder
{
    private static final Map<String, Set<String>> FIELDS = Map.of(
            MessageTypes.ASSIGN_ROLE, Set.of("symbol"),
            MessageTypes.ASSIGN_ROLE_ACK, Set.of("symbol"),
            MessageTypes.MOVE_REQUEST, Set.of("player", "row", "col"),
            MessageTypes.STATE_UPDATE, Set.of("board", "current_player", "winner"),
            MessageTypes.START_TURN, Set.of("player", "board"),
            MessageTypes.INVALID_MOVE, Set.of("player", "row", "col", "error", "message")
    );

    public ProtocolMessage decode(Frame frame)
    {
        Objects.requireNonNull(frame, "frame");

        final String type = frame.type();
        Set<String> expected = FIELDS.get(type);
        if (expected == null) {
            throw new ProtocolDecodeException("Unknown message type: " + type);
        }
        checkFieldSet(frame, expected);

        switch (type) {
            case MessageTypes.ASSIGN_ROLE:
                return new AssignRole(symbol(frame, "symbol"));
            case MessageTypes.ASSIGN_ROLE_ACK:
                return new AssignRoleAck(symbol(frame, "symbol"));
            case MessageTypes.MOVE_REQUEST:
                return new MoveRequest(symbol(frame, "player"), integer(frame, "row"), integer(frame, "col"));
            case MessageTypes.STATE_UPDATE:
                return new StateUpdate(board(frame, "board"),
                                       symbol(frame, "current_player"),
                                       nullableSymbol(frame, "winner"));
            case MessageTypes.START_TURN:
                return new StartTurnNotice(symbol(frame, "player"), board(frame, "board"));
            case MessageTypes.INVALID_MOVE:
                return new InvalidMoveNotice(symbol(frame, "player"),
                                             integer(frame, "row"),
                                             integer(frame, "col"),
                                             error(frame, "error"),
                                             string(frame, "message"));
            default:
                throw new ProtocolDecodeException("Unknown message type: " + type);
        }
    }

    private static void checkFieldSet(Frame frame, Set<String> expected)
    {
        for (String name : frame.fields().keySet()) {
            if (!Frame.TYPE_FIELD.equals(name) && !expected.contains(name)) {
                throw new ProtocolDecodeException("Unexpected field '" + name + "' in " + frame.type());
            }
        }
        for (String name : expected) {
            if (!frame.has(name)) {
                throw new ProtocolDecodeException("Missing field '" + name + "' in " + frame.type());
            }
        }
    }

    private static String string(Frame frame, String name)
    {
        Object value = frame.get(name);
        if (!(value instanceof String s)) {
            throw wrongType(frame, name, "a string");
        }
        return s;
    }

    private static Symbol symbol(Frame frame, String name)
    {
        return parseSymbol(frame, name, frame.get(name));
    }

    private static Symbol nullableSymbol(Frame frame, String name)
    {
        Object value = frame.get(name);
        return value == null ? null : parseSymbol(frame, name, value);
    }

    private static Symbol parseSymbol(Frame frame, String name, Object value)
    {
        if (!(value instanceof String s)) {
            throw wrongType(frame, name, "\"X\" or \"O\"");
        }
        try {
            return Symbol.parse(s);
        } catch (IllegalArgumentException e) {
            throw new ProtocolDecodeException("Field '" + name + "' in " + frame.type() + " is not a symbol: " + s, e);
        }
    }

    private static int integer(Frame frame, String name)
    {
        Object value = frame.get(name);
        if (value instanceof Integer i) {
            return i;
        }
        if (value instanceof Long || value instanceof BigInteger) {
            throw new ProtocolDecodeException("Field '" + name + "' in " + frame.type() + " is out of range: " + value);
        }
        throw wrongType(frame, name, "an integer");
    }

    private static MoveError error(Frame frame, String name)
    {
        String s = string(frame, name);
        try {
            return MoveError.valueOf(s);
        } catch (IllegalArgumentException e) {
            throw new ProtocolDecodeException("Field '" + name + "' in " + frame.type() + " is not a move error: " + s, e);
        }
    }

    private static BoardSnapshot board(Frame frame, String name)
    {
        Object value = frame.get(name);
        if (!(value instanceof List<?> rows) || rows.size() != BoardSnapshot.SIZE) {
            throw wrongType(frame, name, "a 3x3 array");
        }
        List<List<Symbol>> parsed = new ArrayList<>(BoardSnapshot.SIZE);
        for (Object row : rows) {
            if (!(row instanceof List<?> cells) || cells.size() != BoardSnapshot.SIZE) {
                throw wrongType(frame, name, "a 3x3 array");
            }
            List<Symbol> parsedRow = new ArrayList<>(BoardSnapshot.SIZE);
            for (Object cell : cells) {
                parsedRow.add(cell == null ? null : parseSymbol(frame, name, cell));
            }
            parsed.add(parsedRow);
        }
        return BoardSnapshot.ofRows(parsed);
    }

    private static ProtocolDecodeException wrongType(Frame frame, String name, String expected)
    {
        return new ProtocolDecodeException("Field '" + name + "' in " + frame.type() + " must be " + expected);
    }
}

package com.questrail.tictactoe.protocol.model;

import java.util.Set;

/**
 * Values of the {@code type} field used by the turn protocol.
 */
public final class MessageTypes
{
    public static final String ASSIGN_ROLE = "assign_role";
    public static final String ASSIGN_ROLE_ACK = "assign_role_ack";
    public static final String MOVE_REQUEST = "move_request";
    public static final String STATE_UPDATE = "state_update";
    public static final String START_TURN = "start_turn";
    public static final String INVALID_MOVE = "invalid_move";

    /**
     * Reserved for the channel's orderly-close signal. Consumed by the channel
     * itself; never dispatched to handlers or queued.
     */
    public static final String CLOSE = "__close__";

    public static final Set<String> PROTOCOL_TYPES = Set.of(
            ASSIGN_ROLE, ASSIGN_ROLE_ACK, MOVE_REQUEST, STATE_UPDATE, START_TURN, INVALID_MOVE);

    private MessageTypes() {}
}

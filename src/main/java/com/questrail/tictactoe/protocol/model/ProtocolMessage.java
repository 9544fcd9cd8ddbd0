package com.questrail.tictactoe.protocol.model;

/**
 * Semantic form of a turn-protocol message.
 *
 * <h2>Purpose</h2>
 * <p>
 * Everything above the channel (the network participants and their tests)
 * reasons about {@code ProtocolMessage} instances only. Field names, JSON
 * shapes and the {@code type} discriminator are resolved below, by
 * {@code ProtocolMessageEncoder} and {@code ProtocolMessageDecoder}.
 * </p>
 *
 * <h2>Directionality</h2>
 * <ul>
 *   <li>Host to client: {@link AssignRole}, {@link StateUpdate}, {@link StartTurnNotice}, {@link InvalidMoveNotice}</li>
 *   <li>Client to host: {@link AssignRoleAck}, {@link MoveRequest}</li>
 * </ul>
 */
public sealed interface ProtocolMessage
        permits AssignRole, AssignRoleAck, MoveRequest, StateUpdate, StartTurnNotice, InvalidMoveNotice
{
    /**
     * The wire discriminator for this message.
     */
    String type();
}

package com.questrail.tictactoe.participant;

import com.questrail.tictactoe.api.Symbol;
import com.questrail.tictactoe.bus.GameEvent.StartTurn;

/**
 * Participant
 * -----------------------------------------------------------------------------
 * One player of a game session, bound to a single {@link Symbol}.
 *
 * <p>Every variant does two things: it reacts when a turn starts, and it
 * eventually produces a {@code MoveRequested} for its symbol (from a human,
 * a move policy, or the network).</p>
 *
 * <p>Variants: {@link LocalParticipant}, {@link AiParticipant} and the two
 * network participants in {@code com.questrail.tictactoe.network}.</p>
 */
public interface Participant
{
    Symbol symbol();

    ParticipantRole role();

    /**
     * Called for every {@link StartTurn}; implementations ignore turns of the
     * other symbol.
     */
    void onStartTurn(StartTurn event);
}

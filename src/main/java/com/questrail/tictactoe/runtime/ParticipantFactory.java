package com.questrail.tictactoe.runtime;

import com.questrail.tictactoe.api.Symbol;
import com.questrail.tictactoe.bus.EventBus;
import com.questrail.tictactoe.participant.Participant;

/**
 * Creates the player for one symbol on a session's bus.
 *
 * <p>Typically a constructor reference, e.g. {@code LocalParticipant::new}, or
 * {@code (bus, s) -> new AiParticipant(bus, s, new MinimaxMovePolicy())}.</p>
 */
@FunctionalInterface
public interface ParticipantFactory
{
    Participant create(EventBus bus, Symbol symbol);
}

package com.questrail.tictactoe.participant;

import com.questrail.tictactoe.api.Symbol;
import com.questrail.tictactoe.bus.EventBus;
import com.questrail.tictactoe.bus.GameEvent.EnableInput;
import com.questrail.tictactoe.bus.GameEvent.InputError;
import com.questrail.tictactoe.bus.GameEvent.InvalidMove;
import com.questrail.tictactoe.bus.GameEvent.MoveRequested;
import com.questrail.tictactoe.bus.GameEvent.StartTurn;

import java.util.Objects;

/**
 * Human player on the peer that owns the engine.
 *
 * <p>Translates turn and rejection events for its symbol into the front-end
 * events {@link EnableInput} and {@link InputError}. Front ends submit the
 * chosen cell through {@link #requestMove(int, int)}.</p>
 */
public final class LocalParticipant implements Participant
{
    private final EventBus bus;
    private final Symbol symbol;

    public LocalParticipant(EventBus bus, Symbol symbol)
    {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.symbol = Objects.requireNonNull(symbol, "symbol");

        bus.subscribe(StartTurn.class, this::onStartTurn);
        bus.subscribe(InvalidMove.class, this::onInvalidMove);
    }

    @Override
    public Symbol symbol()
    {
        return symbol;
    }

    @Override
    public ParticipantRole role()
    {
        return ParticipantRole.LOCAL_AUTHORITATIVE;
    }

    @Override
    public void onStartTurn(StartTurn event)
    {
        if (event.player() != symbol) {
            return;
        }
        bus.publish(new EnableInput(symbol));
    }

    private void onInvalidMove(InvalidMove event)
    {
        if (event.player() != symbol) {
            return;
        }
        bus.publish(new InputError(symbol, event.message()));
    }

    /**
     * Publish a move for this participant's symbol on the calling thread.
     */
    public void requestMove(int row, int col)
    {
        bus.publish(new MoveRequested(symbol, row, col));
    }
}

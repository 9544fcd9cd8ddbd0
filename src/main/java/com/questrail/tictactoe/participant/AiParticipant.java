package com.questrail.tictactoe.participant;

import com.questrail.tictactoe.api.Cell;
import com.questrail.tictactoe.api.LogicException;
import com.questrail.tictactoe.api.Symbol;
import com.questrail.tictactoe.bus.EventBus;
import com.questrail.tictactoe.bus.GameEvent.DecisionDue;
import com.questrail.tictactoe.bus.GameEvent.MoveRequested;
import com.questrail.tictactoe.bus.GameEvent.StartTurn;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Computer player driven by a {@link MovePolicy}.
 *
 * <p>A turn for this symbol is handed to the bus worker as a
 * {@link DecisionDue}; the policy runs there and the chosen move is published
 * from the worker. The thread that started the turn, possibly a channel
 * reader, is never held up by the search.</p>
 *
 * <p>A policy that finds no move on an open board is a {@link LogicException};
 * on the worker it is logged by the bus and no move is published.</p>
 */
public final class AiParticipant implements Participant
{
    private static final Logger log = LoggerFactory.getLogger(AiParticipant.class);

    private final EventBus bus;
    private final Symbol symbol;
    private final MovePolicy policy;

    public AiParticipant(EventBus bus, Symbol symbol, MovePolicy policy)
    {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.policy = Objects.requireNonNull(policy, "policy");

        bus.subscribe(StartTurn.class, this::onStartTurn);
        bus.subscribe(DecisionDue.class, this::onDecisionDue);
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
        bus.publishAsync(new DecisionDue(symbol, event.board()));
    }

    private void onDecisionDue(DecisionDue event)
    {
        if (event.player() != symbol) {
            return;
        }

        Cell cell = policy.chooseMove(event.board(), symbol)
                .orElseThrow(() -> new LogicException("No moves available for " + symbol + ", but the game is not over"));

        log.debug("{} plays ({}, {})", symbol, cell.row(), cell.col());
        bus.publish(new MoveRequested(symbol, cell.row(), cell.col()));
    }
}

package com.questrail.tictactoe.core;

import com.questrail.tictactoe.api.BoardSnapshot;
import com.questrail.tictactoe.api.InvalidMoveException;
import com.questrail.tictactoe.api.NetworkException;
import com.questrail.tictactoe.api.Symbol;
import com.questrail.tictactoe.bus.EventBus;
import com.questrail.tictactoe.bus.GameEvent;
import com.questrail.tictactoe.bus.GameEvent.InvalidMove;
import com.questrail.tictactoe.bus.GameEvent.MoveRequested;
import com.questrail.tictactoe.bus.GameEvent.SessionEnded;
import com.questrail.tictactoe.bus.GameEvent.StartTurn;
import com.questrail.tictactoe.bus.GameEvent.StateUpdated;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * TurnEngine
 * =============================================================================
 * Owner of one peer's {@link Board}. Every peer has exactly one engine.
 *
 * <h2>Authoritative mode</h2>
 * The engine subscribes to {@link MoveRequested}, applies the move and publishes
 * {@link StateUpdated} followed by {@link StartTurn} for the next player (the
 * latter only while the game is undecided). A rejected move publishes
 * {@link InvalidMove}, followed by a repeat {@link StartTurn} if the rejected
 * player holds the turn. A move outside the grid is not retried: the
 * {@code LogicException} propagates to whoever published the request.
 *
 * <p>Once a {@link SessionEnded} has been seen the board is frozen: further
 * requests raise {@link NetworkException} before anything is applied or
 * published.</p>
 *
 * <h2>Mirror mode</h2>
 * Used by the peer that does not own the game. The engine never applies moves;
 * it adopts every {@link StateUpdated} relayed from the authoritative peer.
 *
 * <p>State changes happen under the engine's lock; events are published after
 * the lock is released so subscribers may call back into the engine.</p>
 */
public final class TurnEngine
{
    private static final Logger log = LoggerFactory.getLogger(TurnEngine.class);

    public enum Mode
    {
        AUTHORITATIVE,
        MIRROR
    }

    private final EventBus bus;
    private final Mode mode;
    private final Board board = new Board();
    private final Object lock = new Object();

    private int appliedMoves;
    private String endedReason;

    private TurnEngine(EventBus bus, Mode mode)
    {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.mode = Objects.requireNonNull(mode, "mode");

        if (mode == Mode.AUTHORITATIVE) {
            bus.subscribe(MoveRequested.class, this::onMoveRequested);
            bus.subscribe(SessionEnded.class, this::onSessionEnded);
        } else {
            bus.subscribe(StateUpdated.class, this::onStateRelayed);
        }
    }

    public static TurnEngine authoritative(EventBus bus)
    {
        return new TurnEngine(bus, Mode.AUTHORITATIVE);
    }

    public static TurnEngine mirror(EventBus bus)
    {
        return new TurnEngine(bus, Mode.MIRROR);
    }

    /**
     * Announce the initial board and the first turn. No-op in mirror mode.
     */
    public void start()
    {
        if (mode != Mode.AUTHORITATIVE) {
            return;
        }
        List<GameEvent> initial;
        synchronized (lock) {
            initial = currentStateEvents();
        }
        publishAll(initial);
    }

    private void onMoveRequested(MoveRequested request)
    {
        List<GameEvent> toPublish;
        synchronized (lock) {
            if (endedReason != null) {
                throw new NetworkException("Session ended (" + endedReason + "); " + request + " not applied");
            }
            try {
                board.apply(request.toMove());
                appliedMoves++;
                log.debug("Applied {} (move {}), board {}", request, appliedMoves, board.snapshot());
                toPublish = currentStateEvents();
            } catch (InvalidMoveException e) {
                log.debug("Rejected {}: {}", request, e.error());
                toPublish = new ArrayList<>();
                toPublish.add(InvalidMove.of(request, e.error()));
                if (request.player() == board.currentPlayer()) {
                    startTurnIfOpen().ifPresent(toPublish::add);
                }
            }
        }
        publishAll(toPublish);
    }

    private void onSessionEnded(SessionEnded event)
    {
        synchronized (lock) {
            if (endedReason == null) {
                endedReason = event.reason();
                log.info("Session ended ({}), board frozen at {}", event.reason(), board.snapshot());
            }
        }
    }

    private void onStateRelayed(StateUpdated update)
    {
        synchronized (lock) {
            board.restore(update.board(), update.currentPlayer(), update.winner());
            appliedMoves = update.board().occupiedCount();
        }
    }

    // Caller holds the lock.
    private List<GameEvent> currentStateEvents()
    {
        List<GameEvent> events = new ArrayList<>(2);
        events.add(new StateUpdated(board.snapshot(), board.currentPlayer(), board.winner().orElse(null)));
        startTurnIfOpen().ifPresent(events::add);
        return events;
    }

    private Optional<GameEvent> startTurnIfOpen()
    {
        if (board.isFinished()) {
            return Optional.empty();
        }
        return Optional.of(new StartTurn(board.currentPlayer(), board.snapshot()));
    }

    private void publishAll(List<GameEvent> events)
    {
        for (GameEvent event : events) {
            bus.publish(event);
        }
    }

    public Mode mode()
    {
        return mode;
    }

    public BoardSnapshot snapshot()
    {
        synchronized (lock) {
            return board.snapshot();
        }
    }

    public Symbol currentPlayer()
    {
        synchronized (lock) {
            return board.currentPlayer();
        }
    }

    public Optional<Symbol> winner()
    {
        synchronized (lock) {
            return board.winner();
        }
    }

    public boolean isGameOver()
    {
        synchronized (lock) {
            return board.isFinished();
        }
    }

    /**
     * Number of moves applied (authoritative) or observed (mirror).
     */
    public int appliedMoves()
    {
        synchronized (lock) {
            return appliedMoves;
        }
    }
}

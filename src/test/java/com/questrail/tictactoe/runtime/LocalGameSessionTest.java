package com.questrail.tictactoe.runtime;

import com.questrail.tictactoe.api.Symbol;
import com.questrail.tictactoe.bus.EventRecorder;
import com.questrail.tictactoe.bus.GameEvent.EnableInput;
import com.questrail.tictactoe.bus.GameEvent.InputError;
import com.questrail.tictactoe.bus.GameEvent.InvalidMove;
import com.questrail.tictactoe.bus.GameEvent.MoveRequested;
import com.questrail.tictactoe.bus.GameEvent.StateUpdated;
import com.questrail.tictactoe.core.TurnEngine;
import com.questrail.tictactoe.participant.AiParticipant;
import com.questrail.tictactoe.participant.LocalParticipant;
import com.questrail.tictactoe.participant.MinimaxMovePolicy;
import com.questrail.tictactoe.participant.MovePolicy;
import com.questrail.tictactoe.participant.RandomMovePolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LocalGameSessionTest
{
    private static final Duration WAIT = Duration.ofSeconds(10);

    @Test
    void humansPlayToAWin() throws Exception
    {
        try (GameSession session = GameSessions.local(LocalParticipant::new, LocalParticipant::new)) {
            LocalParticipant x = (LocalParticipant) session.participant(Symbol.X).orElseThrow();
            LocalParticipant o = (LocalParticipant) session.participant(Symbol.O).orElseThrow();
            EventRecorder events = new EventRecorder(session.bus());
            session.start();

            x.requestMove(0, 0);
            o.requestMove(1, 0);
            x.requestMove(0, 1);
            o.requestMove(1, 1);
            x.requestMove(0, 2);

            assertTrue(session.awaitEnd(Duration.ZERO));
            assertEquals(Optional.of(Symbol.X), session.engine().winner());
            List<StateUpdated> updates = events.ofType(StateUpdated.class);
            assertEquals(Symbol.X, updates.get(updates.size() - 1).winner());
            assertEquals(new EnableInput(Symbol.X), events.ofType(EnableInput.class).get(0));
        }
    }

    @Test
    void localSessionHasNoChannel()
    {
        try (GameSession session = GameSessions.local(LocalParticipant::new, LocalParticipant::new)) {
            assertTrue(session.channel().isEmpty());
            assertEquals(TurnEngine.Mode.AUTHORITATIVE, session.engine().mode());
            assertEquals(2, session.participants().size());
        }
    }

    @Test
    void awaitEndTimesOutWhileUndecided() throws Exception
    {
        try (GameSession session = GameSessions.local(LocalParticipant::new, LocalParticipant::new)) {
            session.start();

            assertFalse(session.awaitEnd(Duration.ofMillis(50)));
        }
    }

    @Test
    void minimaxNeverLosesToRandom() throws Exception
    {
        for (int seed = 0; seed < 10; seed++) {
            Random random = new Random(seed);
            try (GameSession session = GameSessions.local(
                    (bus, s) -> new AiParticipant(bus, s, new RandomMovePolicy(random)),
                    (bus, s) -> new AiParticipant(bus, s, new MinimaxMovePolicy()))) {
                session.start();

                assertTrue(session.awaitEnd(WAIT), "seed " + seed);
                assertTrue(session.engine().isGameOver());
                assertNotEquals(Optional.of(Symbol.X), session.engine().winner(), "seed " + seed);
            }
        }
    }

    @Test
    void aiIsNotAskedTwiceWhenTheWaitingPlayerMovesOutOfTurn() throws Exception
    {
        CountDownLatch opponentRejected = new CountDownLatch(1);
        MovePolicy minimax = new MinimaxMovePolicy();
        MovePolicy gatedMinimax = (board, symbol) -> {
            try {
                assertTrue(opponentRejected.await(WAIT.toMillis(), TimeUnit.MILLISECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return minimax.chooseMove(board, symbol);
        };

        try (GameSession session = GameSessions.local(
                (bus, s) -> new AiParticipant(bus, s, gatedMinimax),
                LocalParticipant::new)) {
            EventRecorder events = new EventRecorder(session.bus());
            LocalParticipant o = (LocalParticipant) session.participant(Symbol.O).orElseThrow();
            session.start();

            o.requestMove(1, 1);
            opponentRejected.countDown();

            CompletableFuture<Void> drained = new CompletableFuture<>();
            session.bus().subscribe(InputError.class, e -> {
                if (e.player() == Symbol.X) {
                    drained.complete(null);
                }
            });
            // Runs on the worker after every decision queued so far.
            session.bus().publishAsync(new InputError(Symbol.X, "drained"));
            drained.get(WAIT.toSeconds(), TimeUnit.SECONDS);

            assertEquals(1, session.engine().appliedMoves());
            assertEquals(1, events.ofType(MoveRequested.class).stream().filter(m -> m.player() == Symbol.X).count());
            assertTrue(events.ofType(InvalidMove.class).stream().noneMatch(m -> m.player() == Symbol.X));
        }
    }

    @Test
    void closeIsIdempotent()
    {
        GameSession session = GameSessions.local(LocalParticipant::new, LocalParticipant::new);

        session.close();
        session.close();

        assertEquals(0, session.bus().subscriberCount(StateUpdated.class));
    }
}

package com.questrail.tictactoe.runtime;

import com.questrail.tictactoe.api.MoveError;
import com.questrail.tictactoe.api.NetworkException;
import com.questrail.tictactoe.api.Symbol;
import com.questrail.tictactoe.bus.EventRecorder;
import com.questrail.tictactoe.bus.GameEvent.InputError;
import com.questrail.tictactoe.bus.GameEvent.InvalidMove;
import com.questrail.tictactoe.bus.GameEvent.StateUpdated;
import com.questrail.tictactoe.config.SessionConfig;
import com.questrail.tictactoe.core.TurnEngine;
import com.questrail.tictactoe.network.LocalNetworkParticipant;
import com.questrail.tictactoe.participant.AiParticipant;
import com.questrail.tictactoe.participant.LocalParticipant;
import com.questrail.tictactoe.participant.MinimaxMovePolicy;
import com.questrail.tictactoe.participant.ParticipantRole;
import com.questrail.tictactoe.protocol.observability.NullObservabilitySink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Host and client sessions talking over loopback TCP.
 */
class NetworkGameSessionTest
{
    private static final Duration WAIT = Duration.ofSeconds(10);

    private static final ParticipantFactory HUMAN = LocalParticipant::new;
    private static final ParticipantFactory MINIMAX = (bus, symbol) -> new AiParticipant(bus, symbol, new MinimaxMovePolicy());

    private GameSession host;
    private GameSession client;

    @AfterEach
    void tearDown()
    {
        if (client != null) {
            client.close();
        }
        if (host != null) {
            host.close();
        }
    }

    private static SessionConfig.Builder config()
    {
        return SessionConfig.builder()
                .withPort(0)
                .withObservability(NullObservabilitySink.INSTANCE);
    }

    private void connect(Symbol hostSymbol, ParticipantFactory hostPlayer, ParticipantFactory clientPlayer) throws Exception
    {
        try (GameSessions.HostListener listener = GameSessions.listen(config().build())) {
            CompletableFuture<GameSession> accepted =
                    CompletableFuture.supplyAsync(() -> listener.accept(hostSymbol, hostPlayer));
            client = GameSessions.client(config().withPort(listener.port()).build(), clientPlayer);
            host = accepted.get(WAIT.toSeconds(), TimeUnit.SECONDS);
        }
    }

    private static void eventually(BooleanSupplier condition) throws InterruptedException
    {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within " + WAIT.toSeconds() + " s");
            }
            Thread.sleep(10);
        }
    }

    private LocalParticipant hostHuman(Symbol symbol)
    {
        return (LocalParticipant) host.participant(symbol).orElseThrow();
    }

    private LocalNetworkParticipant clientHuman(Symbol symbol)
    {
        return (LocalNetworkParticipant) client.participant(symbol).orElseThrow();
    }

    // ---------------------------------------------------------------------
    // Wiring
    // ---------------------------------------------------------------------

    @Test
    void rolesAreComplementary() throws Exception
    {
        connect(Symbol.X, HUMAN, null);

        assertEquals(ParticipantRole.LOCAL_AUTHORITATIVE, host.participant(Symbol.X).orElseThrow().role());
        assertEquals(ParticipantRole.REMOTE_INPUT_RELAY, host.participant(Symbol.O).orElseThrow().role());
        assertEquals(ParticipantRole.LOCAL_INPUT_SOURCE, client.participant(Symbol.O).orElseThrow().role());
        assertTrue(client.participant(Symbol.X).isEmpty());

        assertEquals(TurnEngine.Mode.AUTHORITATIVE, host.engine().mode());
        assertEquals(TurnEngine.Mode.MIRROR, client.engine().mode());
        assertTrue(host.channel().isPresent());
        assertTrue(client.channel().isPresent());
    }

    @Test
    void hostMoveReachesBothBoards() throws Exception
    {
        connect(Symbol.X, HUMAN, null);
        host.start();

        hostHuman(Symbol.X).requestMove(0, 0);

        assertEquals(Symbol.X, host.engine().snapshot().at(0, 0));
        eventually(() -> client.engine().snapshot().at(0, 0) == Symbol.X);
        assertEquals(Symbol.O, client.engine().currentPlayer());
    }

    @Test
    void clientMoveIsCommittedByTheHost() throws Exception
    {
        connect(Symbol.X, HUMAN, null);
        host.start();
        hostHuman(Symbol.X).requestMove(0, 0);
        eventually(() -> client.engine().currentPlayer() == Symbol.O);

        clientHuman(Symbol.O).requestMove(1, 1);

        eventually(() -> host.engine().snapshot().at(1, 1) == Symbol.O);
        eventually(() -> client.engine().snapshot().at(1, 1) == Symbol.O);
        assertEquals(2, host.engine().appliedMoves());
    }

    @Test
    void clientMayOpenTheGame() throws Exception
    {
        connect(Symbol.O, HUMAN, null);
        host.start();

        clientHuman(Symbol.X).requestMove(2, 2);

        eventually(() -> host.engine().snapshot().at(2, 2) == Symbol.X);
        assertEquals(Symbol.O, host.engine().currentPlayer());
    }

    @Test
    void clientMoveOutOfTurnIsRejectedRemotely() throws Exception
    {
        connect(Symbol.X, HUMAN, null);
        EventRecorder clientEvents = new EventRecorder(client.bus());
        host.start();

        clientHuman(Symbol.O).requestMove(0, 0);

        eventually(() -> !clientEvents.ofType(InputError.class).isEmpty());
        assertEquals(MoveError.NOT_YOUR_TURN, clientEvents.ofType(InvalidMove.class).get(0).error());
        assertEquals(0, host.engine().appliedMoves());
        assertNull(client.engine().snapshot().at(0, 0));
    }

    @Test
    void minimaxPlayersDrawOverTheNetwork() throws Exception
    {
        connect(Symbol.X, MINIMAX, MINIMAX);
        host.start();

        assertTrue(host.awaitEnd(WAIT));
        assertTrue(client.awaitEnd(WAIT));

        assertTrue(host.engine().isGameOver());
        assertTrue(host.engine().winner().isEmpty());
        eventually(() -> client.engine().snapshot().equals(host.engine().snapshot()));
        assertEquals(9, host.engine().appliedMoves());
    }

    // ---------------------------------------------------------------------
    // Disconnects
    // ---------------------------------------------------------------------

    @Test
    void clientLeavingEndsTheHostSession() throws Exception
    {
        connect(Symbol.X, HUMAN, null);
        host.start();

        client.close();

        assertTrue(host.awaitEnd(WAIT));
        assertThrows(NetworkException.class, () -> hostHuman(Symbol.X).requestMove(0, 0));
        assertNull(client.engine().snapshot().at(0, 0));
    }

    @Test
    void hostMoveRefusedAfterClientLeftLeavesTheBoardAlone() throws Exception
    {
        connect(Symbol.X, HUMAN, null);
        List<StateUpdated> rendered = new CopyOnWriteArrayList<>();
        host.bus().subscribe(StateUpdated.class, rendered::add);
        host.start();
        client.close();
        assertTrue(host.awaitEnd(WAIT));

        assertThrows(NetworkException.class, () -> hostHuman(Symbol.X).requestMove(0, 0));

        assertNull(host.engine().snapshot().at(0, 0));
        assertEquals(Symbol.X, host.engine().currentPlayer());
        assertEquals(0, host.engine().appliedMoves());
        assertEquals(1, rendered.size());
    }

    @Test
    void clientMoveAfterHostLeavesFails() throws Exception
    {
        connect(Symbol.X, HUMAN, null);
        host.start();

        host.close();

        assertTrue(client.awaitEnd(WAIT));
        assertThrows(NetworkException.class, () -> clientHuman(Symbol.O).requestMove(1, 1));
    }

    // ---------------------------------------------------------------------
    // Setup failures
    // ---------------------------------------------------------------------

    @Test
    void acceptTimesOutWithoutAClient()
    {
        try (GameSessions.HostListener listener =
                     GameSessions.listen(config().withAcceptTimeout(Duration.ofMillis(200)).build())) {
            assertThrows(NetworkException.class, () -> listener.accept(Symbol.X, HUMAN));
        }
    }

    @Test
    void hostGivesUpOnASilentClient() throws Exception
    {
        SessionConfig cfg = config().withHandshakeTimeout(Duration.ofMillis(200)).build();
        try (GameSessions.HostListener listener = GameSessions.listen(cfg);
             Socket silent = new Socket("127.0.0.1", listener.port())) {
            assertTrue(silent.isConnected());
            assertThrows(NetworkException.class, () -> listener.accept(Symbol.X, HUMAN));
        }
    }

    @Test
    void clientGivesUpOnASilentHost() throws Exception
    {
        try (ServerSocket silentHost = new ServerSocket(0)) {
            CompletableFuture<Socket> peer = CompletableFuture.supplyAsync(() -> {
                try {
                    return silentHost.accept();
                } catch (IOException e) {
                    throw new IllegalStateException(e);
                }
            });
            SessionConfig cfg = config()
                    .withPort(silentHost.getLocalPort())
                    .withHandshakeTimeout(Duration.ofMillis(200))
                    .build();

            assertThrows(NetworkException.class, () -> GameSessions.client(cfg));
            peer.get(WAIT.toSeconds(), TimeUnit.SECONDS).close();
        }
    }

    @Test
    void connectingToNobodyFails() throws Exception
    {
        int unused;
        try (ServerSocket reserved = new ServerSocket(0)) {
            unused = reserved.getLocalPort();
        }
        SessionConfig cfg = config().withPort(unused).withConnectTimeout(Duration.ofSeconds(2)).build();

        assertThrows(NetworkException.class, () -> GameSessions.client(cfg));
    }

    @Test
    void hostSymbolCanBeDrawnAtRandom() throws Exception
    {
        int port;
        try (ServerSocket reserved = new ServerSocket(0)) {
            port = reserved.getLocalPort();
        }
        SessionConfig cfg = config().withPort(port).build();
        Symbol expected = new Random(7).nextBoolean() ? Symbol.X : Symbol.O;

        CompletableFuture<GameSession> accepted =
                CompletableFuture.supplyAsync(() -> GameSessions.host(cfg, new Random(7), HUMAN));
        client = connectWithRetry(cfg);
        host = accepted.get(WAIT.toSeconds(), TimeUnit.SECONDS);

        assertEquals(ParticipantRole.LOCAL_AUTHORITATIVE, host.participant(expected).orElseThrow().role());
        assertTrue(client.participant(expected.opponent()).isPresent());
    }

    // The host binds on another thread.
    private static GameSession connectWithRetry(SessionConfig cfg) throws InterruptedException
    {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (true) {
            try {
                return GameSessions.client(cfg);
            } catch (NetworkException e) {
                if (System.nanoTime() > deadline) {
                    throw e;
                }
                Thread.sleep(50);
            }
        }
    }
}

package com.questrail.tictactoe.runtime;

import com.questrail.tictactoe.api.NetworkException;
import com.questrail.tictactoe.api.Symbol;
import com.questrail.tictactoe.bus.EventBus;
import com.questrail.tictactoe.config.SessionConfig;
import com.questrail.tictactoe.core.TurnEngine;
import com.questrail.tictactoe.network.LocalNetworkParticipant;
import com.questrail.tictactoe.network.RemoteNetworkParticipant;
import com.questrail.tictactoe.participant.Participant;
import com.questrail.tictactoe.protocol.channel.FramedChannel;
import com.questrail.tictactoe.protocol.transport.StreamEndpoint;
import com.questrail.tictactoe.protocol.transport.TransportException;
import com.questrail.tictactoe.protocol.transport.tcp.netty.NettyTcpConnector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * GameSessions
 * =============================================================================
 * Composition root. Wires bus, engine, players and channel into a
 * {@link GameSession}.
 *
 * <ul>
 *   <li>{@link #local} - both players on this peer, authoritative engine</li>
 *   <li>{@link #listen} / {@link #host} - this peer owns the engine and one
 *       symbol; the other symbol is played on the connecting peer</li>
 *   <li>{@link #client} - the engine mirrors the host; local moves are sent to
 *       the host and never applied here</li>
 * </ul>
 *
 * Every factory releases what it already acquired if wiring fails part-way.
 */
public final class GameSessions
{
    private static final Logger log = LoggerFactory.getLogger(GameSessions.class);

    private GameSessions() {}

    public static GameSession local(ParticipantFactory xPlayer, ParticipantFactory oPlayer)
    {
        Objects.requireNonNull(xPlayer, "xPlayer");
        Objects.requireNonNull(oPlayer, "oPlayer");

        EventBus bus = new EventBus();
        try {
            TurnEngine engine = TurnEngine.authoritative(bus);
            List<Participant> players = List.of(
                    xPlayer.create(bus, Symbol.X),
                    oPlayer.create(bus, Symbol.O));
            return new GameSession(bus, engine, players, null, List.of());
        } catch (RuntimeException e) {
            bus.close();
            throw e;
        }
    }

    /**
     * Bind the configured port. The returned listener exposes the bound port
     * before any peer connects.
     *
     * @throws NetworkException if the port cannot be bound
     */
    public static HostListener listen(SessionConfig config)
    {
        Objects.requireNonNull(config, "config");
        try {
            return new HostListener(config, NettyTcpConnector.listen(config.host(), config.port()));
        } catch (TransportException e) {
            throw new NetworkException(e.getMessage(), e);
        }
    }

    /**
     * {@link #listen} and {@link HostListener#accept} in one call.
     */
    public static GameSession host(SessionConfig config, Symbol hostSymbol, ParticipantFactory hostPlayer)
    {
        try (HostListener listener = listen(config)) {
            return listener.accept(hostSymbol, hostPlayer);
        }
    }

    /**
     * Like {@link #host(SessionConfig, Symbol, ParticipantFactory)} with the
     * host's symbol drawn from {@code random}.
     */
    public static GameSession host(SessionConfig config, Random random, ParticipantFactory hostPlayer)
    {
        Symbol hostSymbol = random.nextBoolean() ? Symbol.X : Symbol.O;
        log.info("Host plays {}", hostSymbol);
        return host(config, hostSymbol, hostPlayer);
    }

    /**
     * Connect to a host. The client's symbol is whatever the host assigns;
     * moves are made through the session's {@link LocalNetworkParticipant}.
     */
    public static GameSession client(SessionConfig config)
    {
        return client(config, null);
    }

    /**
     * @param extraPlayer created for the assigned symbol before the role is
     *                    acknowledged, e.g. an AI; may be {@code null}
     */
    public static GameSession client(SessionConfig config, ParticipantFactory extraPlayer)
    {
        Objects.requireNonNull(config, "config");

        final StreamEndpoint endpoint;
        try {
            endpoint = NettyTcpConnector.connect(config.host(), config.port(), config.connectTimeout());
        } catch (TransportException e) {
            throw new NetworkException(e.getMessage(), e);
        }

        EventBus bus = new EventBus();
        FramedChannel channel = null;
        try {
            channel = FramedChannel.open(endpoint, config.maxFrameLength(), config.observability());
            TurnEngine engine = TurnEngine.mirror(bus);

            List<Participant> extras = new ArrayList<>(1);
            LocalNetworkParticipant self = new LocalNetworkParticipant(
                    bus, channel, config.handshakeTimeout(), symbol -> {
                        if (extraPlayer != null) {
                            extras.add(extraPlayer.create(bus, symbol));
                        }
                    });

            List<Participant> players = new ArrayList<>();
            players.add(self);
            players.addAll(extras);
            return new GameSession(bus, engine, players, channel, List.of(self));
        } catch (RuntimeException e) {
            if (channel != null) {
                channel.close();
            } else {
                endpoint.stop();
            }
            bus.close();
            throw e;
        }
    }

    /**
     * A bound host port awaiting its single client.
     */
    public static final class HostListener implements AutoCloseable
    {
        private final SessionConfig config;
        private final NettyTcpConnector.Acceptor acceptor;

        private HostListener(SessionConfig config, NettyTcpConnector.Acceptor acceptor)
        {
            this.config = config;
            this.acceptor = acceptor;
        }

        public int port()
        {
            return acceptor.port();
        }

        /**
         * Wait for the client, assign it {@code hostSymbol.opponent()} and
         * wire the host session. Call {@link GameSession#start()} to begin.
         *
         * @throws NetworkException if no client connects in time or the
         *                          handshake fails
         */
        public GameSession accept(Symbol hostSymbol, ParticipantFactory hostPlayer)
        {
            Objects.requireNonNull(hostSymbol, "hostSymbol");
            Objects.requireNonNull(hostPlayer, "hostPlayer");

            final StreamEndpoint endpoint;
            try {
                endpoint = acceptor.accept(config.acceptTimeout());
            } catch (TransportException e) {
                throw new NetworkException(e.getMessage(), e);
            }

            EventBus bus = new EventBus();
            FramedChannel channel = null;
            try {
                channel = FramedChannel.open(endpoint, config.maxFrameLength(), config.observability());
                TurnEngine engine = TurnEngine.authoritative(bus);
                Participant local = hostPlayer.create(bus, hostSymbol);
                RemoteNetworkParticipant remote = new RemoteNetworkParticipant(
                        bus, hostSymbol.opponent(), channel, config.handshakeTimeout());
                return new GameSession(bus, engine, List.of(local, remote), channel, List.of(remote));
            } catch (RuntimeException e) {
                if (channel != null) {
                    channel.close();
                } else {
                    endpoint.stop();
                }
                bus.close();
                throw e;
            }
        }

        @Override
        public void close()
        {
            acceptor.close();
        }
    }
}

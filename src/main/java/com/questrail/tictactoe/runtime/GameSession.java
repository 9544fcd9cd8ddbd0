package com.questrail.tictactoe.runtime;

import com.questrail.tictactoe.api.Symbol;
import com.questrail.tictactoe.bus.EventBus;
import com.questrail.tictactoe.bus.GameEvent.SessionEnded;
import com.questrail.tictactoe.bus.GameEvent.StateUpdated;
import com.questrail.tictactoe.core.TurnEngine;
import com.questrail.tictactoe.participant.Participant;
import com.questrail.tictactoe.protocol.channel.FramedChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * GameSession
 * =============================================================================
 * Scoped owner of one game on one peer: its bus, its turn engine, its players
 * and, for networked sessions, the channel to the other peer.
 *
 * <h2>Lifecycle</h2>
 * Built fully wired by {@link GameSessions}. {@link #start()} announces the
 * first turn (a no-op on the client, whose engine only mirrors the host).
 * {@link #close()} releases the channel first and the bus last; it is
 * idempotent and meant for try-with-resources.
 *
 * <h2>Waiting</h2>
 * {@link #awaitEnd(Duration)} blocks until a decided board is published or
 * the network session ends.
 */
public final class GameSession implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(GameSession.class);

    private final EventBus bus;
    private final TurnEngine engine;
    private final List<Participant> participants;
    private final FramedChannel channel;
    private final List<AutoCloseable> resources;

    private final CountDownLatch ended = new CountDownLatch(1);
    private final AtomicBoolean closed = new AtomicBoolean();

    GameSession(EventBus bus,
                TurnEngine engine,
                List<Participant> participants,
                FramedChannel channel,
                List<AutoCloseable> resources)
    {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.participants = List.copyOf(participants);
        this.channel = channel;
        this.resources = new ArrayList<>(resources);

        bus.subscribe(StateUpdated.class, e -> {
            if (e.isGameOver()) {
                ended.countDown();
            }
        });
        bus.subscribe(SessionEnded.class, e -> ended.countDown());
    }

    public void start()
    {
        engine.start();
    }

    public EventBus bus()
    {
        return bus;
    }

    public TurnEngine engine()
    {
        return engine;
    }

    public List<Participant> participants()
    {
        return participants;
    }

    /**
     * The player bound to {@code symbol} on this peer, if any.
     */
    public Optional<Participant> participant(Symbol symbol)
    {
        for (Participant p : participants) {
            if (p.symbol() == symbol) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    /**
     * The channel to the other peer; empty for a local session.
     */
    public Optional<FramedChannel> channel()
    {
        return Optional.ofNullable(channel);
    }

    /**
     * @return {@code true} if the game was decided or the session ended in time
     */
    public boolean awaitEnd(Duration timeout) throws InterruptedException
    {
        return ended.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (AutoCloseable resource : resources) {
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("Failed to release {}", resource, e);
            }
        }
        bus.close();
    }
}

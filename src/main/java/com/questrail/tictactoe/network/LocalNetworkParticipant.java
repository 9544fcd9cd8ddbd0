package com.questrail.tictactoe.network;

import com.questrail.tictactoe.api.NetworkException;
import com.questrail.tictactoe.api.Symbol;
import com.questrail.tictactoe.bus.EventBus;
import com.questrail.tictactoe.bus.GameEvent.EnableInput;
import com.questrail.tictactoe.bus.GameEvent.InputError;
import com.questrail.tictactoe.bus.GameEvent.InvalidMove;
import com.questrail.tictactoe.bus.GameEvent.MoveRequested;
import com.questrail.tictactoe.bus.GameEvent.SessionEnded;
import com.questrail.tictactoe.bus.GameEvent.StartTurn;
import com.questrail.tictactoe.bus.GameEvent.StateUpdated;
import com.questrail.tictactoe.participant.Participant;
import com.questrail.tictactoe.participant.ParticipantRole;
import com.questrail.tictactoe.protocol.channel.FrameHandler;
import com.questrail.tictactoe.protocol.channel.FramedChannel;
import com.questrail.tictactoe.protocol.internal.decode.ProtocolDecodeException;
import com.questrail.tictactoe.protocol.internal.decode.ProtocolMessageDecoder;
import com.questrail.tictactoe.protocol.internal.encode.ProtocolMessageEncoder;
import com.questrail.tictactoe.protocol.model.AssignRole;
import com.questrail.tictactoe.protocol.model.AssignRoleAck;
import com.questrail.tictactoe.protocol.model.Frame;
import com.questrail.tictactoe.protocol.model.InvalidMoveNotice;
import com.questrail.tictactoe.protocol.model.MessageTypes;
import com.questrail.tictactoe.protocol.model.MoveRequest;
import com.questrail.tictactoe.protocol.model.ProtocolMessage;
import com.questrail.tictactoe.protocol.model.StartTurnNotice;
import com.questrail.tictactoe.protocol.model.StateUpdate;
import com.questrail.tictactoe.protocol.transport.TransportException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * LocalNetworkParticipant
 * =============================================================================
 * Client-side player. Local input chooses the moves; the host commits them.
 *
 * <h2>Handshake</h2>
 * The constructor waits (bounded) for {@code assign_role}, adopts the symbol
 * it names, installs the relay handlers and then sends
 * {@code assign_role_ack}. The host sends no gameplay frame before the ack,
 * so the handlers see every one of them in order.
 *
 * <h2>Steady state</h2>
 * <ul>
 *   <li>{@code state_update}, {@code start_turn} and {@code invalid_move}
 *       frames are re-published as {@link StateUpdated}, {@link StartTurn}
 *       and {@link InvalidMove} on the client bus</li>
 *   <li>{@link StartTurn} for this symbol becomes {@link EnableInput};
 *       {@link InvalidMove} for this symbol becomes {@link InputError}</li>
 *   <li>{@link MoveRequested} for this symbol is sent as {@code move_request}.
 *       Nothing is applied locally; the board changes when the host's
 *       {@code state_update} comes back</li>
 * </ul>
 *
 * <h2>Failures</h2>
 * Forwarding a move over a closed or failing channel raises
 * {@link NetworkException} to the publisher of the move. When the channel
 * closes a {@link SessionEnded} is published.
 */
public final class LocalNetworkParticipant implements Participant, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(LocalNetworkParticipant.class);

    private final EventBus bus;
    private final FramedChannel channel;
    private final Symbol symbol;

    private final ProtocolMessageEncoder encoder = new ProtocolMessageEncoder();
    private final ProtocolMessageDecoder decoder = new ProtocolMessageDecoder();

    private final Consumer<StartTurn> turnListener = this::onStartTurn;
    private final Consumer<InvalidMove> rejectionListener = this::onInvalidMove;
    private final Consumer<MoveRequested> moveForwarder = this::onMoveRequested;

    public LocalNetworkParticipant(EventBus bus, FramedChannel channel, Duration handshakeTimeout)
    {
        this(bus, channel, handshakeTimeout, symbol -> {});
    }

    /**
     * @param onAssigned called with the adopted symbol before the acknowledgement
     *                   is sent; players subscribed here see the first turn
     */
    public LocalNetworkParticipant(EventBus bus,
                                   FramedChannel channel,
                                   Duration handshakeTimeout,
                                   Consumer<Symbol> onAssigned)
    {
        Objects.requireNonNull(onAssigned, "onAssigned");
        this.bus = Objects.requireNonNull(bus, "bus");
        this.channel = Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");

        this.symbol = awaitRole(handshakeTimeout);

        bus.subscribe(StartTurn.class, turnListener);
        bus.subscribe(InvalidMove.class, rejectionListener);
        bus.subscribe(MoveRequested.class, moveForwarder);

        channel.registerHandler(MessageTypes.STATE_UPDATE, this::onRelayedFrame);
        channel.registerHandler(MessageTypes.START_TURN, this::onRelayedFrame);
        channel.registerHandler(MessageTypes.INVALID_MOVE, this::onRelayedFrame);
        channel.addCloseListener(reason -> bus.publish(new SessionEnded(reason.name())));

        try {
            onAssigned.accept(symbol);
            send(new AssignRoleAck(symbol));
        } catch (RuntimeException e) {
            close();
            throw e;
        }
        log.info("Assigned role {}", symbol);
    }

    private Symbol awaitRole(Duration timeout)
    {
        CountDownLatch assigned = new CountDownLatch(1);
        AtomicReference<Symbol> role = new AtomicReference<>();
        AtomicReference<ProtocolDecodeException> malformed = new AtomicReference<>();
        FrameHandler oneShot = frame -> {
            try {
                AssignRole message = (AssignRole) decoder.decode(frame);
                role.compareAndSet(null, message.symbol());
            } catch (ProtocolDecodeException e) {
                malformed.compareAndSet(null, e);
            }
            assigned.countDown();
        };

        channel.registerHandler(MessageTypes.ASSIGN_ROLE, oneShot);
        channel.addCloseListener(reason -> assigned.countDown());
        try {
            if (!assigned.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                channel.close();
                throw new NetworkException("No role assignment within " + timeout.toMillis() + " ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channel.close();
            throw new NetworkException("Interrupted while waiting for a role assignment", e);
        } finally {
            channel.unregisterHandler(MessageTypes.ASSIGN_ROLE, oneShot);
        }

        Symbol adopted = role.get();
        if (adopted == null && malformed.get() != null) {
            channel.close();
            throw new NetworkException("Malformed role assignment", malformed.get());
        }
        if (adopted == null) {
            throw new NetworkException("Channel closed during role handshake");
        }
        return adopted;
    }

    @Override
    public Symbol symbol()
    {
        return symbol;
    }

    @Override
    public ParticipantRole role()
    {
        return ParticipantRole.LOCAL_INPUT_SOURCE;
    }

    public FramedChannel channel()
    {
        return channel;
    }

    /**
     * Ask the host to play this participant's symbol at the cell.
     *
     * @throws NetworkException if the request cannot be sent
     */
    public void requestMove(int row, int col)
    {
        bus.publish(new MoveRequested(symbol, row, col));
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

    private void onMoveRequested(MoveRequested event)
    {
        if (event.player() != symbol) {
            return;
        }
        send(new MoveRequest(event.player(), event.row(), event.col()));
    }

    private void onRelayedFrame(Frame frame)
    {
        ProtocolMessage message = decoder.decode(frame);
        if (message instanceof StateUpdate m) {
            bus.publish(new StateUpdated(m.board(), m.currentPlayer(), m.winner()));
        }
        else if (message instanceof StartTurnNotice m) {
            bus.publish(new StartTurn(m.player(), m.board()));
        }
        else if (message instanceof InvalidMoveNotice m) {
            bus.publish(new InvalidMove(m.player(), m.row(), m.col(), m.error(), m.message()));
        }
    }

    private void send(ProtocolMessage message)
    {
        if (!channel.isOpen()) {
            throw new NetworkException("Cannot send " + message.type() + ": connection to host is closed");
        }
        try {
            channel.send(encoder.encode(message));
        } catch (TransportException e) {
            throw new NetworkException("Cannot send " + message.type() + " to host", e);
        }
    }

    /**
     * Stop forwarding and close the channel.
     */
    @Override
    public void close()
    {
        bus.unsubscribe(StartTurn.class, turnListener);
        bus.unsubscribe(InvalidMove.class, rejectionListener);
        bus.unsubscribe(MoveRequested.class, moveForwarder);
        channel.close();
    }
}

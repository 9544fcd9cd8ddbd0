package com.questrail.tictactoe.network;

import com.questrail.tictactoe.api.LogicException;
import com.questrail.tictactoe.api.NetworkException;
import com.questrail.tictactoe.api.Symbol;
import com.questrail.tictactoe.bus.EventBus;
import com.questrail.tictactoe.bus.GameEvent.InvalidMove;
import com.questrail.tictactoe.bus.GameEvent.MoveRequested;
import com.questrail.tictactoe.bus.GameEvent.SessionEnded;
import com.questrail.tictactoe.bus.GameEvent.StartTurn;
import com.questrail.tictactoe.bus.GameEvent.StateUpdated;
import com.questrail.tictactoe.participant.Participant;
import com.questrail.tictactoe.participant.ParticipantRole;
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
import java.util.Optional;
import java.util.function.Consumer;

/**
 * RemoteNetworkParticipant
 * =============================================================================
 * Host-side stand-in for the player on the other peer.
 *
 * <h2>Handshake</h2>
 * The constructor sends {@code assign_role} naming the remote symbol and
 * blocks until the matching {@code assign_role_ack} arrives. Nothing else is
 * registered or relayed before that. A timeout, a closed channel or a wrong
 * acknowledgement closes the channel and raises {@link NetworkException}.
 *
 * <h2>Steady state</h2>
 * <ul>
 *   <li>every {@link StateUpdated} on the host bus goes out as {@code state_update}</li>
 *   <li>{@link StartTurn} and {@link InvalidMove} for the remote symbol go out as
 *       {@code start_turn} / {@code invalid_move}</li>
 *   <li>an inbound {@code move_request} is published as {@link MoveRequested}
 *       on the reader thread, as if it were local input</li>
 * </ul>
 *
 * <h2>Failures</h2>
 * When the channel closes for any reason a {@link SessionEnded} is published;
 * the host engine then refuses further moves. Relays over a channel that has
 * already closed are dropped. A relay whose write fails on an open channel
 * raises {@link NetworkException} to whoever published the event. A
 * {@code move_request} for the wrong symbol is a {@link LogicException}; it
 * propagates out of the frame handler and the channel closes.
 */
public final class RemoteNetworkParticipant implements Participant, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(RemoteNetworkParticipant.class);

    private final EventBus bus;
    private final Symbol symbol;
    private final FramedChannel channel;

    private final ProtocolMessageEncoder encoder = new ProtocolMessageEncoder();
    private final ProtocolMessageDecoder decoder = new ProtocolMessageDecoder();

    private final Consumer<StateUpdated> stateRelay = this::onStateUpdated;
    private final Consumer<StartTurn> turnRelay = this::onStartTurn;
    private final Consumer<InvalidMove> rejectionRelay = this::onInvalidMove;

    public RemoteNetworkParticipant(EventBus bus, Symbol remoteSymbol, FramedChannel channel, Duration handshakeTimeout)
    {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.symbol = Objects.requireNonNull(remoteSymbol, "remoteSymbol");
        this.channel = Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");

        handshake(handshakeTimeout);

        channel.registerHandler(MessageTypes.MOVE_REQUEST, this::onMoveRequestFrame);
        channel.addCloseListener(reason -> bus.publish(new SessionEnded(reason.name())));

        bus.subscribe(StateUpdated.class, stateRelay);
        bus.subscribe(StartTurn.class, turnRelay);
        bus.subscribe(InvalidMove.class, rejectionRelay);
    }

    private void handshake(Duration timeout)
    {
        try {
            relay(new AssignRole(symbol));
        } catch (NetworkException e) {
            channel.close();
            throw e;
        }

        Optional<Frame> reply = channel.receive(timeout);
        if (reply.isEmpty()) {
            boolean wasOpen = channel.isOpen();
            channel.close();
            throw new NetworkException(wasOpen
                    ? "No role acknowledgement within " + timeout.toMillis() + " ms"
                    : "Channel closed during role handshake");
        }

        try {
            ProtocolMessage message = decoder.decode(reply.get());
            if (!(message instanceof AssignRoleAck ack) || ack.symbol() != symbol) {
                throw new NetworkException("Expected assign_role_ack for " + symbol + ", got " + reply.get());
            }
        } catch (ProtocolDecodeException e) {
            channel.close();
            throw new NetworkException("Malformed role acknowledgement: " + reply.get(), e);
        } catch (NetworkException e) {
            channel.close();
            throw e;
        }
        log.info("Peer acknowledged role {}", symbol);
    }

    @Override
    public Symbol symbol()
    {
        return symbol;
    }

    @Override
    public ParticipantRole role()
    {
        return ParticipantRole.REMOTE_INPUT_RELAY;
    }

    public FramedChannel channel()
    {
        return channel;
    }

    @Override
    public void onStartTurn(StartTurn event)
    {
        if (event.player() != symbol) {
            return;
        }
        relayIfOpen(new StartTurnNotice(event.player(), event.board()));
    }

    private void onStateUpdated(StateUpdated event)
    {
        relayIfOpen(new StateUpdate(event.board(), event.currentPlayer(), event.winner()));
    }

    private void onInvalidMove(InvalidMove event)
    {
        if (event.player() != symbol) {
            return;
        }
        relayIfOpen(new InvalidMoveNotice(event.player(), event.row(), event.col(), event.error(), event.message()));
    }

    private void onMoveRequestFrame(Frame frame)
    {
        ProtocolMessage message = decoder.decode(frame);
        MoveRequest request = (MoveRequest) message;
        if (request.player() != symbol) {
            throw new LogicException("Peer requested a move for " + request.player() + " but plays " + symbol);
        }
        bus.publish(new MoveRequested(request.player(), request.row(), request.col()));
    }

    private void relayIfOpen(ProtocolMessage message)
    {
        if (!channel.isOpen()) {
            log.debug("Dropping {}: connection to peer is closed", message.type());
            return;
        }
        relay(message);
    }

    private void relay(ProtocolMessage message)
    {
        if (!channel.isOpen()) {
            throw new NetworkException("Cannot send " + message.type() + ": connection to peer is closed");
        }
        try {
            channel.send(encoder.encode(message));
        } catch (TransportException e) {
            throw new NetworkException("Cannot send " + message.type() + " to peer", e);
        }
    }

    /**
     * Stop relaying and close the channel.
     */
    @Override
    public void close()
    {
        bus.unsubscribe(StateUpdated.class, stateRelay);
        bus.unsubscribe(StartTurn.class, turnRelay);
        bus.unsubscribe(InvalidMove.class, rejectionRelay);
        channel.close();
    }
}

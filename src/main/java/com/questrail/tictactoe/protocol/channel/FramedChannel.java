package com.questrail.tictactoe.protocol.channel;

import com.questrail.tictactoe.protocol.codec.FrameDecodeException;
import com.questrail.tictactoe.protocol.codec.FrameDecoder;
import com.questrail.tictactoe.protocol.codec.FrameEncoder;
import com.questrail.tictactoe.protocol.codec.impl.DefaultFrameDecoder;
import com.questrail.tictactoe.protocol.codec.impl.DefaultFrameEncoder;
import com.questrail.tictactoe.protocol.codec.impl.LineFraming;
import com.questrail.tictactoe.protocol.model.Frame;
import com.questrail.tictactoe.protocol.model.MessageTypes;
import com.questrail.tictactoe.protocol.observability.ChannelErrorEvent;
import com.questrail.tictactoe.protocol.observability.ChannelFrameEvent;
import com.questrail.tictactoe.protocol.observability.ChannelLifecycleEvent;
import com.questrail.tictactoe.protocol.observability.ChannelObservabilitySink;
import com.questrail.tictactoe.protocol.transport.StreamEndpoint;
import com.questrail.tictactoe.protocol.transport.StreamEndpointListener;
import com.questrail.tictactoe.protocol.transport.TransportException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * FramedChannel
 * =============================================================================
 * A live framed connection: one {@link StreamEndpoint}, its frame codec, a
 * handler registry and an inbox.
 *
 * <h2>Inbound path</h2>
 * Bytes from the endpoint's reader thread are split by {@link LineFraming} and
 * decoded into {@link Frame}s. Each frame goes to exactly one place:
 * <ul>
 *   <li>the handlers registered for its type, in registration order, or</li>
 *   <li>if there are none, the inbox, for {@link #receive(Duration)}</li>
 * </ul>
 * Registering a handler drains queued inbox frames of that type into it, in
 * arrival order, before any newer frame of that type is dispatched.
 *
 * <h2>Close</h2>
 * The channel closes exactly once, for one {@link CloseReason}. Cleanup order:
 * <ol>
 *   <li>stop accepting sends</li>
 *   <li>best-effort close frame to the peer</li>
 *   <li>shut down the write half, then stop the endpoint</li>
 *   <li>clear handlers and release blocked receivers</li>
 *   <li>notify close listeners</li>
 * </ol>
 * Afterwards {@link #send(Frame)} is a no-op and receive calls return empty.
 *
 * <h2>Failure semantics</h2>
 * Nothing is retried. Malformed input, a failing handler, end of stream and
 * transport errors all close the channel.
 */
public final class FramedChannel implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(FramedChannel.class);

    private static final Frame CLOSE_FRAME = Frame.builder(MessageTypes.CLOSE).build();

    private final StreamEndpoint endpoint;
    private final LineFraming framing;
    private final FrameEncoder encoder;
    private final FrameDecoder decoder;
    private final ChannelObservabilitySink sink;

    // Guards handlers and inbox; held while dispatching so that drains on
    // registration and reader-thread dispatch never interleave.
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition frameArrived = lock.newCondition();
    private final Map<String, List<FrameHandler>> handlers = new HashMap<>();
    private final Deque<Frame> inbox = new ArrayDeque<>();

    private final ReentrantLock sendLock = new ReentrantLock();

    private final AtomicBoolean closed = new AtomicBoolean();
    private final List<Consumer<CloseReason>> closeListeners = new CopyOnWriteArrayList<>();
    private volatile CloseReason closeReason;

    public FramedChannel(StreamEndpoint endpoint,
                         int maxFrameLength,
                         FrameEncoder encoder,
                         FrameDecoder decoder,
                         ChannelObservabilitySink sink)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.framing = new LineFraming(maxFrameLength);
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.sink = Objects.requireNonNull(sink, "sink");

        endpoint.setListener(new EndpointListener());
    }

    /**
     * Wrap an established endpoint with the JSON codec and start reading.
     */
    public static FramedChannel open(StreamEndpoint endpoint, int maxFrameLength, ChannelObservabilitySink sink)
    {
        FramedChannel channel = new FramedChannel(
                endpoint, maxFrameLength, new DefaultFrameEncoder(), new DefaultFrameDecoder(), sink);
        channel.start();
        return channel;
    }

    public void start()
    {
        endpoint.start();
    }

    // ---------------------------------------------------------------------
    // Outbound
    // ---------------------------------------------------------------------

    /**
     * Encode and write {@code frame}. Writes from concurrent callers never
     * interleave.
     *
     * <p>A no-op once the channel is closed.</p>
     *
     * @throws TransportException if the write fails; the channel is closed first
     * @throws IllegalArgumentException if the frame uses the reserved close type
     */
    public void send(Frame frame)
    {
        Objects.requireNonNull(frame, "frame");
        if (MessageTypes.CLOSE.equals(frame.type())) {
            throw new IllegalArgumentException("'" + MessageTypes.CLOSE + "' is reserved for the channel");
        }
        if (closed.get()) {
            return;
        }

        byte[] bytes = encoder.encode(frame);
        sendLock.lock();
        try {
            if (closed.get()) {
                return;
            }
            endpoint.send(bytes);
        } catch (TransportException e) {
            sink.onError(new ChannelErrorEvent(Instant.now(), "Send of " + frame.type() + " failed", e));
            close(CloseReason.TRANSPORT_ERROR);
            throw e;
        } finally {
            sendLock.unlock();
        }
        sink.onFrame(new ChannelFrameEvent(Instant.now(), ChannelFrameEvent.Direction.OUTBOUND, frame.type()));
    }

    // ---------------------------------------------------------------------
    // Inbound: pull
    // ---------------------------------------------------------------------

    /**
     * Block until an unhandled frame is available or the channel closes.
     *
     * @return the oldest inbox frame, or empty once the channel is closed
     */
    public Optional<Frame> receive()
    {
        lock.lock();
        try {
            while (inbox.isEmpty()) {
                if (closed.get()) {
                    return Optional.empty();
                }
                frameArrived.await();
            }
            return closed.get() ? Optional.empty() : Optional.of(inbox.poll());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #receive()} but gives up after {@code timeout}.
     *
     * @return empty on timeout or once the channel is closed
     */
    public Optional<Frame> receive(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (inbox.isEmpty()) {
                if (closed.get() || nanos <= 0) {
                    return Optional.empty();
                }
                nanos = frameArrived.awaitNanos(nanos);
            }
            return closed.get() ? Optional.empty() : Optional.of(inbox.poll());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Non-blocking {@link #receive()}.
     */
    public Optional<Frame> poll()
    {
        return receive(Duration.ZERO);
    }

    // ---------------------------------------------------------------------
    // Inbound: push
    // ---------------------------------------------------------------------

    /**
     * Route frames of {@code type} to {@code handler}. Queued inbox frames of
     * that type are delivered to it immediately, on the calling thread.
     */
    public void registerHandler(String type, FrameHandler handler)
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");

        lock.lock();
        try {
            if (closed.get()) {
                return;
            }
            handlers.computeIfAbsent(type, t -> new ArrayList<>()).add(handler);

            List<Frame> pending = new ArrayList<>();
            for (Iterator<Frame> it = inbox.iterator(); it.hasNext(); ) {
                Frame f = it.next();
                if (f.type().equals(type)) {
                    pending.add(f);
                    it.remove();
                }
            }
            for (Frame f : pending) {
                handler.onFrame(f);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove the first registration of {@code handler} for {@code type}.
     */
    public void unregisterHandler(String type, FrameHandler handler)
    {
        lock.lock();
        try {
            List<FrameHandler> list = handlers.get(type);
            if (list == null) {
                return;
            }
            for (int i = 0; i < list.size(); i++) {
                if (list.get(i) == handler) {
                    list.remove(i);
                    break;
                }
            }
            if (list.isEmpty()) {
                handlers.remove(type);
            }
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    public boolean isOpen()
    {
        return !closed.get();
    }

    public Optional<CloseReason> closeReason()
    {
        return Optional.ofNullable(closeReason);
    }

    /**
     * Called once with the close reason. Listeners added after close are
     * called immediately.
     */
    public void addCloseListener(Consumer<CloseReason> listener)
    {
        Objects.requireNonNull(listener, "listener");
        closeListeners.add(listener);
        CloseReason reason = closeReason;
        if (reason != null && closeListeners.remove(listener)) {
            listener.accept(reason);
        }
    }

    @Override
    public void close()
    {
        close(CloseReason.LOCAL_REQUEST);
    }

    void close(CloseReason reason)
    {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        if (reason != CloseReason.TRANSPORT_ERROR && reason != CloseReason.END_OF_STREAM) {
            sendLock.lock();
            try {
                endpoint.send(encoder.encode(CLOSE_FRAME));
            } catch (TransportException e) {
                log.debug("Close frame not delivered: {}", e.getMessage());
            } finally {
                sendLock.unlock();
            }
        }
        endpoint.shutdownOutput();
        endpoint.stop();

        lock.lock();
        try {
            handlers.clear();
            inbox.clear();
            closeReason = reason;
            frameArrived.signalAll();
        } finally {
            lock.unlock();
        }

        sink.onLifecycle(new ChannelLifecycleEvent(Instant.now(), false, remote(), reason.name()));

        for (Consumer<CloseReason> listener : closeListeners) {
            if (!closeListeners.remove(listener)) {
                continue;
            }
            try {
                listener.accept(reason);
            } catch (RuntimeException e) {
                log.warn("Close listener failed", e);
            }
        }
    }

    private String remote()
    {
        return String.valueOf(endpoint.remoteAddress());
    }

    private void onFrame(Frame frame)
    {
        sink.onFrame(new ChannelFrameEvent(Instant.now(), ChannelFrameEvent.Direction.INBOUND, frame.type()));

        if (MessageTypes.CLOSE.equals(frame.type())) {
            close(CloseReason.PEER_CLOSED);
            return;
        }

        lock.lock();
        try {
            if (closed.get()) {
                return;
            }
            List<FrameHandler> targets = handlers.get(frame.type());
            if (targets == null || targets.isEmpty()) {
                inbox.add(frame);
                frameArrived.signalAll();
                return;
            }
            for (FrameHandler h : List.copyOf(targets)) {
                h.onFrame(frame);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Endpoint callbacks; all on the endpoint's reader thread.
     */
    private final class EndpointListener implements StreamEndpointListener
    {
        @Override
        public void onTransportUp()
        {
            sink.onLifecycle(new ChannelLifecycleEvent(Instant.now(), true, remote(), null));
        }

        @Override
        public void onBytes(byte[] chunk)
        {
            if (closed.get()) {
                return;
            }
            try {
                for (byte[] payload : framing.append(chunk)) {
                    if (closed.get()) {
                        return;
                    }
                    onFrame(decoder.decode(payload));
                }
            } catch (FrameDecodeException e) {
                sink.onError(new ChannelErrorEvent(Instant.now(), "Malformed frame from " + remote(), e));
                close(CloseReason.PROTOCOL_ERROR);
            } catch (RuntimeException e) {
                sink.onError(new ChannelErrorEvent(Instant.now(), "Frame handler failed", e));
                close(CloseReason.PROTOCOL_ERROR);
            }
        }

        @Override
        public void onEndOfStream()
        {
            close(CloseReason.END_OF_STREAM);
        }

        @Override
        public void onTransportDown(Throwable cause)
        {
            if (cause != null && !closed.get()) {
                sink.onError(new ChannelErrorEvent(Instant.now(), "Transport failed", cause));
            }
            close(cause == null ? CloseReason.END_OF_STREAM : CloseReason.TRANSPORT_ERROR);
        }
    }
}

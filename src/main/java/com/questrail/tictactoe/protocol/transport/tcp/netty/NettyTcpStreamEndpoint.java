package com.questrail.tictactoe.protocol.transport.tcp.netty;

import com.questrail.tictactoe.protocol.transport.StreamEndpoint;
import com.questrail.tictactoe.protocol.transport.StreamEndpointListener;
import com.questrail.tictactoe.protocol.transport.TransportException;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpStreamEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link StreamEndpoint} port over one
 * connected TCP socket.
 *
 * <h2>Architectural Role</h2>
 * A <strong>pure transport adapter</strong>. It never looks inside the bytes
 * it moves.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) do
 * not escape this package. Instances are created by {@link NettyTcpConnector}.
 *
 * <h2>Threading</h2>
 * Each endpoint owns a single-threaded event loop. Listener callbacks run on
 * it, in order. Sends never block: the write is queued on the event loop and
 * a failed write tears the connection down, which the listener sees as
 * {@link StreamEndpointListener#onTransportDown(Throwable)}.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} enables reading and reports the transport up.
 * - {@link #stop()} closes the socket and shuts down the event loop.
 */
public final class NettyTcpStreamEndpoint implements StreamEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpStreamEndpoint.class);

    private static final long CLOSE_TIMEOUT_MILLIS = 5_000;

    private final SocketChannel channel;
    private final EventLoopGroup group;
    private final InboundRelay relay;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();

    private volatile StreamEndpointListener listener;

    NettyTcpStreamEndpoint(SocketChannel channel, EventLoopGroup group)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.group = Objects.requireNonNull(group, "group");
        this.relay = Objects.requireNonNull(channel.pipeline().get(InboundRelay.class), "relay");
    }

    @Override
    public void setListener(StreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
        relay.setListener(listener);
    }

    @Override
    public void start()
    {
        StreamEndpointListener l = requireListener();
        if (!started.compareAndSet(false, true)) {
            return;
        }
        l.onTransportUp();
        channel.config().setAutoRead(true);
    }

    @Override
    public void send(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");
        if (!channel.isActive()) {
            throw new TransportException("Connection to " + channel.remoteAddress() + " is closed");
        }

        // Netty queues whole buffers in call order, so writes never interleave.
        channel.writeAndFlush(Unpooled.wrappedBuffer(payload))
                .addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
    }

    @Override
    public void shutdownOutput()
    {
        if (!channel.isActive() || channel.isOutputShutdown()) {
            return;
        }
        ChannelFuture f = channel.shutdownOutput();
        if (!channel.eventLoop().inEventLoop()) {
            f.awaitUninterruptibly(CLOSE_TIMEOUT_MILLIS);
        }
        if (f.isDone() && !f.isSuccess()) {
            log.debug("Output shutdown toward {} failed", channel.remoteAddress(), f.cause());
        }
    }

    @Override
    public void stop()
    {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        ChannelFuture f = channel.close();
        if (!channel.eventLoop().inEventLoop()) {
            f.awaitUninterruptibly(CLOSE_TIMEOUT_MILLIS);
        }
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);

        relay.notifyDown(null);
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return channel.remoteAddress();
    }

    private StreamEndpointListener requireListener()
    {
        StreamEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("StreamEndpointListener must be set before start()");
        }
        return l;
    }
}

package com.questrail.tictactoe.protocol.transport.tcp.netty;

import com.questrail.tictactoe.protocol.transport.StreamEndpoint;
import com.questrail.tictactoe.protocol.transport.TransportException;

import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpConnector
 * =============================================================================
 * Establishes the single TCP connection a session runs over.
 *
 * <ul>
 *   <li>{@link #connect(String, int, Duration)} dials a listening peer</li>
 *   <li>{@link #listen(String, int)} binds a port; {@link Acceptor#accept(Duration)}
 *       then waits for exactly one peer</li>
 * </ul>
 *
 * Both return a {@link StreamEndpoint} that is not yet started. Sockets are
 * created with reads disabled, half-closure allowed and Nagle off.
 */
public final class NettyTcpConnector
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpConnector.class);

    private NettyTcpConnector() {}

    public static StreamEndpoint connect(String host, int port, Duration timeout)
    {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(timeout, "timeout");

        EventLoopGroup group = newGroup("tictactoe-client");
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, timeout.toMillis()))
                .option(ChannelOption.AUTO_READ, false)
                .option(ChannelOption.ALLOW_HALF_CLOSURE, true)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new InboundRelay());

        ChannelFuture f = bootstrap.connect(host, port);
        // Netty enforces the connect timeout; the extra second only bounds our wait.
        f.awaitUninterruptibly(timeout.toMillis() + 1_000);
        if (!f.isSuccess()) {
            f.channel().close();
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            Throwable cause = f.cause();
            throw new TransportException("Could not connect to " + host + ":" + port
                    + (cause == null ? " within " + timeout.toMillis() + " ms" : ""), cause);
        }

        log.debug("Connected to {}", f.channel().remoteAddress());
        return new NettyTcpStreamEndpoint((SocketChannel) f.channel(), group);
    }

    /**
     * Bind {@code bindHost:port} (port {@code 0} picks an ephemeral port).
     *
     * @throws TransportException if the port cannot be bound
     */
    public static Acceptor listen(String bindHost, int port)
    {
        Objects.requireNonNull(bindHost, "bindHost");
        return new Acceptor(bindHost, port);
    }

    /**
     * A bound listening socket awaiting its one peer.
     */
    public static final class Acceptor implements AutoCloseable
    {
        private final EventLoopGroup group = newGroup("tictactoe-host");
        private final CompletableFuture<SocketChannel> accepted = new CompletableFuture<>();
        private final AtomicBoolean claimed = new AtomicBoolean();
        private final Channel serverChannel;

        private volatile boolean handedOff;

        private Acceptor(String bindHost, int port)
        {
            ServerBootstrap bootstrap = new ServerBootstrap()
                    .group(group)
                    .channel(NioServerSocketChannel.class)
                    .option(ChannelOption.SO_REUSEADDR, true)
                    .childOption(ChannelOption.AUTO_READ, false)
                    .childOption(ChannelOption.ALLOW_HALF_CLOSURE, true)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch)
                        {
                            if (!claimed.compareAndSet(false, true)) {
                                log.warn("Rejecting extra connection from {}", ch.remoteAddress());
                                ch.close();
                                return;
                            }
                            ch.pipeline().addLast(new InboundRelay());
                            accepted.complete(ch);
                        }
                    });

            ChannelFuture f = bootstrap.bind(bindHost, port).awaitUninterruptibly();
            if (!f.isSuccess()) {
                group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
                throw new TransportException("Could not listen on " + bindHost + ":" + port, f.cause());
            }
            this.serverChannel = f.channel();
            log.debug("Listening on {}", serverChannel.localAddress());
        }

        /**
         * The bound port; meaningful as soon as {@link #listen} returns.
         */
        public int port()
        {
            return ((InetSocketAddress) serverChannel.localAddress()).getPort();
        }

        /**
         * Wait for the peer. The listening socket is closed either way.
         *
         * @throws TransportException if no peer connects within {@code timeout}
         */
        public StreamEndpoint accept(Duration timeout)
        {
            Objects.requireNonNull(timeout, "timeout");
            int port = port();
            try {
                SocketChannel ch = accepted.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                serverChannel.close().awaitUninterruptibly();
                handedOff = true;
                log.debug("Accepted {}", ch.remoteAddress());
                return new NettyTcpStreamEndpoint(ch, group);
            } catch (TimeoutException e) {
                close();
                throw new TransportException("No peer connected to port " + port + " within "
                        + timeout.toMillis() + " ms", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                close();
                throw new TransportException("Interrupted while waiting for a peer", e);
            } catch (ExecutionException e) {
                close();
                throw new TransportException("Accept failed", e.getCause());
            }
        }

        /**
         * Release the listening socket. After a successful {@link #accept} the
         * event loop belongs to the returned endpoint and is left running.
         */
        @Override
        public void close()
        {
            serverChannel.close();
            if (!handedOff) {
                accepted.cancel(false);
                group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            }
        }
    }

    private static EventLoopGroup newGroup(String name)
    {
        return new NioEventLoopGroup(1, new DefaultThreadFactory(name, true));
    }
}

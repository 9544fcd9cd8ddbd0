package com.questrail.tictactoe.protocol.transport;

import java.net.SocketAddress;

/**
 * StreamEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for one established, bidirectional byte stream (TCP-style).
 *
 * <p>The endpoint moves bytes only. Chunk boundaries delivered to the listener
 * carry no meaning; reassembling frames is the job of the layer above.</p>
 *
 * <p>Implementations may be backed by Netty, plain sockets, or a test harness.</p>
 */
public interface StreamEndpoint
{
    /**
     * Begin delivering inbound bytes to the listener.
     *
     * <p>On success the endpoint MUST notify its listener via
     * {@link StreamEndpointListener#onTransportUp()} exactly once.</p>
     */
    void start();

    /**
     * Queue {@code payload} for writing. Payloads from concurrent callers are
     * written whole, in call order.
     *
     * <p>A write that fails after this returns brings the transport down.</p>
     *
     * @throws TransportException if the stream is already closed
     */
    void send(byte[] payload);

    /**
     * Half-close: signal end-of-stream to the peer while still reading.
     * Best effort; never throws.
     */
    void shutdownOutput();

    /**
     * Close the stream and release all transport resources.
     *
     * <p>The listener is notified via
     * {@link StreamEndpointListener#onTransportDown(Throwable)} at most once,
     * whichever of stop, peer reset or I/O error happens first.</p>
     */
    void stop();

    /**
     * Register the listener that receives inbound bytes and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(StreamEndpointListener listener);

    /**
     * The peer address, or {@code null} if unknown.
     */
    SocketAddress remoteAddress();
}

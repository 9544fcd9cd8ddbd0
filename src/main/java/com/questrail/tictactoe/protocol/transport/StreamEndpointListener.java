package com.questrail.tictactoe.protocol.transport;

/**
 * StreamEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link StreamEndpoint}.
 *
 * <p>Callbacks are delivered serially, in stream order. Netty endpoints deliver
 * them on the connection's event loop.</p>
 */
public interface StreamEndpointListener
{
    /**
     * The stream is readable. Carries no protocol meaning.
     */
    void onTransportUp();

    /**
     * Bytes received, exactly as read. A chunk may hold part of a frame or
     * several frames.
     */
    void onBytes(byte[] chunk);

    /**
     * The peer closed its sending side. No further {@link #onBytes} follow.
     */
    void onEndOfStream();

    /**
     * The stream is unusable.
     *
     * @param cause the failure, or {@code null} for an orderly close
     */
    void onTransportDown(Throwable cause);
}

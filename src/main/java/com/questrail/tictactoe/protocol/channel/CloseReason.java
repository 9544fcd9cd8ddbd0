package com.questrail.tictactoe.protocol.channel;

/**
 * Why a {@link FramedChannel} closed. Reported exactly once per channel.
 */
public enum CloseReason
{
    /** {@link FramedChannel#close()} was called locally. */
    LOCAL_REQUEST,

    /** The peer sent the reserved close frame. */
    PEER_CLOSED,

    /** The stream ended without a close frame. */
    END_OF_STREAM,

    /** A read or write on the stream failed. */
    TRANSPORT_ERROR,

    /** An inbound frame could not be decoded, or a handler rejected it. */
    PROTOCOL_ERROR
}

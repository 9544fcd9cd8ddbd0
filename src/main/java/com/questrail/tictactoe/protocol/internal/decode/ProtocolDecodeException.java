package com.questrail.tictactoe.protocol.internal.decode;

/**
 * Indicates that a well-formed {@code Frame} could not be translated into a
 * valid {@code ProtocolMessage}.
 *
 * This typically reflects:
 * <ul>
 *   <li>Unknown message type</li>
 *   <li>Missing or unexpected fields</li>
 *   <li>A field of the wrong JSON type or out of range</li>
 * </ul>
 */
public final class ProtocolDecodeException extends RuntimeException
{
    public ProtocolDecodeException(String message) {
        super(message);
    }

    public ProtocolDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.questrail.tictactoe.protocol.codec;

/**
 * Bytes read from the stream could not be turned into a {@link
 * com.questrail.tictactoe.protocol.model.Frame}: malformed JSON, a non-object
 * payload, a missing {@code type}, or a frame longer than the configured limit.
 *
 * <p>Always fatal to the channel that read the bytes.</p>
 */
public final class FrameDecodeException extends RuntimeException
{
    public FrameDecodeException(String message)
    {
        super(message);
    }

    public FrameDecodeException(String message, Throwable cause)
    {
        super(message, cause);
    }
}

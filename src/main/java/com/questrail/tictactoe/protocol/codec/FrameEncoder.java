package com.questrail.tictactoe.protocol.codec;

import com.questrail.tictactoe.protocol.model.Frame;

/**
 * FrameEncoder
 * -----------------------------------------------------------------------------
 * Mechanical inverse of {@link FrameDecoder}: produces the exact bytes to write
 * to the stream, including the trailing delimiter.
 */
public interface FrameEncoder
{
    /**
     * @throws IllegalArgumentException if the frame holds values that cannot be encoded
     */
    byte[] encode(Frame frame);
}

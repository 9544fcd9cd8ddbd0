package com.questrail.tictactoe.protocol.channel;

import com.questrail.tictactoe.protocol.model.Frame;

/**
 * Push-style consumer of inbound frames of one type.
 *
 * <p>Invoked on the channel's reader thread, in arrival order. An exception
 * thrown here closes the channel with {@link CloseReason#PROTOCOL_ERROR}.</p>
 */
@FunctionalInterface
public interface FrameHandler
{
    void onFrame(Frame frame);
}

package com.questrail.tictactoe.protocol.observability;

import java.time.Instant;

/**
 * One frame crossing the channel.
 */
public record ChannelFrameEvent(
    Instant timestamp,
    Direction direction,
    String type
) {
    public enum Direction { INBOUND, OUTBOUND }
}

package com.questrail.tictactoe.protocol.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly on a framed channel.
 */
public record ChannelErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}

package com.questrail.tictactoe.protocol.observability;

import java.time.Instant;

/**
 * The channel opened, or closed for {@code reason}.
 *
 * @param reason {@code null} when {@code opened} is true
 */
public record ChannelLifecycleEvent(
    Instant timestamp,
    boolean opened,
    String remote,
    String reason
) {
}

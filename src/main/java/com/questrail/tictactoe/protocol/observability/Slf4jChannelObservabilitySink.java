package com.questrail.tictactoe.protocol.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ChannelObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jChannelObservabilitySink implements ChannelObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jChannelObservabilitySink.class);

    @Override
    public void onFrame(ChannelFrameEvent event) {
        log.debug("Frame {} {}", event.direction(), event.type());
    }

    @Override
    public void onLifecycle(ChannelLifecycleEvent event) {
        if (event.opened()) {
            log.info("Channel to {} open", event.remote());
        } else {
            log.info("Channel to {} closed: {}", event.remote(), event.reason());
        }
    }

    @Override
    public void onError(ChannelErrorEvent event) {
        log.error("Channel error: {}", event.message(), event.cause());
    }
}

package com.questrail.tictactoe.protocol.observability;

/**
 * Receives framed-channel observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface ChannelObservabilitySink {
    /**
     * Called for every frame sent or received.
     * @param event the frame details
     */
    void onFrame(ChannelFrameEvent event);

    /**
     * Called when the channel opens or closes.
     * @param event the lifecycle transition
     */
    void onLifecycle(ChannelLifecycleEvent event);

    /**
     * Called when a frame cannot be decoded, a handler fails, or the transport errors.
     * @param event the error event
     */
    void onError(ChannelErrorEvent event);
}

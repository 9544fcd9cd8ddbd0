package com.questrail.tictactoe.protocol.observability;

/**
 * No-op implementation of ChannelObservabilitySink.
 */
public final class NullObservabilitySink implements ChannelObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onFrame(ChannelFrameEvent event) {}

    @Override
    public void onLifecycle(ChannelLifecycleEvent event) {}

    @Override
    public void onError(ChannelErrorEvent event) {}
}

package com.questrail.tictactoe.protocol.transport;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * FakeStreamEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link StreamEndpoint} implementation.
 *
 * <p>Stores outbound bytes and lets tests inject inbound chunks and lifecycle
 * signals. Injection runs the listener on the calling thread, standing in for
 * the reader thread.</p>
 */
public final class FakeStreamEndpoint implements StreamEndpoint {

    private volatile StreamEndpointListener listener;
    private final List<byte[]> sent = new ArrayList<>();
    private volatile Consumer<String> onSend = line -> {};
    private volatile boolean failSends;
    private volatile boolean started;
    private volatile boolean stopped;
    private volatile boolean outputShutdown;

    @Override
    public void setListener(StreamEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        started = true;
        if (listener != null) {
            listener.onTransportUp();
        }
    }

    @Override
    public void send(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        if (stopped) {
            throw new TransportException("stopped");
        }
        if (failSends) {
            throw new TransportException("simulated write failure");
        }
        synchronized (sent) {
            sent.add(payload.clone());
        }
        onSend.accept(new String(payload, StandardCharsets.UTF_8).trim());
    }

    @Override
    public void shutdownOutput() {
        outputShutdown = true;
    }

    @Override
    public void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        if (listener != null) {
            listener.onTransportDown(null);
        }
    }

    @Override
    public SocketAddress remoteAddress() {
        return InetSocketAddress.createUnresolved("fake-peer", 1);
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void inject(byte[] chunk) {
        StreamEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("No listener installed");
        }
        l.onBytes(chunk);
    }

    /**
     * Inject one or more text lines, each terminated with a newline.
     */
    public void injectLines(String... lines) {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        inject(sb.toString().getBytes(StandardCharsets.UTF_8));
    }

    public void injectEndOfStream() {
        listener.onEndOfStream();
    }

    public void injectFailure(Throwable cause) {
        listener.onTransportDown(cause);
    }

    /**
     * Called with each sent line (without its newline), on the sending thread.
     */
    public void onSend(Consumer<String> onSend) {
        this.onSend = Objects.requireNonNull(onSend, "onSend");
    }

    public void failSends(boolean fail) {
        this.failSends = fail;
    }

    /**
     * Sent payloads as text, newline stripped.
     */
    public List<String> sentLines() {
        List<String> lines = new ArrayList<>();
        synchronized (sent) {
            for (byte[] p : sent) {
                lines.add(new String(p, StandardCharsets.UTF_8).trim());
            }
        }
        return lines;
    }

    public boolean isStarted() {
        return started;
    }

    public boolean isStopped() {
        return stopped;
    }

    public boolean isOutputShutdown() {
        return outputShutdown;
    }
}

package com.questrail.tictactoe.config;

import com.questrail.tictactoe.protocol.observability.ChannelObservabilitySink;
import com.questrail.tictactoe.protocol.observability.Slf4jChannelObservabilitySink;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings for a networked game session.
 *
 * <p>{@code port} 0 asks the host for an ephemeral port.</p>
 */
public record SessionConfig(
    String host,
    int port,
    Duration acceptTimeout,
    Duration connectTimeout,
    Duration handshakeTimeout,
    int maxFrameLength,
    ChannelObservabilitySink observability
) {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 9000;
    public static final int DEFAULT_MAX_FRAME_LENGTH = 64 * 1024;

    public SessionConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(acceptTimeout, "acceptTimeout");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");
        Objects.requireNonNull(observability, "observability");
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (maxFrameLength <= 0) {
            throw new IllegalArgumentException("maxFrameLength must be positive: " + maxFrameLength);
        }
    }

    public static SessionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private Duration acceptTimeout = Duration.ofSeconds(3);
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration handshakeTimeout = Duration.ofSeconds(5);
        private int maxFrameLength = DEFAULT_MAX_FRAME_LENGTH;
        private ChannelObservabilitySink observability = new Slf4jChannelObservabilitySink();

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withAcceptTimeout(Duration acceptTimeout) {
            this.acceptTimeout = acceptTimeout;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withHandshakeTimeout(Duration handshakeTimeout) {
            this.handshakeTimeout = handshakeTimeout;
            return this;
        }

        public Builder withMaxFrameLength(int maxFrameLength) {
            this.maxFrameLength = maxFrameLength;
            return this;
        }

        public Builder withObservability(ChannelObservabilitySink observability) {
            this.observability = observability;
            return this;
        }

        public SessionConfig build() {
            return new SessionConfig(host, port, acceptTimeout, connectTimeout, handshakeTimeout,
                    maxFrameLength, observability);
        }
    }
}

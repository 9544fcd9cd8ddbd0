package com.questrail.tictactoe.config;

import com.questrail.tictactoe.protocol.observability.NullObservabilitySink;
import com.questrail.tictactoe.protocol.observability.Slf4jChannelObservabilitySink;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SessionConfigTest
{
    @Test
    void defaults()
    {
        SessionConfig config = SessionConfig.defaults();

        assertEquals("127.0.0.1", config.host());
        assertEquals(9000, config.port());
        assertEquals(Duration.ofSeconds(3), config.acceptTimeout());
        assertEquals(Duration.ofSeconds(3), config.connectTimeout());
        assertEquals(Duration.ofSeconds(5), config.handshakeTimeout());
        assertEquals(64 * 1024, config.maxFrameLength());
        assertTrue(config.observability() instanceof Slf4jChannelObservabilitySink);
    }

    @Test
    void builderOverridesOnlyWhatIsSet()
    {
        SessionConfig config = SessionConfig.builder()
                .withHost("0.0.0.0")
                .withPort(0)
                .withHandshakeTimeout(Duration.ofMillis(250))
                .withObservability(NullObservabilitySink.INSTANCE)
                .build();

        assertEquals("0.0.0.0", config.host());
        assertEquals(0, config.port());
        assertEquals(Duration.ofMillis(250), config.handshakeTimeout());
        assertEquals(Duration.ofSeconds(3), config.acceptTimeout());
        assertSame(NullObservabilitySink.INSTANCE, config.observability());
    }

    @Test
    void rejectsInvalidValues()
    {
        assertThrows(IllegalArgumentException.class, () -> SessionConfig.builder().withPort(-1).build());
        assertThrows(IllegalArgumentException.class, () -> SessionConfig.builder().withPort(70_000).build());
        assertThrows(IllegalArgumentException.class, () -> SessionConfig.builder().withMaxFrameLength(0).build());
        assertThrows(NullPointerException.class, () -> SessionConfig.builder().withHost(null).build());
    }
}

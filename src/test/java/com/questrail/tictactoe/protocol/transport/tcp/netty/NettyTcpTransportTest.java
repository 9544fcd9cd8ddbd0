package com.questrail.tictactoe.protocol.transport.tcp.netty;

import com.questrail.tictactoe.protocol.channel.CloseReason;
import com.questrail.tictactoe.protocol.channel.FramedChannel;
import com.questrail.tictactoe.protocol.model.Frame;
import com.questrail.tictactoe.protocol.observability.NullObservabilitySink;
import com.questrail.tictactoe.protocol.observability.RecordingObservabilitySink;
import com.questrail.tictactoe.protocol.transport.StreamEndpoint;
import com.questrail.tictactoe.protocol.transport.TransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two framed channels over a loopback TCP connection.
 */
class NettyTcpTransportTest
{
    private static final Duration WAIT = Duration.ofSeconds(5);

    private FramedChannel hostSide;
    private FramedChannel clientSide;

    @AfterEach
    void tearDown()
    {
        if (clientSide != null) {
            clientSide.close();
        }
        if (hostSide != null) {
            hostSide.close();
        }
    }

    private void connect(int maxFrameLength) throws Exception
    {
        try (NettyTcpConnector.Acceptor acceptor = NettyTcpConnector.listen("127.0.0.1", 0)) {
            CompletableFuture<StreamEndpoint> accepted = CompletableFuture.supplyAsync(() -> acceptor.accept(WAIT));
            StreamEndpoint client = NettyTcpConnector.connect("127.0.0.1", acceptor.port(), WAIT);
            StreamEndpoint host = accepted.get(WAIT.toSeconds(), TimeUnit.SECONDS);

            clientSide = FramedChannel.open(client, maxFrameLength, NullObservabilitySink.INSTANCE);
            hostSide = FramedChannel.open(host, maxFrameLength, new RecordingObservabilitySink());
        }
    }

    private static void eventually(BooleanSupplier condition) throws InterruptedException
    {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within " + WAIT.toSeconds() + " s");
            }
            Thread.sleep(10);
        }
    }

    @Test
    void framesArriveInOrder() throws Exception
    {
        connect(4096);

        for (int i = 0; i < 200; i++) {
            clientSide.send(Frame.builder("tick").put("n", i).build());
        }

        for (int i = 0; i < 200; i++) {
            Optional<Frame> frame = hostSide.receive(WAIT);
            assertTrue(frame.isPresent(), "frame " + i);
            assertEquals(i, frame.get().get("n"));
        }
    }

    @Test
    void largeFrameSurvivesSegmentation() throws Exception
    {
        connect(256 * 1024);
        String blob = "x".repeat(100_000);

        hostSide.send(Frame.builder("blob").put("data", blob).build());

        assertEquals(blob, clientSide.receive(WAIT).orElseThrow().get("data"));
    }

    @Test
    void localCloseIsSeenAsPeerClose() throws Exception
    {
        connect(4096);

        clientSide.close();

        eventually(() -> !hostSide.isOpen());
        assertEquals(Optional.of(CloseReason.PEER_CLOSED), hostSide.closeReason());
        assertEquals(Optional.empty(), hostSide.receive(Duration.ofMillis(10)));
    }

    @Test
    void oversizedFrameClosesTheReceiver() throws Exception
    {
        connect(1024);

        clientSide.send(Frame.builder("blob").put("data", "y".repeat(4096)).build());

        eventually(() -> !hostSide.isOpen());
        assertEquals(Optional.of(CloseReason.PROTOCOL_ERROR), hostSide.closeReason());
        eventually(() -> !clientSide.isOpen());
    }

    @Test
    void connectionRefused() throws Exception
    {
        int unused;
        try (ServerSocket reserved = new ServerSocket(0)) {
            unused = reserved.getLocalPort();
        }

        assertThrows(TransportException.class, () -> NettyTcpConnector.connect("127.0.0.1", unused, WAIT));
    }

    @Test
    void acceptTimesOut()
    {
        NettyTcpConnector.Acceptor acceptor = NettyTcpConnector.listen("127.0.0.1", 0);

        assertThrows(TransportException.class, () -> acceptor.accept(Duration.ofMillis(100)));
    }
}

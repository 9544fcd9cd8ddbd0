package com.questrail.tictactoe.protocol.transport.tcp.netty;

import com.questrail.tictactoe.protocol.transport.StreamEndpointListener;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import io.netty.util.ReferenceCountUtil;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Forwards Netty inbound events to the port listener as plain bytes.
 *
 * <p>Installed in the pipeline when the socket is created, before the owning
 * {@link NettyTcpStreamEndpoint} and its listener exist. Reads stay disabled
 * until the endpoint is started, so nothing is lost in between.</p>
 */
final class InboundRelay extends ChannelInboundHandlerAdapter
{
    private final AtomicBoolean down = new AtomicBoolean();

    private volatile StreamEndpointListener listener;

    void setListener(StreamEndpointListener listener)
    {
        this.listener = listener;
    }

    /**
     * Report the transport down once, regardless of who noticed first.
     */
    void notifyDown(Throwable cause)
    {
        StreamEndpointListener l = listener;
        if (l != null && down.compareAndSet(false, true)) {
            l.onTransportDown(cause);
        }
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg)
    {
        try {
            StreamEndpointListener l = listener;
            if (l == null || !(msg instanceof ByteBuf content)) {
                return;
            }
            // Copy out of the pooled buffer; Netty types stay in this package.
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            l.onBytes(bytes);
        } finally {
            ReferenceCountUtil.release(msg);
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt)
    {
        if (evt instanceof ChannelInputShutdownEvent) {
            StreamEndpointListener l = listener;
            if (l != null) {
                l.onEndOfStream();
            }
            return;
        }
        ctx.fireUserEventTriggered(evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx)
    {
        notifyDown(null);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        notifyDown(cause);
        ctx.close();
    }
}

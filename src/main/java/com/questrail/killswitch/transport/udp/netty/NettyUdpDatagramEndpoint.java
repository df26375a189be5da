package com.questrail.killswitch.transport.udp.netty;

import com.questrail.killswitch.transport.DatagramEndpoint;
import com.questrail.killswitch.transport.DatagramEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty-backed {@link DatagramEndpoint}. The runtime creates one for heartbeat
 * ingress and one for alarm egress.
 *
 * <h2>Architectural Role</h2>
 * A <strong>pure transport adapter</strong>: it never decodes alarm records,
 * counts heartbeats or touches the alarm bus.
 *
 * <h2>Netty containment rule</h2>
 * {@code Channel}, {@code EventLoopGroup} and {@code ByteBuf} stay inside this
 * package. Inbound payloads are copied into {@code byte[]} before they reach
 * the listener; Netty releases the packet after {@code channelRead0}.
 *
 * <h2>Threading</h2>
 * One daemon event loop thread per endpoint, named after the bind port.
 * Listener callbacks run on it, so a listener must not block. Heartbeat ingress
 * only stamps the watchdog; egress queries only read the bus.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   start() → asynchronous bind → onTransportUp / onTransportDown(cause)
 *   stop()  → channel closed (blocking), event loop shut down
 * </pre>
 * An endpoint is not restartable after {@code stop()}.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpDatagramEndpoint.class);

    private final InetSocketAddress bindAddress;
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.group = new NioEventLoopGroup(1, eventLoopThreads(bindAddress));
        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before start()");
        }

        ChannelFuture bind = bootstrap.bind(bindAddress);
        bind.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.warn("UDP bind to {} failed", bindAddress, future.cause());
                l.onTransportDown(future.cause());
                return;
            }
            channel = future.channel();
            log.debug("UDP endpoint bound to {}", future.channel().localAddress());
            l.onTransportUp();
        });
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            // channelInactive reports the transport down.
            ch.close().syncUninterruptibly();
        }
        group.shutdownGracefully();
    }

    @Override
    public void send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null) {
            log.debug("Dropping {} byte datagram to {}: transport not up", payload.length, remote);
            return;
        }

        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        ch.writeAndFlush(new DatagramPacket(buf, (InetSocketAddress) remote))
                .addListener((ChannelFutureListener) future -> {
                    if (!future.isSuccess()) {
                        log.debug("Datagram to {} not sent", remote, future.cause());
                    }
                });
    }

    private static ThreadFactory eventLoopThreads(InetSocketAddress bindAddress)
    {
        String name = "kill-switch-udp-" + bindAddress.getPort();
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            DatagramEndpointListener l = listener;
            if (l == null) {
                return;
            }

            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            try {
                l.onDatagram(packet.sender(), bytes);
            } catch (RuntimeException e) {
                // One bad datagram must not close a heartbeat socket.
                log.warn("Listener rejected datagram from {}", packet.sender(), e);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            DatagramEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(null);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("UDP endpoint {} failed; closing", bindAddress, cause);
            DatagramEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(cause);
            }
            ctx.close();
        }
    }
}

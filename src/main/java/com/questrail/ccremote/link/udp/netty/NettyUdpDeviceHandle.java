package com.questrail.ccremote.link.udp.netty;

import com.questrail.ccremote.api.LinkUnavailableException;
import com.questrail.ccremote.link.DeviceHandle;
import com.questrail.ccremote.link.InboundChannel;
import com.questrail.ccremote.link.InboundReceiver;
import com.questrail.ccremote.link.OutboundChannel;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyUdpDeviceHandle
 * =============================================================================
 * Netty-backed {@link DeviceHandle} for network MIDI bridges that carry raw
 * MIDI bytes in UDP datagrams, one message per datagram.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT encode
 * control changes, interpret inbound bytes, or log traffic; that is the job of
 * {@code DeviceLink}.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound payloads are copied into
 * {@code byte[]}; reference-counted buffers are released internally.
 *
 * <h2>Lifecycle</h2>
 * The socket is bound on the first open call and shared by the outbound and
 * inbound channel. {@link #close()} closes the socket and shuts down the event
 * loop group. Inbound delivery happens on the event loop thread.
 */
public final class NettyUdpDeviceHandle implements DeviceHandle
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpDeviceHandle.class);

    private static final long IO_TIMEOUT_MILLIS = 2_000;

    private final String name;
    private final InetSocketAddress bindAddress;
    private final InetSocketAddress remoteAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private final Object bindLock = new Object();
    private volatile Channel channel;
    private volatile InboundReceiver receiver;
    private volatile boolean closed;

    /**
     * @param bindAddress   local address to receive on (port 0 picks a free port)
     * @param remoteAddress the bridge's address that outbound datagrams go to
     */
    public NettyUdpDeviceHandle(String name, InetSocketAddress bindAddress, InetSocketAddress remoteAddress)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public String name()
    {
        return name;
    }

    /**
     * Returns the bound local address, or {@code null} before the first open.
     */
    public SocketAddress localAddress()
    {
        Channel ch = channel;
        return ch == null ? null : ch.localAddress();
    }

    @Override
    public OutboundChannel openOutbound()
    {
        Channel ch = bind();
        return new DatagramOutbound(ch);
    }

    @Override
    public InboundChannel openInbound()
    {
        bind();
        return new DatagramInbound();
    }

    private Channel bind()
    {
        synchronized (bindLock) {
            if (closed) {
                throw new LinkUnavailableException("Device '" + name + "' is closed");
            }
            Channel ch = channel;
            if (ch != null) {
                return ch;
            }

            ChannelFuture f = bootstrap.bind(bindAddress);
            if (!f.awaitUninterruptibly(IO_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
                throw new LinkUnavailableException("Timed out binding " + bindAddress);
            }
            if (!f.isSuccess()) {
                throw new LinkUnavailableException("Failed to bind " + bindAddress, f.cause());
            }
            channel = f.channel();
            log.info("UDP MIDI device '{}' bound to {} -> {}", name, channel.localAddress(), remoteAddress);
            return channel;
        }
    }

    @Override
    public void close()
    {
        synchronized (bindLock) {
            if (closed) {
                return;
            }
            closed = true;
        }

        receiver = null;
        Channel ch = channel;
        if (ch != null) {
            ch.close().awaitUninterruptibly(IO_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
        }
        group.shutdownGracefully(0, IO_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
    }

    @Override
    public String toString()
    {
        return "NettyUdpDeviceHandle[" + name + " -> " + remoteAddress + "]";
    }

    private final class DatagramOutbound implements OutboundChannel
    {
        private final Channel ch;
        private volatile boolean released;

        DatagramOutbound(Channel ch)
        {
            this.ch = ch;
        }

        @Override
        public void send(byte[] message) throws IOException
        {
            Objects.requireNonNull(message, "message");
            if (released || !ch.isActive()) {
                throw new IOException("UDP channel to " + remoteAddress + " is closed");
            }

            ByteBuf buf = Unpooled.wrappedBuffer(message.clone());
            ChannelFuture f = ch.writeAndFlush(new DatagramPacket(buf, remoteAddress));
            if (!f.awaitUninterruptibly(IO_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
                throw new IOException("Timed out writing to " + remoteAddress);
            }
            if (!f.isSuccess()) {
                throw new IOException("Write to " + remoteAddress + " failed", f.cause());
            }
        }

        @Override
        public void close()
        {
            released = true;
        }
    }

    private final class DatagramInbound implements InboundChannel
    {
        @Override
        public void connect(InboundReceiver r)
        {
            receiver = Objects.requireNonNull(r, "receiver");
        }

        @Override
        public void close()
        {
            receiver = null;
        }
    }

    /**
     * Receives Netty {@link DatagramPacket}s and forwards raw payload bytes
     * to the connected receiver.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            InboundReceiver r = receiver;
            if (r == null) {
                return;
            }

            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            r.onBytes(bytes);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("UDP MIDI device '{}' receive error", name, cause);
            InboundReceiver r = receiver;
            if (r != null) {
                r.onReceiveError(cause);
            }
        }
    }
}

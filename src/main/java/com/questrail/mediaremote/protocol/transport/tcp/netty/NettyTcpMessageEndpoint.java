package com.questrail.mediaremote.protocol.transport.tcp.netty;

import com.questrail.mediaremote.protocol.session.PeerId;
import com.questrail.mediaremote.protocol.transport.MessageEndpoint;
import com.questrail.mediaremote.protocol.transport.MessageEndpointListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.protobuf.ProtobufVarint32LengthFieldPrepender;
import io.netty.util.AttributeKey;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * NettyTcpMessageEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link MessageEndpoint} port: a TCP
 * server where every message is prefixed with its length as a varint32.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It frames and
 * deframes; it MUST NOT decode envelopes, reassemble transactions, or run
 * timers.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound frames are copied into
 * {@code byte[]} and every reference-counted buffer is released here.
 *
 * <h2>Frame limit</h2>
 * A length prefix above {@code maxFrameLength} fails the channel with a
 * {@link io.netty.handler.codec.TooLongFrameException} before any of the frame
 * is buffered, and the connection is closed.
 *
 * <h2>Peers</h2>
 * Each accepted channel becomes one {@link PeerId}, derived from the remote
 * address. All callbacks for a peer run on that channel's event loop, which
 * keeps them in wire order.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the server socket and returns once bound.
 * - {@link #stop()} closes every connection, then shuts the event loops down.
 */
public final class NettyTcpMessageEndpoint implements MessageEndpoint
{
    private static final AttributeKey<PeerId> PEER = AttributeKey.valueOf("mediaremote.peer");
    private static final AttributeKey<Throwable> FAILURE = AttributeKey.valueOf("mediaremote.failure");

    private final InetSocketAddress bindAddress;
    private final int maxFrameLength;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap bootstrap;

    private final Map<PeerId, Channel> peers = new ConcurrentHashMap<>();

    private volatile MessageEndpointListener listener;
    private volatile Channel serverChannel;

    public NettyTcpMessageEndpoint(InetSocketAddress bindAddress, int maxFrameLength)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        if (maxFrameLength <= 0) {
            throw new IllegalArgumentException("maxFrameLength must be > 0");
        }
        this.maxFrameLength = maxFrameLength;

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast("frameDecoder", new BoundedVarint32FrameDecoder(maxFrameLength));
                        p.addLast("framePrepender", new ProtobufVarint32LengthFieldPrepender());
                        p.addLast("peer", new PeerHandler());
                    }
                });
    }

    @Override
    public void setListener(MessageEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Binds the server socket, blocking until the bind completes.
     *
     * @throws IllegalStateException if the bind fails; the listener has already
     *         received {@link MessageEndpointListener#onTransportDown(Throwable)}
     */
    @Override
    public void start()
    {
        MessageEndpointListener l = requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            l.onTransportDown(f.cause());
            throw new IllegalStateException("Failed to bind " + bindAddress, f.cause());
        }

        serverChannel = f.channel();
        l.onTransportUp();
    }

    @Override
    public void stop()
    {
        MessageEndpointListener l = listener;

        Channel server = serverChannel;
        serverChannel = null;
        if (server != null) {
            server.close().awaitUninterruptibly();
        }

        for (Channel ch : List.copyOf(peers.values())) {
            ch.close().awaitUninterruptibly();
        }

        workerGroup.shutdownGracefully().awaitUninterruptibly();
        bossGroup.shutdownGracefully().awaitUninterruptibly();

        if (l != null && server != null) {
            l.onTransportDown(null);
        }
    }

    @Override
    public boolean send(PeerId peer, byte[] message)
    {
        Objects.requireNonNull(peer, "peer");
        Objects.requireNonNull(message, "message");

        Channel ch = peers.get(peer);
        if (ch == null || !ch.isActive()) {
            return false;
        }

        ch.writeAndFlush(Unpooled.wrappedBuffer(message));
        return true;
    }

    @Override
    public void disconnect(PeerId peer)
    {
        Channel ch = peers.get(peer);
        if (ch != null) {
            ch.close();
        }
    }

    @Override
    public SocketAddress localAddress()
    {
        Channel server = serverChannel;
        return (server == null) ? null : server.localAddress();
    }

    private MessageEndpointListener requireListener()
    {
        MessageEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("MessageEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * PeerHandler
     * -------------------------------------------------------------------------
     * Per-channel handler: maps the channel to a peer and forwards each
     * deframed message as a plain byte array.
     */
    private final class PeerHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            Channel ch = ctx.channel();
            PeerId peer = PeerId.of(String.valueOf(ch.remoteAddress()));
            ch.attr(PEER).set(peer);
            peers.put(peer, ch);

            MessageEndpointListener l = listener;
            if (l != null) {
                l.onPeerConnected(peer, ch.remoteAddress());
            }
            ctx.fireChannelActive();
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame)
        {
            MessageEndpointListener l = listener;
            PeerId peer = ctx.channel().attr(PEER).get();
            if (l == null || peer == null) {
                return;
            }

            byte[] bytes = new byte[frame.readableBytes()];
            frame.getBytes(frame.readerIndex(), bytes);
            l.onMessage(peer, bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            Channel ch = ctx.channel();
            PeerId peer = ch.attr(PEER).getAndSet(null);
            if (peer != null) {
                peers.remove(peer, ch);
                MessageEndpointListener l = listener;
                if (l != null) {
                    l.onPeerDisconnected(peer, ch.attr(FAILURE).get());
                }
            }
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // Reported with the disconnect that follows.
            ctx.channel().attr(FAILURE).set(cause);
            ctx.close();
        }
    }
}

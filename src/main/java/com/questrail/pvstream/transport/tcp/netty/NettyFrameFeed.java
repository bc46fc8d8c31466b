package com.questrail.pvstream.transport.tcp.netty;

import com.questrail.pvstream.transport.FeedConnectionException;
import com.questrail.pvstream.transport.FrameFeed;
import com.questrail.pvstream.transport.FrameFeedListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyFrameFeed
 * =============================================================================
 * Netty-backed TCP client implementation of the {@link FrameFeed} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Decode frames into images</li>
 *   <li>Queue, throttle or drop frames for the display</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Listeners receive {@code RawFrame} values that
 * were fully copied out of the inbound buffer.
 *
 * <h2>Lifecycle</h2>
 * - {@link #subscribe(String)} connects on first use (bounded by the connect
 *   timeout) and sends a subscribe request.
 * - {@link #unsubscribe()} stops delivery and tells the server.
 * - {@link #close()} closes the connection and shuts down the event loop.
 *
 * <p>All listener callbacks run on the connection's single event loop thread.</p>
 */
public final class NettyFrameFeed implements FrameFeed
{
    private static final Logger log = LoggerFactory.getLogger(NettyFrameFeed.class);

    private final InetSocketAddress serverAddress;
    private final Duration connectTimeout;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private volatile FrameFeedListener listener;
    private volatile Channel channel;
    private volatile String subscribedChannel;

    public NettyFrameFeed(InetSocketAddress serverAddress, Duration connectTimeout)
    {
        this.serverAddress = Objects.requireNonNull(serverAddress, "serverAddress");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        NdWirePipeline.configure(ch.pipeline());
                        ch.pipeline().addLast("feed", newInboundHandler());
                    }
                });
    }

    @Override
    public void setListener(FrameFeedListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public synchronized void subscribe(String channelName)
    {
        Objects.requireNonNull(channelName, "channelName");
        requireListener();

        Channel ch = connectIfNeeded();
        subscribedChannel = channelName;
        ch.writeAndFlush(new NdWireMessage.Subscribe(channelName));
        log.info("Subscribed to {} on {}", channelName, serverAddress);
    }

    @Override
    public synchronized void unsubscribe()
    {
        String name = subscribedChannel;
        subscribedChannel = null;
        if (name == null) {
            return;
        }
        Channel ch = channel;
        if (ch != null && ch.isActive()) {
            ch.writeAndFlush(new NdWireMessage.Unsubscribe(name));
        }
        log.info("Unsubscribed from {}", name);
    }

    @Override
    public synchronized void close()
    {
        unsubscribe();
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    private Channel connectIfNeeded()
    {
        Channel ch = channel;
        if (ch != null && ch.isActive()) {
            return ch;
        }

        ChannelFuture f = bootstrap.connect(serverAddress);
        boolean completed = f.awaitUninterruptibly(connectTimeout.toMillis() + 500);
        if (!completed) {
            f.cancel(false);
            throw new FeedConnectionException("timed out connecting to " + serverAddress);
        }
        if (!f.isSuccess()) {
            throw new FeedConnectionException("cannot connect to " + serverAddress, f.cause());
        }
        channel = f.channel();
        return channel;
    }

    InboundHandler newInboundHandler()
    {
        return new InboundHandler();
    }

    private FrameFeedListener requireListener()
    {
        FrameFeedListener l = listener;
        if (l == null) {
            throw new IllegalStateException("FrameFeedListener must be set before subscribe()");
        }
        return l;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Forwards frames of the subscribed channel to the port listener. A
     * connection reports down exactly once, from {@code channelInactive},
     * carrying the first failure seen on it if there was one.
     */
    final class InboundHandler extends SimpleChannelInboundHandler<NdWireMessage>
    {
        // Set by exceptionCaught; reported once, when the close completes
        private Throwable failure;

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            FrameFeedListener l = listener;
            if (l != null) {
                l.onFeedUp();
            }
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, NdWireMessage message)
        {
            FrameFeedListener l = listener;
            String wanted = subscribedChannel;
            if (l == null || wanted == null) {
                return;
            }
            if (message instanceof NdWireMessage.FrameUpdate update && wanted.equals(update.channelName())) {
                l.onFrame(update.frame());
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            FrameFeedListener l = listener;
            if (l != null) {
                l.onFeedDown(failure);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("Feed connection to {} failed", serverAddress, cause);
            if (failure == null) {
                failure = cause;
            }
            ctx.close();
        }
    }
}

package com.questrail.pvstream.transport.tcp.netty;

import com.questrail.pvstream.ntnd.model.RawFrame;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * NettyFrameStreamServer
 * =============================================================================
 * Publisher side of the frame stream: accepts TCP clients, tracks which
 * channel each one subscribed to, and fans published frames out to them.
 *
 * <h2>No backpressure</h2>
 * A client whose outbound buffer is over the high-water mark is skipped for
 * that frame, not queued for. Slow viewers lose frames; the publisher never
 * waits.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Callers publish {@link RawFrame}s
 * by channel name.
 */
public final class NettyFrameStreamServer
{
    private static final Logger log = LoggerFactory.getLogger(NettyFrameStreamServer.class);

    private final InetSocketAddress bindAddress;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap bootstrap;

    private final Map<String, ChannelGroup> subscribers = new ConcurrentHashMap<>();
    private final LongAdder sent = new LongAdder();
    private final LongAdder skipped = new LongAdder();

    private volatile Channel serverChannel;

    public NettyFrameStreamServer(InetSocketAddress bindAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup(1);
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        NdWirePipeline.configure(ch.pipeline());
                        ch.pipeline().addLast("subscriptions", new SubscriptionHandler());
                    }
                });
    }

    /**
     * Bind and start accepting clients.
     *
     * @throws IllegalStateException if the address cannot be bound
     */
    public void start()
    {
        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            throw new IllegalStateException("cannot bind frame server to " + bindAddress, f.cause());
        }
        serverChannel = f.channel();
        log.info("Frame server listening on {}", boundAddress());
    }

    /** Actual listening address (useful when bound to port 0). */
    public InetSocketAddress boundAddress()
    {
        Channel ch = serverChannel;
        if (ch == null) {
            throw new IllegalStateException("server not started");
        }
        return (InetSocketAddress) ch.localAddress();
    }

    /**
     * Send {@code frame} to every writable subscriber of {@code channelName}.
     *
     * @return number of clients the frame was written to
     */
    public int publish(String channelName, RawFrame frame)
    {
        Objects.requireNonNull(channelName, "channelName");
        Objects.requireNonNull(frame, "frame");

        ChannelGroup group = subscribers.get(channelName);
        if (group == null || group.isEmpty()) {
            return 0;
        }

        NdWireMessage.FrameUpdate update = new NdWireMessage.FrameUpdate(channelName, frame);
        int written = 0;
        for (Channel ch : group) {
            if (!ch.isWritable()) {
                skipped.increment();
                continue;
            }
            ch.writeAndFlush(update);
            written++;
        }
        sent.add(written);
        return written;
    }

    public int subscriberCount(String channelName)
    {
        ChannelGroup group = subscribers.get(channelName);
        return group == null ? 0 : group.size();
    }

    public long sentCount()
    {
        return sent.sum();
    }

    /** Frames not sent because the client was not writable. */
    public long skippedCount()
    {
        return skipped.sum();
    }

    public void stop()
    {
        Channel ch = serverChannel;
        serverChannel = null;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        for (ChannelGroup group : subscribers.values()) {
            group.close().awaitUninterruptibly();
        }
        subscribers.clear();
        workerGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        bossGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        log.info("Frame server on {} stopped", bindAddress);
    }

    private ChannelGroup groupFor(String channelName)
    {
        return subscribers.computeIfAbsent(channelName,
                name -> new DefaultChannelGroup(name, GlobalEventExecutor.INSTANCE));
    }

    /**
     * SubscriptionHandler
     * -------------------------------------------------------------------------
     * Applies client subscribe/unsubscribe requests. Closed channels leave
     * their groups automatically.
     */
    private final class SubscriptionHandler extends SimpleChannelInboundHandler<NdWireMessage>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, NdWireMessage message)
        {
            if (message instanceof NdWireMessage.Subscribe s) {
                groupFor(s.channelName()).add(ctx.channel());
                log.debug("{} subscribed to {}", ctx.channel().remoteAddress(), s.channelName());
            }
            else if (message instanceof NdWireMessage.Unsubscribe u) {
                ChannelGroup group = subscribers.get(u.channelName());
                if (group != null) {
                    group.remove(ctx.channel());
                }
                log.debug("{} unsubscribed from {}", ctx.channel().remoteAddress(), u.channelName());
            }
            else {
                log.warn("Ignoring unexpected {} from {}", message.getClass().getSimpleName(),
                        ctx.channel().remoteAddress());
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("Client {} failed", ctx.channel().remoteAddress(), cause);
            ctx.close();
        }
    }
}

package com.questrail.pvstream.runtime;

import com.questrail.pvstream.internal.time.MonotonicClock;
import com.questrail.pvstream.internal.time.ScheduledExecutorScheduler;
import com.questrail.pvstream.internal.time.SystemMonotonicClock;
import com.questrail.pvstream.internal.time.SystemWallClock;
import com.questrail.pvstream.ntnd.codec.impl.DefaultFrameEncoder;
import com.questrail.pvstream.sim.TestPattern;
import com.questrail.pvstream.sim.TestPatternStreamer;
import com.questrail.pvstream.transport.tcp.netty.NettyFrameStreamServer;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * TestPatternServerRuntime
 * =============================================================================
 * Composition root for a synthetic detector: a {@link TestPatternStreamer}
 * publishing one channel through a {@link NettyFrameStreamServer}.
 */
public final class TestPatternServerRuntime {

    private final NettyFrameStreamServer server;
    private final TestPatternStreamer streamer;
    private final ScheduledExecutorService executor;
    private final String channelName;

    private TestPatternServerRuntime(NettyFrameStreamServer server,
                                     TestPatternStreamer streamer,
                                     ScheduledExecutorService executor,
                                     String channelName) {
        this.server = server;
        this.streamer = streamer;
        this.executor = executor;
        this.channelName = channelName;
    }

    public void start() {
        server.start();
        streamer.start();
    }

    public void stop() {
        streamer.stop();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        server.stop();
    }

    public InetSocketAddress boundAddress() {
        return server.boundAddress();
    }

    public String channelName() {
        return channelName;
    }

    public int subscriberCount() {
        return server.subscriberCount(channelName);
    }

    public long framesGenerated() {
        return streamer.frameCount();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String channelName;
        private InetSocketAddress bindAddress = new InetSocketAddress("127.0.0.1", 0);
        private TestPattern pattern = TestPattern.GRADIENT;
        private int width = 1000;
        private int height = 1000;
        private double fps = 10.0;
        private long seed = 0L;

        public Builder withChannelName(String channelName) {
            this.channelName = channelName;
            return this;
        }

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withPattern(TestPattern pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder withSize(int width, int height) {
            this.width = width;
            this.height = height;
            return this;
        }

        public Builder withFps(double fps) {
            this.fps = fps;
            return this;
        }

        public Builder withSeed(long seed) {
            this.seed = seed;
            return this;
        }

        public TestPatternServerRuntime build() {
            Objects.requireNonNull(channelName, "channelName");
            Objects.requireNonNull(bindAddress, "bindAddress");
            Objects.requireNonNull(pattern, "pattern");

            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            ScheduledExecutorService exec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "pvstream-pattern");
                t.setDaemon(true);
                return t;
            });

            NettyFrameStreamServer server = new NettyFrameStreamServer(bindAddress);
            String channel = channelName;
            TestPatternStreamer streamer = new TestPatternStreamer(
                frame -> server.publish(channel, frame),
                new DefaultFrameEncoder(),
                pattern,
                width,
                height,
                fps,
                new ScheduledExecutorScheduler(exec, clock),
                clock,
                SystemWallClock.INSTANCE,
                seed);

            return new TestPatternServerRuntime(server, streamer, exec, channel);
        }
    }
}

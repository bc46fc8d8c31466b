package com.questrail.pvstream.runtime;

import com.questrail.pvstream.api.FrameRenderer;
import com.questrail.pvstream.config.ViewerConfig;
import com.questrail.pvstream.display.DisplayLoop;
import com.questrail.pvstream.display.DisplayPump;
import com.questrail.pvstream.internal.time.MonotonicClock;
import com.questrail.pvstream.internal.time.MonotonicScheduler;
import com.questrail.pvstream.internal.time.ScheduledExecutorScheduler;
import com.questrail.pvstream.internal.time.SystemMonotonicClock;
import com.questrail.pvstream.internal.time.SystemWallClock;
import com.questrail.pvstream.internal.time.WallClock;
import com.questrail.pvstream.ntnd.codec.FrameDecoder;
import com.questrail.pvstream.ntnd.codec.impl.DefaultFrameDecoder;
import com.questrail.pvstream.observability.Slf4jStreamObservabilitySink;
import com.questrail.pvstream.observability.StreamObservabilitySink;
import com.questrail.pvstream.processing.ProcessorChain;
import com.questrail.pvstream.processing.ProcessorRegistry;
import com.questrail.pvstream.queue.FrameQueue;
import com.questrail.pvstream.subscriber.StreamSubscriber;
import com.questrail.pvstream.transport.FrameFeed;
import com.questrail.pvstream.transport.tcp.netty.NettyFrameFeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * ViewerRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one viewer: feed, subscriber,
 * queue, display pump and the display thread that drives it.
 *
 * <h2>Threads</h2>
 * <ul>
 *   <li>Feed thread: owned by the {@link FrameFeed}; runs the subscriber.</li>
 *   <li>Display thread: a single-threaded scheduled executor; runs every
 *       pump tick and every {@link #onDisplayThread(Consumer)} action.</li>
 * </ul>
 *
 * <p>Unless another sink is supplied, drops, hook failures and feed state
 * changes go to SLF4J through {@link Slf4jStreamObservabilitySink}.</p>
 */
public final class ViewerRuntime {
    private static final Logger log = LoggerFactory.getLogger(ViewerRuntime.class);

    private final ViewerConfig config;
    private final FrameFeed feed;
    private final FrameQueue queue;
    private final StreamSubscriber subscriber;
    private final DisplayPump pump;
    private final DisplayLoop loop;
    private final ScheduledExecutorService displayExecutor;

    private ViewerRuntime(ViewerConfig config,
                          FrameFeed feed,
                          FrameQueue queue,
                          StreamSubscriber subscriber,
                          DisplayPump pump,
                          DisplayLoop loop,
                          ScheduledExecutorService displayExecutor) {
        this.config = config;
        this.feed = feed;
        this.queue = queue;
        this.subscriber = subscriber;
        this.pump = pump;
        this.loop = loop;
        this.displayExecutor = displayExecutor;
    }

    /**
     * Start the display loop, then subscribe.
     *
     * @throws com.questrail.pvstream.transport.FeedConnectionException if the
     *         feed cannot subscribe; the display loop is stopped again
     */
    public void start() {
        loop.start();
        try {
            subscriber.start();
        } catch (RuntimeException e) {
            loop.stop();
            throw e;
        }
        log.info("Viewer started on {}", config.feed().channelName());
    }

    public void stop() {
        subscriber.stop();
        loop.stop();
        feed.close();
        displayExecutor.shutdown();
        try {
            if (!displayExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                displayExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            displayExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Viewer on {} stopped", config.feed().channelName());
    }

    /**
     * Run {@code action} against the pump on the display thread. This is the
     * way to change view options while running.
     */
    public CompletableFuture<Void> onDisplayThread(Consumer<DisplayPump> action) {
        Objects.requireNonNull(action, "action");
        return CompletableFuture.runAsync(() -> action.accept(pump), displayExecutor);
    }

    /** Read pump state on the display thread. */
    public <T> CompletableFuture<T> queryDisplay(Function<DisplayPump, T> query) {
        Objects.requireNonNull(query, "query");
        return CompletableFuture.supplyAsync(() -> query.apply(pump), displayExecutor);
    }

    /** Pause or resume from any thread. */
    public void setPaused(boolean paused) {
        if (paused) {
            pump.pause();
        } else {
            pump.resume();
        }
    }

    public FrameQueue queue() {
        return queue;
    }

    public StreamSubscriber subscriber() {
        return subscriber;
    }

    public ViewerConfig config() {
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ViewerConfig config;
        private FrameRenderer renderer;
        private StreamObservabilitySink observabilitySink = new Slf4jStreamObservabilitySink();
        private ProcessorRegistry processorRegistry = ProcessorRegistry.withBuiltins();
        private FrameFeed frameFeed;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withConfig(ViewerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withRenderer(FrameRenderer renderer) {
            this.renderer = renderer;
            return this;
        }

        public Builder withObservabilitySink(StreamObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withProcessorRegistry(ProcessorRegistry registry) {
            this.processorRegistry = registry;
            return this;
        }

        /** Replace the Netty feed, e.g. with an in-process source. */
        public Builder withFrameFeed(FrameFeed feed) {
            this.frameFeed = feed;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public ViewerRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(renderer, "renderer");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(processorRegistry, "processorRegistry");

            // 1. Processors are validated before anything starts
            ProcessorChain chain = processorRegistry.buildChain(config.processors(), observabilitySink, wallClock);

            // 2. Producer side
            FrameFeed feed = frameFeed != null
                ? frameFeed
                : new NettyFrameFeed(config.feed().serverAddress(), config.feed().connectTimeout());
            FrameQueue queue = new FrameQueue();
            FrameDecoder decoder = new DefaultFrameDecoder();
            StreamSubscriber subscriber = new StreamSubscriber(
                config.feed().channelName(), feed, decoder, queue, wallClock, observabilitySink);

            // 3. Consumer side, confined to one thread
            ScheduledExecutorService displayExec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "pvstream-display");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(displayExec, clock);
            DisplayPump pump = new DisplayPump(queue, renderer, config.display(), clock, chain);
            DisplayLoop loop = new DisplayLoop(pump, scheduler, clock, wallClock, observabilitySink, config.tickInterval());

            return new ViewerRuntime(config, feed, queue, subscriber, pump, loop, displayExec);
        }
    }
}

package com.questrail.pvstream.transport.tcp.netty;

import com.questrail.pvstream.model.FrameFixtures;
import com.questrail.pvstream.ntnd.model.RawFrame;
import com.questrail.pvstream.transport.FeedConnectionException;
import com.questrail.pvstream.transport.FrameFeedListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyLoopbackIntegrationTest
 * -----------------------------------------------------------------------------
 * Real sockets on 127.0.0.1: server on an ephemeral port, feed connecting to
 * it. Timeouts are generous.
 */
final class NettyLoopbackIntegrationTest
{
    private static final String CHANNEL = "13SIM1:Pva1:Image";

    private NettyFrameStreamServer server;
    private NettyFrameFeed feed;
    private final Listener listener = new Listener();

    private static final class Listener implements FrameFeedListener
    {
        final BlockingQueue<RawFrame> frames = new LinkedBlockingQueue<>();
        final CountDownLatch up = new CountDownLatch(1);
        final CountDownLatch down = new CountDownLatch(1);

        @Override
        public void onFeedUp()
        {
            up.countDown();
        }

        @Override
        public void onFeedDown(Throwable cause)
        {
            down.countDown();
        }

        @Override
        public void onFrame(RawFrame frame)
        {
            frames.add(frame);
        }
    }

    @BeforeEach
    void setUp()
    {
        server = new NettyFrameStreamServer(new InetSocketAddress("127.0.0.1", 0));
        server.start();
        feed = new NettyFrameFeed(server.boundAddress(), Duration.ofSeconds(2));
        feed.setListener(listener);
    }

    @AfterEach
    void tearDown()
    {
        feed.close();
        server.stop();
    }

    private static void await(BooleanSupplier condition, String what) throws InterruptedException
    {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("timed out waiting for " + what);
            }
            Thread.sleep(10);
        }
    }

    @Test
    void subscribedFeedReceivesPublishedFrames() throws Exception
    {
        feed.subscribe(CHANNEL);
        assertTrue(listener.up.await(5, TimeUnit.SECONDS));
        await(() -> server.subscriberCount(CHANNEL) == 1, "subscription");

        assertEquals(1, server.publish(CHANNEL, FrameFixtures.rawMono16(1, 4, 4)));
        assertEquals(1, server.publish(CHANNEL, FrameFixtures.rawMono16(2, 4, 4)));

        RawFrame first = listener.frames.poll(5, TimeUnit.SECONDS);
        RawFrame second = listener.frames.poll(5, TimeUnit.SECONDS);
        assertNotNull(first);
        assertNotNull(second);
        assertEquals(1L, first.uniqueId());
        assertEquals(2L, second.uniqueId());
        assertEquals(16, second.value().length());
        assertEquals(15.0, second.value().getDouble(15));
        assertEquals(2, server.sentCount());
    }

    @Test
    void otherChannelsAreNotDelivered() throws Exception
    {
        feed.subscribe(CHANNEL);
        await(() -> server.subscriberCount(CHANNEL) == 1, "subscription");

        assertEquals(0, server.publish("OTHER:Image", FrameFixtures.rawMono16(9, 2, 2)));
        server.publish(CHANNEL, FrameFixtures.rawMono16(10, 2, 2));

        RawFrame received = listener.frames.poll(5, TimeUnit.SECONDS);
        assertNotNull(received);
        assertEquals(10L, received.uniqueId());
    }

    @Test
    void unsubscribeStopsDelivery() throws Exception
    {
        feed.subscribe(CHANNEL);
        await(() -> server.subscriberCount(CHANNEL) == 1, "subscription");

        feed.unsubscribe();
        await(() -> server.subscriberCount(CHANNEL) == 0, "unsubscription");

        assertEquals(0, server.publish(CHANNEL, FrameFixtures.rawMono16(1, 2, 2)));
    }

    @Test
    void serverShutdownIsReportedAsFeedDown() throws Exception
    {
        feed.subscribe(CHANNEL);
        assertTrue(listener.up.await(5, TimeUnit.SECONDS));

        server.stop();

        assertTrue(listener.down.await(5, TimeUnit.SECONDS));
    }

    @Test
    void connectionRefusedFailsSubscribe() throws Exception
    {
        int closedPort;
        try (ServerSocket spare = new ServerSocket(0)) {
            closedPort = spare.getLocalPort();
        }
        NettyFrameFeed unreachable = new NettyFrameFeed(
                new InetSocketAddress("127.0.0.1", closedPort), Duration.ofMillis(500));
        unreachable.setListener(listener);
        try {
            assertThrows(FeedConnectionException.class, () -> unreachable.subscribe(CHANNEL));
        }
        finally {
            unreachable.close();
        }
    }
}

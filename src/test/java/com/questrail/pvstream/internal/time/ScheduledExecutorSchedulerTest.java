package com.questrail.pvstream.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Real-time tests for the executor-backed scheduler the display loop and the
 * test-pattern streamer run on. Timeouts are generous.
 */
class ScheduledExecutorSchedulerTest {

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void tickRunsOnceDeadlineIsReached() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() + TimeUnit.MILLISECONDS.toNanos(20);

        scheduler.scheduleAtNanos(deadline, latch::countDown);

        assertTrue(latch.await(1, TimeUnit.SECONDS));
        assertTrue(SystemMonotonicClock.INSTANCE.nowNanos() >= deadline);
    }

    @Test
    void overdueDeadlineRunsWithoutDelay() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long overdue = SystemMonotonicClock.INSTANCE.nowNanos() - TimeUnit.SECONDS.toNanos(2);

        scheduler.scheduleAtNanos(overdue, latch::countDown);

        assertTrue(latch.await(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void cancelledTickNeverRuns() throws InterruptedException {
        AtomicBoolean ran = new AtomicBoolean(false);

        Cancellable handle = scheduler.scheduleAfter(Duration.ofMillis(80), SystemMonotonicClock.INSTANCE,
            () -> ran.set(true));

        assertTrue(handle.cancel());
        assertFalse(handle.cancel(), "second cancel reports nothing left to cancel");
        Thread.sleep(150);
        assertFalse(ran.get());
    }

    @Test
    void tasksRunInDeadlineOrder() throws InterruptedException {
        List<String> order = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(2);
        long now = SystemMonotonicClock.INSTANCE.nowNanos();

        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(40), () -> {
            order.add("late");
            latch.countDown();
        });
        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(10), () -> {
            order.add("early");
            latch.countDown();
        });

        assertTrue(latch.await(1, TimeUnit.SECONDS));
        assertEquals(List.of("early", "late"), order);
    }

    @Test
    void schedulingAfterShutdownIsDropped() throws InterruptedException {
        AtomicBoolean ran = new AtomicBoolean(false);
        executor.shutdown();

        Cancellable handle = assertDoesNotThrow(
            () -> scheduler.scheduleAtNanos(SystemMonotonicClock.INSTANCE.nowNanos(), () -> ran.set(true)));

        assertFalse(handle.cancel());
        assertTrue(executor.awaitTermination(1, TimeUnit.SECONDS));
        assertFalse(ran.get());
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> scheduler.scheduleAfter(Duration.ofMillis(-1), SystemMonotonicClock.INSTANCE, () -> {}));
    }
}

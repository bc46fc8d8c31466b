package com.questrail.pvstream.display;

import com.questrail.pvstream.api.FrameRenderer;
import com.questrail.pvstream.api.RecordingRenderer;
import com.questrail.pvstream.config.DisplaySettings;
import com.questrail.pvstream.internal.time.DeterministicScheduler;
import com.questrail.pvstream.internal.time.ManualMonotonicClock;
import com.questrail.pvstream.internal.time.ManualWallClock;
import com.questrail.pvstream.model.FrameFixtures;
import com.questrail.pvstream.model.QueuedFrame;
import com.questrail.pvstream.observability.RecordingObservabilitySink;
import com.questrail.pvstream.observability.StreamErrorEvent;
import com.questrail.pvstream.queue.FrameQueue;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class DisplayLoopTest {

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final FrameQueue queue = new FrameQueue();
    private final RecordingRenderer renderer = new RecordingRenderer();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final DisplayPump pump = new DisplayPump(queue, renderer,
        DisplaySettings.builder().withAutoContrast(false).build(), clock);
    private final DisplayLoop loop = new DisplayLoop(pump, scheduler, clock,
        new ManualWallClock(Instant.EPOCH), sink, Duration.ofMillis(5));

    private void publish(long uid) {
        queue.publish(new QueuedFrame(Instant.EPOCH, FrameFixtures.mono16(2, 2, uid, (r, c, ch) -> 1)));
    }

    @Test
    void firstTickRunsImmediatelyThenOnInterval() {
        loop.start();
        assertEquals(1, scheduler.runDueTasks());

        clock.advanceMillis(4);
        assertEquals(0, scheduler.runDueTasks());

        clock.advanceMillis(1);
        assertEquals(1, scheduler.runDueTasks());
        assertEquals(2, loop.tickCount());
    }

    @Test
    void ticksRenderWhatTheProducerPublished() {
        loop.start();
        publish(1);
        scheduler.runDueTasks();

        publish(2);
        publish(3);
        clock.advanceMillis(5);
        scheduler.runDueTasks();

        assertEquals(2, renderer.count());
        assertEquals(3L, renderer.last().frame().uniqueId());
    }

    @Test
    void lateTickDoesNotBurstToCatchUp() {
        loop.start();
        scheduler.runDueTasks();

        clock.advanceMillis(50);
        assertEquals(1, scheduler.runDueTasks(), "one overdue tick, not ten");
        assertEquals(1, scheduler.pendingCount());
    }

    @Test
    void renderFailureIsReportedAndLoopContinues() {
        renderer.failWith(new IllegalStateException("no surface"));
        loop.start();
        publish(1);

        scheduler.runDueTasks();

        StreamErrorEvent error = sink.eventsOfType(StreamErrorEvent.class).get(0);
        assertInstanceOf(IllegalStateException.class, error.cause());
        assertTrue(loop.isRunning());
        assertEquals(1, scheduler.pendingCount());
    }

    @Test
    void stopCancelsTheNextTick() {
        loop.start();
        scheduler.runDueTasks();

        loop.stop();
        clock.advanceMillis(100);

        assertEquals(0, scheduler.runDueTasks());
        assertFalse(loop.isRunning());
        assertEquals(1, loop.tickCount());
    }

    @Test
    void restartDuringATickLeavesOneChain() {
        AtomicReference<DisplayLoop> holder = new AtomicReference<>();
        FrameRenderer restarting = (frame, window) -> {
            holder.get().stop();
            holder.get().start();
        };
        DisplayPump restartPump = new DisplayPump(queue, restarting,
            DisplaySettings.builder().withAutoContrast(false).build(), clock);
        DisplayLoop restartLoop = new DisplayLoop(restartPump, scheduler, clock,
            new ManualWallClock(Instant.EPOCH), sink, Duration.ofMillis(5));
        holder.set(restartLoop);

        restartLoop.start();
        publish(1);
        assertEquals(2, scheduler.runDueTasks(), "old tick, then the restarted chain's first tick");
        assertEquals(1, scheduler.pendingCount());

        restartLoop.stop();
        clock.advanceMillis(100);

        assertEquals(0, scheduler.runDueTasks());
        assertEquals(2, restartLoop.tickCount());
    }

    @Test
    void zeroIntervalIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new DisplayLoop(pump, scheduler, clock,
            new ManualWallClock(Instant.EPOCH), sink, Duration.ZERO));
    }
}

package com.questrail.pvstream.processing.builtin;

import com.questrail.pvstream.api.ScalarType;
import com.questrail.pvstream.model.DecodedFrame;
import com.questrail.pvstream.model.FrameFixtures;
import com.questrail.pvstream.model.FrameMetadata;
import com.questrail.pvstream.processing.ProcessedFrame;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FrameAccumulatorTest {

    private static DecodedFrame frame(int value) {
        return FrameFixtures.mono16(2, 2, value, (r, c, ch) -> value);
    }

    @Test
    void sumsOnlyWhileRunning() {
        FrameAccumulator acc = new FrameAccumulator(true);

        acc.process(frame(1), FrameMetadata.empty());
        acc.start();
        acc.process(frame(2), FrameMetadata.empty());
        ProcessedFrame out = acc.process(frame(3), FrameMetadata.empty());
        acc.stop();
        acc.process(frame(4), FrameMetadata.empty());

        assertEquals(2, acc.count());
        assertEquals(ScalarType.FLOAT32, out.frame().dtype());
        assertEquals(5.0, out.frame().valueAt(0, 0, 0));
        assertEquals(2L, out.metadata().get(FrameAccumulator.SUMMED_FRAMES).orElseThrow());
        assertEquals(5.0, acc.snapshot().orElseThrow().valueAt(1, 1, 0));
    }

    @Test
    void withoutPreviewFramesPassThrough() {
        FrameAccumulator acc = new FrameAccumulator(false);
        acc.start();
        DecodedFrame f = frame(7);

        assertSame(f, acc.process(f, FrameMetadata.empty()).frame());
        assertEquals(ScalarType.FLOAT64, acc.snapshot().orElseThrow().dtype());
    }

    @Test
    void shapeChangeRestartsTheSum() {
        FrameAccumulator acc = new FrameAccumulator(true);
        acc.start();
        acc.process(frame(5), FrameMetadata.empty());

        ProcessedFrame out = acc.process(FrameFixtures.mono16(3, 1, 1, (r, c, ch) -> 2), FrameMetadata.empty());

        assertEquals(1, acc.count());
        assertEquals(3, out.frame().width());
        assertEquals(2.0, out.frame().valueAt(0, 2, 0));
    }

    @Test
    void resetClearsTheSum() {
        FrameAccumulator acc = new FrameAccumulator(true);
        acc.start();
        acc.process(frame(5), FrameMetadata.empty());

        acc.reset();

        assertEquals(0, acc.count());
        assertEquals(0.0, acc.snapshot().orElseThrow().valueAt(0, 0, 0));
    }

    @Test
    void nothingToSnapshotBeforeTheFirstFrame() {
        assertTrue(new FrameAccumulator(true).snapshot().isEmpty());
    }
}

package com.questrail.pvstream.model;

import com.questrail.pvstream.api.ColorMode;
import com.questrail.pvstream.ntnd.model.NdValue;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DecodedFrameTest {

    @Test
    void pixelCountMustMatchGeometry() {
        NdValue six = new NdValue.UInt8Values(new byte[6]);

        assertDoesNotThrow(() -> new DecodedFrame(3, 2, 1, ColorMode.MONO, six, 1, null));
        assertThrows(IllegalArgumentException.class, () -> new DecodedFrame(2, 2, 1, ColorMode.MONO, six, 1, null));
        assertThrows(IllegalArgumentException.class, () -> new DecodedFrame(0, 6, 1, ColorMode.MONO, six, 1, null));
    }

    @Test
    void threeChannelsNeedAnRgbMode() {
        NdValue twelve = new NdValue.UInt8Values(new byte[12]);

        assertDoesNotThrow(() -> new DecodedFrame(2, 2, 3, ColorMode.RGB2, twelve, 1, null));
        assertThrows(IllegalArgumentException.class, () -> new DecodedFrame(2, 2, 3, ColorMode.MONO, twelve, 1, null));
        assertThrows(IllegalArgumentException.class,
            () -> new DecodedFrame(2, 3, 2, ColorMode.RGB1, twelve, 1, null));
    }

    @Test
    void interleavedIndexing() {
        DecodedFrame f = FrameFixtures.rgb8(3, 2, 1, (r, c, ch) -> 100 * r + 10 * c + ch);

        assertEquals((1 * 3 + 2) * 3 + 1, f.index(1, 2, 1));
        assertEquals(121.0, f.valueAt(1, 2, 1));
        assertTrue(f.isColor());
        assertEquals(18, f.byteSize());
    }

    @Test
    void withPixelsKeepsIdentity() {
        Instant ts = Instant.parse("2024-02-02T00:00:00Z");
        DecodedFrame f = new DecodedFrame(2, 1, 1, ColorMode.MONO, new NdValue.UInt8Values(new byte[2]), 77, ts);

        DecodedFrame g = f.withPixels(new NdValue.Float32Values(new float[] {1f, 2f}));

        assertEquals(77L, g.uniqueId());
        assertEquals(ts, g.captureTimestamp());
        assertTrue(f.sameShape(g));
    }

    @Test
    void metadataCarriesUidAndTimestamp() {
        DecodedFrame f = FrameFixtures.mono16(1, 1, 9, (r, c, ch) -> 0);

        FrameMetadata m = FrameMetadata.of(f).with("note", "x");

        assertEquals(9L, m.get(FrameMetadata.UID).orElseThrow());
        assertEquals(FrameFixtures.T0, m.get(FrameMetadata.TIMESTAMP).orElseThrow());
        assertEquals("x", m.get("note").orElseThrow());
        assertTrue(FrameMetadata.empty().get("note").isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> m.asMap().put("y", 1));
        assertThrows(NullPointerException.class, () -> m.with("z", null));
    }
}

package com.questrail.pvstream.display;

import com.questrail.pvstream.model.DecodedFrame;
import com.questrail.pvstream.model.FrameFixtures;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ViewTransformsTest {

    /** value = 10*row + col */
    private static DecodedFrame grid(int width, int height) {
        return FrameFixtures.mono16(width, height, 1, (r, c, ch) -> 10 * r + c);
    }

    @Test
    void identityReturnsTheSameFrame() {
        DecodedFrame f = grid(3, 2);

        assertSame(f, ViewTransforms.apply(f, 1, false, false, false));
    }

    @Test
    void decimationKeepsEveryNthPixelRoundingUp() {
        DecodedFrame d = ViewTransforms.decimate(grid(5, 5), 2);

        assertEquals(3, d.width());
        assertEquals(3, d.height());
        assertEquals(0.0, d.valueAt(0, 0, 0));
        assertEquals(24.0, d.valueAt(1, 2, 0));
        assertEquals(44.0, d.valueAt(2, 2, 0));
    }

    @Test
    void transposeSwapsAxes() {
        DecodedFrame t = ViewTransforms.transpose(grid(3, 2));

        assertEquals(2, t.width());
        assertEquals(3, t.height());
        assertEquals(12.0, t.valueAt(2, 1, 0));
    }

    @Test
    void flipsMirrorTheRightAxis() {
        DecodedFrame f = grid(3, 2);

        assertEquals(2.0, ViewTransforms.flipHorizontal(f).valueAt(0, 0, 0));
        assertEquals(10.0, ViewTransforms.flipVertical(f).valueAt(0, 0, 0));
    }

    @Test
    void transformsComposeAsDecimateTransposeThenFlip() {
        DecodedFrame src = grid(4, 2);

        DecodedFrame combined = ViewTransforms.apply(src, 2, true, true, false);
        DecodedFrame stepwise = ViewTransforms.flipHorizontal(
            ViewTransforms.transpose(ViewTransforms.decimate(src, 2)));

        assertEquals(stepwise.width(), combined.width());
        assertEquals(stepwise.height(), combined.height());
        assertArrayEquals(stepwise.pixels().toDoubles(), combined.pixels().toDoubles(), 0.0);
    }

    @Test
    void flipAfterTransposeDiffersFromFlipBefore() {
        DecodedFrame src = grid(3, 2);

        DecodedFrame transposeFirst = ViewTransforms.flipHorizontal(ViewTransforms.transpose(src));
        DecodedFrame flipFirst = ViewTransforms.transpose(ViewTransforms.flipHorizontal(src));

        assertArrayEquals(new double[] {10, 0, 11, 1, 12, 2}, transposeFirst.pixels().toDoubles(), 0.0);
        assertArrayEquals(new double[] {2, 12, 1, 11, 0, 10}, flipFirst.pixels().toDoubles(), 0.0);
        assertArrayEquals(transposeFirst.pixels().toDoubles(),
            ViewTransforms.apply(src, 1, true, true, false).pixels().toDoubles(), 0.0);
    }

    @Test
    void verticalFlipAlsoRunsAfterTranspose() {
        DecodedFrame src = grid(3, 2);

        DecodedFrame transposeFirst = ViewTransforms.flipVertical(ViewTransforms.transpose(src));
        DecodedFrame flipFirst = ViewTransforms.transpose(ViewTransforms.flipVertical(src));

        assertArrayEquals(new double[] {2, 12, 1, 11, 0, 10}, transposeFirst.pixels().toDoubles(), 0.0);
        assertArrayEquals(new double[] {10, 0, 11, 1, 12, 2}, flipFirst.pixels().toDoubles(), 0.0);
        assertArrayEquals(transposeFirst.pixels().toDoubles(),
            ViewTransforms.apply(src, 1, true, false, true).pixels().toDoubles(), 0.0);
    }

    @Test
    void allThreeTransformsRunTransposeThenFlipHThenFlipV() {
        DecodedFrame src = grid(3, 2);

        DecodedFrame out = ViewTransforms.apply(src, 1, true, true, true);
        DecodedFrame stepwise = ViewTransforms.flipVertical(
            ViewTransforms.flipHorizontal(ViewTransforms.transpose(src)));

        assertEquals(2, out.width());
        assertEquals(3, out.height());
        assertArrayEquals(new double[] {12, 2, 11, 1, 10, 0}, out.pixels().toDoubles(), 0.0);
        assertArrayEquals(stepwise.pixels().toDoubles(), out.pixels().toDoubles(), 0.0);

        // Both flips together are a half turn, which commutes with transpose
        DecodedFrame flipsFirst = ViewTransforms.transpose(
            ViewTransforms.flipVertical(ViewTransforms.flipHorizontal(src)));
        assertArrayEquals(out.pixels().toDoubles(), flipsFirst.pixels().toDoubles(), 0.0);
    }

    @Test
    void colourPixelsMoveAsAWhole() {
        DecodedFrame rgb = FrameFixtures.rgb8(2, 1, 1, (r, c, ch) -> 10 * c + ch);

        DecodedFrame flipped = ViewTransforms.flipHorizontal(rgb);

        assertEquals(10.0, flipped.valueAt(0, 0, 0));
        assertEquals(12.0, flipped.valueAt(0, 0, 2));
        assertEquals(2.0, flipped.valueAt(0, 1, 2));
    }

    @Test
    void autoDecimationFitsTheViewport() {
        assertEquals(4, ViewTransforms.autoDecimation(2048, 2048, 512, 512));
        assertEquals(1, ViewTransforms.autoDecimation(1000, 1000, 600, 600));
        assertEquals(1, ViewTransforms.autoDecimation(100, 100, 512, 512));
        assertEquals(2, ViewTransforms.autoDecimation(1000, 4000, 400, 400));
    }

    @Test
    void decimationBelowOneIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ViewTransforms.decimate(grid(2, 2), 0));
    }
}

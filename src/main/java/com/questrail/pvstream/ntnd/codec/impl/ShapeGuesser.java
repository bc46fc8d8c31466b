package com.questrail.pvstream.ntnd.codec.impl;

import java.util.Optional;

/**
 * ShapeGuesser
 * -----------------------------------------------------------------------------
 * Heuristic {@code (height, width)} for a single-channel buffer whose declared
 * dimensions do not match its length.
 *
 * <p>Tried in order:</p>
 * <ol>
 *   <li>common camera resolutions (VGA, SVGA, XGA, HD, UXGA), landscape first</li>
 *   <li>a perfect square</li>
 *   <li>the factor pair closest to square, with {@code height <= width}</li>
 * </ol>
 *
 * <p>A pair with a side of 1 is not an image; lengths that only factor that
 * way (primes) yield empty. The guess is only ever a way to show something
 * instead of dropping the frame; it is not guaranteed to be right.</p>
 */
final class ShapeGuesser
{
    /** (height, width) pairs. */
    private static final int[][] COMMON_SHAPES = {
            {480, 640}, {640, 480},
            {600, 800}, {800, 600},
            {768, 1024}, {1024, 768},
            {1080, 1920}, {1920, 1080},
            {1200, 1600}, {1600, 1200},
    };

    private ShapeGuesser() {}

    /**
     * @param length number of elements in the buffer
     * @return {@code {height, width}} if a plausible shape exists
     */
    static Optional<int[]> guess(int length)
    {
        if (length < 4) {
            return Optional.empty();
        }

        for (int[] shape : COMMON_SHAPES) {
            if (shape[0] * shape[1] == length) {
                return Optional.of(shape.clone());
            }
        }

        final int side = (int) Math.sqrt(length);
        if (side * side == length) {
            return Optional.of(new int[] {side, side});
        }

        for (int h = side; h > 1; h--) {
            if (length % h == 0) {
                return Optional.of(new int[] {h, length / h});
            }
        }
        return Optional.empty();
    }
}

package com.questrail.pvstream.sim;

import com.questrail.pvstream.api.ColorMode;
import com.questrail.pvstream.model.DecodedFrame;
import com.questrail.pvstream.ntnd.model.NdValue;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Synthetic 16-bit detector images. Every pattern except {@link #RANDOM}
 * animates deterministically with the frame index.
 */
public enum TestPattern {

    /** Uniform noise over {@code [0, 65535)}. */
    RANDOM {
        @Override
        void fill(short[] px, int width, int height, long frame, Random random) {
            for (int i = 0; i < px.length; i++) {
                px[i] = (short) random.nextInt(65535);
            }
        }
    },

    /** {@code sin(x + t) * cos(y + t)} over four periods, scaled to the full range. */
    GRADIENT {
        @Override
        void fill(short[] px, int width, int height, long frame, Random random) {
            double offset = frame * 0.1;
            for (int r = 0; r < height; r++) {
                double y = linspace(r, height, 4 * Math.PI);
                double cy = Math.cos(y + offset);
                for (int c = 0; c < width; c++) {
                    double x = linspace(c, width, 4 * Math.PI);
                    double v = Math.sin(x + offset) * cy;
                    px[r * width + c] = (short) (int) ((v + 1) * 32767);
                }
            }
        }
    },

    /** Three discs orbiting the centre with pulsing radius and intensity. */
    CIRCLES {
        @Override
        void fill(short[] px, int width, int height, long frame, Random random) {
            for (int i = 0; i < 3; i++) {
                double angle = frame * 0.05 + i * 2 * Math.PI / 3;
                int cx = width / 2 + (int) (width * 0.3 * Math.cos(angle));
                int cy = height / 2 + (int) (height * 0.3 * Math.sin(angle));
                double radius = 100 + 50 * Math.sin(frame * 0.1 + i);
                short value = (short) (int) (20000 + 10000 * Math.sin(frame * 0.1 + i));
                for (int r = 0; r < height; r++) {
                    for (int c = 0; c < width; c++) {
                        double dx = c - cx;
                        double dy = r - cy;
                        if (Math.sqrt(dx * dx + dy * dy) < radius) {
                            px[r * width + c] = value;
                        }
                    }
                }
            }
        }
    },

    /** Two-level checkerboard whose square size breathes between 30 and 70. */
    CHECKERBOARD {
        @Override
        void fill(short[] px, int width, int height, long frame, Random random) {
            int square = 50 + (int) (20 * Math.sin(frame * 0.05));
            for (int r = 0; r < height; r++) {
                for (int c = 0; c < width; c++) {
                    boolean even = ((r / square) + (c / square)) % 2 == 0;
                    px[r * width + c] = (short) (even ? 40000 : 10000);
                }
            }
        }
    };

    abstract void fill(short[] px, int width, int height, long frame, Random random);

    /**
     * Render frame number {@code frame} as a MONO, 16-bit unsigned image.
     */
    public DecodedFrame render(int width, int height, long frame, Random random, Instant timestamp) {
        Objects.requireNonNull(random, "random");
        short[] px = new short[width * height];
        fill(px, width, height, frame, random);
        return new DecodedFrame(width, height, 1, ColorMode.MONO, new NdValue.UInt16Values(px), frame, timestamp);
    }

    public static Optional<TestPattern> fromName(String name) {
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static double linspace(int i, int n, double end) {
        return n <= 1 ? 0.0 : end * i / (n - 1);
    }
}

package com.questrail.pvstream.api;

import java.util.Optional;

/**
 * ColorMode
 * =============================================================================
 * areaDetector {@code ColorMode} attribute values.
 *
 * <p>The mode tells the decoder how the axes of a 3-D array are laid out on the
 * wire. Shapes below are numpy C-order shapes of the flat buffer, listed in
 * {@code dimension[]} order.</p>
 *
 * <ul>
 *   <li>{@link #MONO} single channel, {@code [NX, NY]}</li>
 *   <li>{@link #BAYER} raw colour-filter mosaic, single channel</li>
 *   <li>{@link #RGB1} planar-first {@code [3, NX, NY]}</li>
 *   <li>{@link #RGB2} planar-middle {@code [NX, 3, NY]}</li>
 *   <li>{@link #RGB3} interleaved {@code [NX, NY, 3]}</li>
 * </ul>
 */
public enum ColorMode {
    MONO(0),
    BAYER(1),
    RGB1(2),
    RGB2(3),
    RGB3(4);

    private final int code;

    ColorMode(int code) {
        this.code = code;
    }

    /** Wire value of the {@code ColorMode} attribute. */
    public int code() {
        return code;
    }

    /** True for the three RGB layouts. */
    public boolean isRgb() {
        return this == RGB1 || this == RGB2 || this == RGB3;
    }

    /**
     * Maps a wire value to a mode; unknown values (YUV modes, garbage) are empty.
     */
    public static Optional<ColorMode> fromCode(int code) {
        for (ColorMode mode : values()) {
            if (mode.code == code) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}

package com.questrail.pvstream.api;

/**
 * Size of the renderer's drawing area in device pixels, used for automatic
 * decimation.
 */
public record Viewport(int width, int height) {
    public Viewport {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("viewport must be at least 1x1, got " + width + "x" + height);
        }
    }
}

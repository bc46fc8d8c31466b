package com.questrail.pvstream.display;

import com.questrail.pvstream.api.ContrastWindow;
import com.questrail.pvstream.model.DecodedFrame;

/**
 * Mutable state of the display side.
 *
 * <p>Confined to the display thread: only {@link DisplayPump} writes it and
 * nothing here is synchronized. Read it from other threads only through the
 * runtime's display-thread hook.</p>
 */
public final class DisplayState {

    public static final double FPS_ALPHA = 0.2;
    static final double MIN_DT_SECONDS = 1e-6;

    DecodedFrame lastDisplayedFrame;
    DecodedFrame lastViewFrame;
    ContrastWindow contrastWindow;
    int lastDecimation = 1;
    double fpsEma = Double.NaN;
    long lastRenderNanos;
    boolean rendered;
    long consumedFrames;
    long autoContrastCounter;
    DecodedFrame flatReference;

    /** Last frame handed to the renderer, after every transform and hook. */
    public DecodedFrame lastDisplayedFrame() {
        return lastDisplayedFrame;
    }

    /** Last frame after view transforms, before flat-field and hooks. */
    public DecodedFrame lastViewFrame() {
        return lastViewFrame;
    }

    /** Active window, or {@code null} before the first one was estimated or set. */
    public ContrastWindow contrastWindow() {
        return contrastWindow;
    }

    public int lastDecimation() {
        return lastDecimation;
    }

    public long consumedFrames() {
        return consumedFrames;
    }

    public DecodedFrame flatReference() {
        return flatReference;
    }

    /** Smoothed render rate; NaN before the first render. */
    public double fpsEma() {
        return fpsEma;
    }

    void recordRender(long nowNanos, long referenceNanos) {
        double dt = Math.max(MIN_DT_SECONDS, (nowNanos - referenceNanos) / 1e9);
        double instant = 1.0 / dt;
        fpsEma = Double.isNaN(fpsEma) ? instant : (1.0 - FPS_ALPHA) * fpsEma + FPS_ALPHA * instant;
        lastRenderNanos = nowNanos;
        rendered = true;
    }
}

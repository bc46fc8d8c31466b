package com.questrail.pvstream.display;

import com.questrail.pvstream.api.ContrastWindow;
import com.questrail.pvstream.api.FrameRenderer;
import com.questrail.pvstream.api.Viewport;
import com.questrail.pvstream.config.DisplaySettings;
import com.questrail.pvstream.internal.time.MonotonicClock;
import com.questrail.pvstream.model.DecodedFrame;
import com.questrail.pvstream.model.FrameMetadata;
import com.questrail.pvstream.model.QueuedFrame;
import com.questrail.pvstream.processing.ProcessedFrame;
import com.questrail.pvstream.processing.ProcessorChain;
import com.questrail.pvstream.queue.FrameQueue;

import java.util.Objects;
import java.util.Optional;

/**
 * DisplayPump
 * =============================================================================
 * Consumer side of the frame path. One {@link #tick()} takes at most one frame
 * from the {@link FrameQueue} and renders it.
 *
 * <h2>Tick sequence</h2>
 * <ol>
 *   <li>Paused: return without touching the queue.</li>
 *   <li>Target FPS set and the last render was less than {@code 1/targetFps}
 *       ago: return without touching the queue.</li>
 *   <li>{@code tryTake}; nothing new: return.</li>
 *   <li>Grayscale requested and the frame is RGB: luminance.</li>
 *   <li>Decimation: fixed factor, or fit to the renderer's viewport.</li>
 *   <li>Transpose, horizontal flip, vertical flip.</li>
 *   <li>Flat-field, when enabled and the reference has the same shape.</li>
 *   <li>Post-processing hooks.</li>
 *   <li>Contrast window (auto every Nth frame, or the held manual window).</li>
 *   <li>Render, then update the FPS estimate.</li>
 * </ol>
 *
 * <h2>Threading</h2>
 * {@code tick()} and every setter except {@link #pause()}, {@link #resume()}
 * and {@link #togglePause()} must be called on the display thread. The run
 * state is volatile so a GUI thread may pause directly.
 *
 * <h2>Failures</h2>
 * Hook failures are absorbed by the {@link ProcessorChain}. A renderer
 * exception propagates out of {@code tick()}; the frame counts as consumed but
 * not rendered.
 */
public final class DisplayPump {

    private final FrameQueue queue;
    private final FrameRenderer renderer;
    private final MonotonicClock clock;
    private final ContrastEstimator contrastEstimator = new ContrastEstimator();
    private final DisplayState state = new DisplayState();
    private final long createdNanos;

    private volatile PumpState runState = PumpState.RUNNING;

    private ProcessorChain processors;
    private double targetFps;
    private int fixedDecimation;
    private boolean autoContrast;
    private int contrastInterval;
    private boolean flatFieldEnabled;
    private boolean grayscale;
    private boolean transpose;
    private boolean flipHorizontal;
    private boolean flipVertical;

    public DisplayPump(FrameQueue queue,
                       FrameRenderer renderer,
                       DisplaySettings settings,
                       MonotonicClock clock,
                       ProcessorChain processors) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.processors = Objects.requireNonNull(processors, "processors");
        Objects.requireNonNull(settings, "settings");

        this.targetFps = settings.targetFps();
        this.fixedDecimation = settings.fixedDecimation();
        this.autoContrast = settings.autoContrast();
        this.contrastInterval = settings.contrastInterval();
        this.flatFieldEnabled = settings.flatField();
        this.grayscale = settings.grayscale();
        this.transpose = settings.transpose();
        this.flipHorizontal = settings.flipHorizontal();
        this.flipVertical = settings.flipVertical();

        this.createdNanos = clock.nowNanos();
    }

    public DisplayPump(FrameQueue queue, FrameRenderer renderer, DisplaySettings settings, MonotonicClock clock) {
        this(queue, renderer, settings, clock, ProcessorChain.empty());
    }

    public TickOutcome tick() {
        if (runState == PumpState.PAUSED) {
            return TickOutcome.PAUSED;
        }

        final long now = clock.nowNanos();
        if (targetFps > 0 && state.rendered && (now - state.lastRenderNanos) < minRenderIntervalNanos()) {
            return TickOutcome.RATE_LIMITED;
        }

        final Optional<QueuedFrame> taken = queue.tryTake();
        if (taken.isEmpty()) {
            return TickOutcome.NO_FRAME;
        }
        state.consumedFrames++;

        DecodedFrame frame = taken.get().frame();

        if (grayscale && frame.isColor()) {
            frame = LuminanceConverter.toLuminance(frame);
        }

        final int decimation = decimationFor(frame);
        state.lastDecimation = decimation;
        frame = ViewTransforms.apply(frame, decimation, transpose, flipHorizontal, flipVertical);
        state.lastViewFrame = frame;

        if (flatFieldEnabled) {
            frame = FlatFieldCorrector.apply(frame, state.flatReference);
        }

        if (!processors.isEmpty()) {
            FrameMetadata metadata = FrameMetadata.of(frame)
                .with("receiveTimestamp", taken.get().receiveTimestamp());
            ProcessedFrame processed = processors.apply(frame, metadata);
            frame = processed.frame();
        }

        final ContrastWindow window = contrastFor(frame);

        renderer.render(frame, window);

        state.lastDisplayedFrame = frame;
        state.recordRender(now, state.rendered ? state.lastRenderNanos : createdNanos);
        return TickOutcome.RENDERED;
    }

    private long minRenderIntervalNanos() {
        return (long) (1e9 / targetFps);
    }

    private int decimationFor(DecodedFrame frame) {
        if (fixedDecimation > 0) {
            return fixedDecimation;
        }
        Optional<Viewport> viewport = renderer.viewport();
        if (viewport.isEmpty()) {
            return 1;
        }
        return ViewTransforms.autoDecimation(frame.height(), frame.width(),
            viewport.get().height(), viewport.get().width());
    }

    private ContrastWindow contrastFor(DecodedFrame frame) {
        if (autoContrast) {
            if (state.contrastWindow == null || state.autoContrastCounter % contrastInterval == 0) {
                ContrastWindow estimate = contrastEstimator.estimate(frame);
                if (estimate.isUsable()) {
                    state.contrastWindow = estimate;
                }
            }
            state.autoContrastCounter++;
        }
        return state.contrastWindow != null ? state.contrastWindow : ContrastWindow.UNIT;
    }

    // -------------------------------------------------------------------------
    // Run state (any thread)
    // -------------------------------------------------------------------------

    public void pause() {
        runState = PumpState.PAUSED;
    }

    public void resume() {
        runState = PumpState.RUNNING;
    }

    public PumpState togglePause() {
        PumpState next = runState == PumpState.PAUSED ? PumpState.RUNNING : PumpState.PAUSED;
        runState = next;
        return next;
    }

    public PumpState runState() {
        return runState;
    }

    // -------------------------------------------------------------------------
    // View options (display thread)
    // -------------------------------------------------------------------------

    public void setTargetFps(double targetFps) {
        if (!(targetFps >= 0) || Double.isInfinite(targetFps)) {
            throw new IllegalArgumentException("targetFps must be finite and >= 0, got " + targetFps);
        }
        this.targetFps = targetFps;
    }

    public void setFixedDecimation(int fixedDecimation) {
        if (fixedDecimation < 0) {
            throw new IllegalArgumentException("fixedDecimation must be >= 0, got " + fixedDecimation);
        }
        this.fixedDecimation = fixedDecimation;
    }

    /** Turning auto-contrast on recomputes the window on the next frame. */
    public void setAutoContrast(boolean autoContrast) {
        if (autoContrast && !this.autoContrast) {
            state.autoContrastCounter = 0;
        }
        this.autoContrast = autoContrast;
    }

    public void setContrastInterval(int contrastInterval) {
        if (contrastInterval < 1) {
            throw new IllegalArgumentException("contrastInterval must be >= 1, got " + contrastInterval);
        }
        this.contrastInterval = contrastInterval;
    }

    /** Hold an explicit window. Turns auto-contrast off. */
    public void setContrastWindow(ContrastWindow window) {
        state.contrastWindow = Objects.requireNonNull(window, "window");
        this.autoContrast = false;
    }

    public void setGrayscale(boolean grayscale) {
        this.grayscale = grayscale;
    }

    public void setTranspose(boolean transpose) {
        this.transpose = transpose;
    }

    public void setFlipHorizontal(boolean flipHorizontal) {
        this.flipHorizontal = flipHorizontal;
    }

    public void setFlipVertical(boolean flipVertical) {
        this.flipVertical = flipVertical;
    }

    public void setFlatFieldEnabled(boolean enabled) {
        this.flatFieldEnabled = enabled;
    }

    public void setProcessorChain(ProcessorChain processors) {
        this.processors = Objects.requireNonNull(processors, "processors");
    }

    // -------------------------------------------------------------------------
    // Flat reference (display thread)
    // -------------------------------------------------------------------------

    /**
     * Use the last frame seen after view transforms as the flat reference.
     *
     * @return false if no frame has been displayed yet
     */
    public boolean captureFlatFromLastFrame() {
        if (state.lastViewFrame == null) {
            return false;
        }
        state.flatReference = state.lastViewFrame;
        return true;
    }

    public void setFlatReference(DecodedFrame flat) {
        state.flatReference = Objects.requireNonNull(flat, "flat");
    }

    public void clearFlat() {
        state.flatReference = null;
    }

    // -------------------------------------------------------------------------
    // Readouts
    // -------------------------------------------------------------------------

    /**
     * Smoothed render rate, capped by {@code 1 / secondsSinceLastRender} so a
     * stalled feed shows as a falling rate. 0 before the first render.
     */
    public double fps() {
        if (!state.rendered) {
            return 0.0;
        }
        double sinceLast = Math.max(DisplayState.MIN_DT_SECONDS,
            (clock.nowNanos() - state.lastRenderNanos) / 1e9);
        return Math.min(state.fpsEma, 1.0 / sinceLast);
    }

    public DisplayState state() {
        return state;
    }

    public boolean isAutoContrast() {
        return autoContrast;
    }

    public boolean isGrayscale() {
        return grayscale;
    }

    public boolean isFlatFieldEnabled() {
        return flatFieldEnabled;
    }
}

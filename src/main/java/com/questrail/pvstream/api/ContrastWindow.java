package com.questrail.pvstream.api;

/**
 * Display intensity bounds mapped to the renderer's visible range.
 *
 * <p>A window may be degenerate ({@code high <= low}, e.g. a flat frame) or
 * non-finite. Renderers must use {@link #normalize(double)}, which never divides
 * by zero, or check {@link #isUsable()} themselves.</p>
 *
 * @param low  lower display bound
 * @param high upper display bound
 */
public record ContrastWindow(double low, double high) {

    /** Window used before any contrast has been estimated or set. */
    public static final ContrastWindow UNIT = new ContrastWindow(0.0, 1.0);

    /**
     * True when both bounds are finite and {@code high > low}.
     */
    public boolean isUsable() {
        return Double.isFinite(low) && Double.isFinite(high) && high > low;
    }

    public double width() {
        return high - low;
    }

    /**
     * Maps a pixel value to [0, 1]. A degenerate window maps values at or
     * above {@code low} to 1 and values below it to 0.
     */
    public double normalize(double value) {
        if (!isUsable()) {
            return value >= low ? 1.0 : 0.0;
        }
        double t = (value - low) / (high - low);
        return Math.max(0.0, Math.min(1.0, t));
    }
}

package com.questrail.pvstream.config;

/**
 * Initial view settings for the display pump. All of them can be changed at
 * runtime through the pump's setters.
 *
 * @param targetFps        render rate cap; 0 means unthrottled
 * @param fixedDecimation  spatial stride; 0 means automatic (fit the viewport)
 * @param autoContrast     recompute the contrast window periodically
 * @param contrastInterval recompute on every Nth consumed frame
 * @param flatField        apply the flat reference when one is set
 * @param grayscale        convert RGB frames to luminance before display
 */
public record DisplaySettings(
    double targetFps,
    int fixedDecimation,
    boolean autoContrast,
    int contrastInterval,
    boolean flatField,
    boolean grayscale,
    boolean transpose,
    boolean flipHorizontal,
    boolean flipVertical
) {
    public DisplaySettings {
        if (!(targetFps >= 0) || Double.isInfinite(targetFps)) {
            throw new IllegalArgumentException("targetFps must be finite and >= 0, got " + targetFps);
        }
        if (fixedDecimation < 0) {
            throw new IllegalArgumentException("fixedDecimation must be >= 0, got " + fixedDecimation);
        }
        if (contrastInterval < 1) {
            throw new IllegalArgumentException("contrastInterval must be >= 1, got " + contrastInterval);
        }
    }

    public static DisplaySettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private double targetFps = 0.0;
        private int fixedDecimation = 0;
        private boolean autoContrast = true;
        private int contrastInterval = 10;
        private boolean flatField = false;
        private boolean grayscale = true;
        private boolean transpose = false;
        private boolean flipHorizontal = false;
        private boolean flipVertical = false;

        public Builder withTargetFps(double targetFps) {
            this.targetFps = targetFps;
            return this;
        }

        public Builder withFixedDecimation(int fixedDecimation) {
            this.fixedDecimation = fixedDecimation;
            return this;
        }

        public Builder withAutoContrast(boolean autoContrast) {
            this.autoContrast = autoContrast;
            return this;
        }

        public Builder withContrastInterval(int contrastInterval) {
            this.contrastInterval = contrastInterval;
            return this;
        }

        public Builder withFlatField(boolean flatField) {
            this.flatField = flatField;
            return this;
        }

        public Builder withGrayscale(boolean grayscale) {
            this.grayscale = grayscale;
            return this;
        }

        public Builder withTranspose(boolean transpose) {
            this.transpose = transpose;
            return this;
        }

        public Builder withFlipHorizontal(boolean flipHorizontal) {
            this.flipHorizontal = flipHorizontal;
            return this;
        }

        public Builder withFlipVertical(boolean flipVertical) {
            this.flipVertical = flipVertical;
            return this;
        }

        public DisplaySettings build() {
            return new DisplaySettings(targetFps, fixedDecimation, autoContrast, contrastInterval,
                flatField, grayscale, transpose, flipHorizontal, flipVertical);
        }
    }
}

package com.trading.hedge.progress;

/**
 * Smoothing parameters of the progress tracker.
 *
 * @param windowFraction share of the total cost retained in the rate window;
 *                       the window holds {@code max(1, windowFraction * totalCost)} samples.
 * @param fallbackRate   units per second assumed until two samples span a
 *                       non-zero interval.
 */
public record ProgressSettings(double windowFraction, double fallbackRate) {
    public static final double DEFAULT_WINDOW_FRACTION = 0.5;
    public static final double DEFAULT_FALLBACK_RATE = 0.001;

    public ProgressSettings {
        if (!(windowFraction > 0) || windowFraction > 1) {
            throw new IllegalArgumentException("windowFraction must be in (0, 1]: " + windowFraction);
        }
        if (!(fallbackRate > 0) || Double.isInfinite(fallbackRate)) {
            throw new IllegalArgumentException("fallbackRate must be positive and finite: " + fallbackRate);
        }
    }

    public static ProgressSettings defaults() {
        return new ProgressSettings(DEFAULT_WINDOW_FRACTION, DEFAULT_FALLBACK_RATE);
    }

    /** Window capacity for a run of {@code totalCost} units. */
    public int windowCapacity(long totalCost) {
        double size = Math.floor(windowFraction * totalCost);
        if (size < 1) {
            return 1;
        }
        return size >= Integer.MAX_VALUE ? Integer.MAX_VALUE - 8 : (int) size;
    }
}
